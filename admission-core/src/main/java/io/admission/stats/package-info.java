/**
 * Request counters, per-operation timings and the immutable snapshots exposed to callers.
 *
 * @see io.admission.stats.AdmissionStats
 */
package io.admission.stats;
