/**
 * Bounded request history and the sliding-window burst detector built on it.
 */
package io.admission.burst;
