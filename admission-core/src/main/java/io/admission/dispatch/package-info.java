/**
 * Priority-lane dispatcher with a concurrency ceiling and circuit-breaker gating.
 *
 * <p>{@link io.admission.dispatch.AdmissionDispatcher} selects tickets in strict priority
 * order, runs them on a bounded worker pool through the result cache and records each
 * outcome against the breaker, history and stats.
 *
 * @see io.admission.dispatch.AdmissionDispatcher
 * @see io.admission.dispatch.PriorityLanes
 */
package io.admission.dispatch;
