/**
 * Root API for in-process admission control: priority lanes, a concurrency ceiling, a
 * circuit breaker, burst detection and a TTL result cache in front of an injected
 * {@link io.admission.RequestExecutor}.
 *
 * <h2>Core Design</h2>
 * <p>{@link io.admission.Admission#enqueue} admits a request into one of four FIFO lanes
 * and returns a ticket id immediately. A single dispatcher thread drains the lanes in
 * strict order ({@code CRITICAL > HIGH > NORMAL > LOW}) and hands tickets to at most
 * {@code maxConcurrentRequests} workers. Each worker serves cacheable requests from the
 * result cache when fresh, otherwise calls the executor and races it against
 * {@code requestTimeout}. Outcomes are reported through
 * {@link io.admission.AdmissionListener} and reflected in
 * {@link io.admission.Admission#getStats()}.
 *
 * <p>Consecutive failures trip the circuit breaker, which halts dispatch (not admission)
 * until the cooldown after the last failure has elapsed.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>admission-core</b>: API, dispatcher, breaker, cache, burst detection (ULID ids only)</li>
 *   <li><b>admission-micrometer</b>: {@code MetricsExporter} backed by Micrometer</li>
 *   <li><b>admission-spring-boot-starter</b>: auto-configuration bound to {@code admission.*}</li>
 * </ul>
 *
 * @see io.admission.Admission
 * @see io.admission.AdmissionRequest
 * @see io.admission.AdmissionListener
 */
package io.admission;
