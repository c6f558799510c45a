package io.admission.spi;

import io.admission.Priority;

/**
 * Observability hook for exporting admission counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer, Prometheus, or other monitoring systems. Calls are made
 * outside the dispatcher's state lock and may come from any thread.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of tickets admitted into a lane.
     *
     * @param priority the lane
     */
    void incrementAdmitted(Priority priority);

    /**
     * Increments the count of tickets that completed successfully.
     */
    void incrementCompleted();

    /**
     * Increments the count of tickets whose executor threw.
     */
    void incrementFailed();

    /**
     * Increments the count of tickets that exceeded the request timeout.
     */
    void incrementTimedOut();

    /**
     * Increments the count of circuit breaker trips.
     */
    void incrementBreakerTrips();

    /**
     * Increments the count of burst detections.
     */
    default void incrementBurstDetections() {
    }

    /**
     * Increments the count of fresh result cache hits.
     */
    default void incrementCacheHit() {
    }

    /**
     * Increments the count of result cache misses, stale entries included.
     */
    default void incrementCacheMiss() {
    }

    /**
     * Records the current depth of one lane.
     *
     * @param priority the lane
     * @param depth    queued tickets
     */
    void recordLaneDepth(Priority priority, int depth);

    /**
     * Records the number of tickets currently executing.
     *
     * @param inFlight dispatched, unfinished tickets
     */
    void recordInFlight(int inFlight);

    /**
     * Records admission-to-outcome time of a finished ticket.
     *
     * @param responseTimeMs response time in milliseconds (always non-negative)
     */
    default void recordResponseTimeMs(long responseTimeMs) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementAdmitted(Priority priority) {
        }

        @Override
        public void incrementCompleted() {
        }

        @Override
        public void incrementFailed() {
        }

        @Override
        public void incrementTimedOut() {
        }

        @Override
        public void incrementBreakerTrips() {
        }

        @Override
        public void recordLaneDepth(Priority priority, int depth) {
        }

        @Override
        public void recordInFlight(int inFlight) {
        }
    }
}
