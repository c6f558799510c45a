package io.admission.stats;

import io.admission.Priority;
import io.admission.breaker.BreakerState;

import java.util.Map;

/**
 * Immutable snapshot returned by {@link io.admission.Admission#getStats()}.
 *
 * @param totalRequests       tickets admitted
 * @param activeRequests      tickets admitted and not yet finished (queued or running)
 * @param inFlightRequests    tickets dispatched and not yet finished
 * @param completedRequests   successful outcomes
 * @param failedRequests      failed or timed-out outcomes
 * @param averageResponseTime mean milliseconds from admission to successful outcome
 * @param circuitBreakerTrips CLOSED to OPEN transitions
 * @param burstDetections     burst checks that reached the threshold
 * @param lastBurstTime       epoch milliseconds of the last burst, or {@code -1}
 * @param circuitBreaker      breaker state
 * @param queueSizes          queued tickets per lane
 * @param totalQueueSize      queued tickets across all lanes
 * @param cache               result cache contents
 * @param queryStats          per-operation timings
 */
public record AdmissionStats(
    long totalRequests,
    long activeRequests,
    int inFlightRequests,
    long completedRequests,
    long failedRequests,
    double averageResponseTime,
    long circuitBreakerTrips,
    long burstDetections,
    long lastBurstTime,
    BreakerState circuitBreaker,
    Map<Priority, Integer> queueSizes,
    int totalQueueSize,
    CacheStats cache,
    Map<String, OperationStats> queryStats) {

  public AdmissionStats {
    queueSizes = Map.copyOf(queueSizes);
    queryStats = Map.copyOf(queryStats);
  }
}
