package io.admission.breaker;

/**
 * Point-in-time view of a {@link CircuitBreaker}.
 *
 * @param isOpen          whether dispatch is halted
 * @param failureCount    failures since the last reset
 * @param successCount    successes since the last reset
 * @param lastFailureTime epoch milliseconds of the last counted failure, or {@code -1}
 * @param openedAt        epoch milliseconds of the last trip, or {@code -1}
 */
public record BreakerState(boolean isOpen, int failureCount, int successCount,
    long lastFailureTime, long openedAt) {
}
