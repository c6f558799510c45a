package io.admission.stats;

/**
 * Timing statistics for one operation name.
 *
 * @param count        executions recorded
 * @param totalTime    summed execution time in milliseconds
 * @param averageTime  {@code totalTime / count}
 * @param minTime      fastest execution in milliseconds
 * @param maxTime      slowest execution in milliseconds
 * @param successCount successful executions
 * @param failureCount failed executions
 */
public record OperationStats(long count, double totalTime, double averageTime,
    double minTime, double maxTime, long successCount, long failureCount) {
}
