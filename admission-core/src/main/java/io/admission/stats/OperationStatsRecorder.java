package io.admission.stats;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Accumulates {@link OperationStats} per operation name. Cache hits are recorded under
 * {@code cached_<key>} so that they do not dilute the timings of real executions.
 *
 * <p>Not thread-safe. The owning dispatcher guards every call with its state lock.
 */
public final class OperationStatsRecorder {
  public static final String CACHED_PREFIX = "cached_";

  private final Map<String, Accumulator> byOperation = new LinkedHashMap<>();

  public void record(String operation, double elapsedMs, boolean success) {
    byOperation.computeIfAbsent(operation, ignored -> new Accumulator()).add(elapsedMs, success);
  }

  public void recordCacheHit(String cacheKey, double elapsedMs) {
    record(CACHED_PREFIX + cacheKey, elapsedMs, true);
  }

  public Map<String, OperationStats> snapshot() {
    Map<String, OperationStats> result = new LinkedHashMap<>();
    byOperation.forEach((name, acc) -> result.put(name, acc.toStats()));
    return Collections.unmodifiableMap(result);
  }

  private static final class Accumulator {
    private long count;
    private double totalTime;
    private double minTime = Double.POSITIVE_INFINITY;
    private double maxTime;
    private long successCount;
    private long failureCount;

    void add(double elapsedMs, boolean success) {
      count++;
      totalTime += elapsedMs;
      minTime = Math.min(minTime, elapsedMs);
      maxTime = Math.max(maxTime, elapsedMs);
      if (success) {
        successCount++;
      } else {
        failureCount++;
      }
    }

    OperationStats toStats() {
      return new OperationStats(count, totalTime, count == 0 ? 0.0 : totalTime / count,
          minTime, maxTime, successCount, failureCount);
    }
  }
}
