package io.admission.dispatch;

import io.admission.AdmissionRequest;
import io.admission.ExecutionResult;
import io.admission.RequestExecutor;
import io.admission.cache.CacheEntry;
import io.admission.cache.CacheKeyFunction;
import io.admission.cache.QueryCacheKeys;
import io.admission.cache.ResultCache;
import io.admission.spi.MetricsExporter;
import io.admission.stats.OperationStatsRecorder;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Lock;

/**
 * Resolves a request through the {@link ResultCache} before falling back to the
 * {@link RequestExecutor}.
 *
 * <p>Cache and operation stats are touched only while holding the shared state lock.
 * The executor itself runs unlocked. Each execution carries a {@code settled} flag that is
 * claimed exactly once: either by the execution committing its outcome, or by the worker
 * giving up on it after a timeout. A result that loses the claim is neither cached nor
 * counted.
 */
final class CacheAwareExecutor {
  private final RequestExecutor executor;
  private final ResultCache cache;
  private final OperationStatsRecorder operationStats;
  private final CacheKeyFunction cacheKeyFunction;
  private final Duration defaultTtl;
  private final Clock clock;
  private final Lock lock;
  private final MetricsExporter metrics;

  CacheAwareExecutor(RequestExecutor executor, ResultCache cache,
      OperationStatsRecorder operationStats, CacheKeyFunction cacheKeyFunction,
      Duration defaultTtl, Clock clock, Lock lock, MetricsExporter metrics) {
    this.executor = Objects.requireNonNull(executor, "executor");
    this.cache = Objects.requireNonNull(cache, "cache");
    this.operationStats = Objects.requireNonNull(operationStats, "operationStats");
    this.cacheKeyFunction = Objects.requireNonNull(cacheKeyFunction, "cacheKeyFunction");
    this.defaultTtl = Objects.requireNonNull(defaultTtl, "defaultTtl");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.lock = Objects.requireNonNull(lock, "lock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Executes a request, serving cacheable requests from the cache when fresh.
   *
   * @param request   the request
   * @param settled   claimed by whichever side settles the execution first
   * @return the result tagged with its origin
   * @throws Exception whatever the executor throws
   */
  ExecutionResult execute(AdmissionRequest request, AtomicBoolean settled) throws Exception {
    if (!request.isCacheable()) {
      return new ExecutionResult(executor.execute(request), false);
    }

    long startNanos = System.nanoTime();
    String key = QueryCacheKeys.resolve(request, cacheKeyFunction);
    Duration ttl = request.ttl() != null ? request.ttl() : defaultTtl;

    Optional<CacheEntry> cached;
    lock.lock();
    try {
      cached = cache.lookup(key, ttl, clock.millis());
      if (cached.isPresent()) {
        operationStats.recordCacheHit(key, elapsedMs(startNanos));
      }
    } finally {
      lock.unlock();
    }
    if (cached.isPresent()) {
      metrics.incrementCacheHit();
      return new ExecutionResult(cached.get().value(), true);
    }
    metrics.incrementCacheMiss();

    Object value;
    try {
      value = executor.execute(request);
    } catch (Exception e) {
      recordFailureIfLive(settled, request.operation(), startNanos);
      throw e;
    }

    lock.lock();
    try {
      if (settled.compareAndSet(false, true)) {
        cache.put(key, value, clock.millis());
        operationStats.record(request.operation(), elapsedMs(startNanos), true);
      }
    } finally {
      lock.unlock();
    }
    return new ExecutionResult(value, false);
  }

  private void recordFailureIfLive(AtomicBoolean settled, String operation, long startNanos) {
    lock.lock();
    try {
      if (settled.compareAndSet(false, true)) {
        operationStats.record(operation, elapsedMs(startNanos), false);
      }
    } finally {
      lock.unlock();
    }
  }

  private static double elapsedMs(long startNanos) {
    return (System.nanoTime() - startNanos) / 1_000_000.0;
  }
}
