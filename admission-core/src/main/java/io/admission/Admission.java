package io.admission;

import io.admission.cache.CacheKeyFunction;
import io.admission.dispatch.AdmissionDispatcher;
import io.admission.spi.MetricsExporter;
import io.admission.stats.AdmissionStats;
import io.admission.stats.CacheStats;
import io.admission.stats.OperationStats;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Composite entry point that wraps an {@link AdmissionDispatcher} and its metrics exporter
 * into a single {@link AutoCloseable} unit.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (Admission admission = Admission.builder()
 *     .executor(request -> jdbcTemplate.queryForList(request.operation(), request.params().toArray()))
 *     .maxConcurrentRequests(20)
 *     .circuitBreakerThreshold(5)
 *     .build()) {
 *   admission.enqueue(AdmissionRequest.query("SELECT * FROM kelas").build(), Priority.HIGH);
 * }
 * }</pre>
 *
 * @see AdmissionDispatcher
 * @see AdmissionListener
 */
public final class Admission implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(Admission.class.getName());

  private final AdmissionDispatcher dispatcher;
  private final MetricsExporter metrics;

  private Admission(AdmissionDispatcher dispatcher, MetricsExporter metrics) {
    this.dispatcher = dispatcher;
    this.metrics = metrics;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Admits a request into the lane for {@code priority}.
   *
   * @param request  the request
   * @param priority the lane
   * @return the ticket id
   * @throws IllegalStateException if this instance has been closed
   */
  public String enqueue(AdmissionRequest request, Priority priority) {
    return dispatcher.enqueue(request, priority);
  }

  /**
   * Admits a request by priority name. Unrecognized or {@code null} names fall back to
   * {@link Priority#NORMAL}.
   *
   * @param request      the request
   * @param priorityName case-insensitive priority name
   * @return the ticket id
   */
  public String enqueue(AdmissionRequest request, String priorityName) {
    Priority priority = Priority.fromName(priorityName);
    if (priority == null) {
      logger.log(Level.WARNING, "Unknown priority ''{0}'', using NORMAL", priorityName);
      priority = Priority.NORMAL;
    }
    return dispatcher.enqueue(request, priority);
  }

  /**
   * Admits a request into the {@link Priority#NORMAL} lane.
   */
  public String enqueue(AdmissionRequest request) {
    return dispatcher.enqueue(request, Priority.NORMAL);
  }

  public AdmissionStats getStats() {
    return dispatcher.getStats();
  }

  public CacheStats getCacheStats() {
    return dispatcher.getCacheStats();
  }

  public Map<String, OperationStats> getQueryStats() {
    return dispatcher.getQueryStats();
  }

  public void clearCache() {
    dispatcher.clearCache();
  }

  public void enable() {
    dispatcher.enable();
  }

  public void disable() {
    dispatcher.disable();
  }

  public void setEnabled(boolean enabled) {
    dispatcher.setEnabled(enabled);
  }

  public void stop() {
    dispatcher.stop();
  }

  public boolean isEnabled() {
    return dispatcher.isEnabled();
  }

  /**
   * Returns the underlying dispatcher for advanced use (e.g. history inspection).
   */
  public AdmissionDispatcher dispatcher() {
    return dispatcher;
  }

  /**
   * Closes the dispatcher, then the metrics exporter if it is {@link AutoCloseable}.
   */
  @Override
  public void close() {
    RuntimeException first = null;
    try {
      dispatcher.close();
    } catch (RuntimeException e) {
      first = e;
    }
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
        if (first == null) first = re; else first.addSuppressed(re);
      }
    }
    if (first != null) {
      throw first;
    }
  }

  /**
   * Builder for {@link Admission}. Every setting is forwarded to
   * {@link AdmissionDispatcher.Builder}; see there for defaults.
   */
  public static final class Builder {
    private final AdmissionDispatcher.Builder dispatcher = AdmissionDispatcher.builder();
    private MetricsExporter metrics;
    private final AtomicBoolean built = new AtomicBoolean(false);

    private Builder() {}

    public Builder executor(RequestExecutor executor) {
      dispatcher.executor(executor);
      return this;
    }

    public Builder cacheKeyFunction(CacheKeyFunction cacheKeyFunction) {
      dispatcher.cacheKeyFunction(cacheKeyFunction);
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      dispatcher.metrics(metrics);
      return this;
    }

    public Builder clock(Clock clock) {
      dispatcher.clock(clock);
      return this;
    }

    public Builder listener(AdmissionListener listener) {
      dispatcher.listener(listener);
      return this;
    }

    public Builder listeners(List<AdmissionListener> listeners) {
      dispatcher.listeners(listeners);
      return this;
    }

    public Builder maxConcurrentRequests(int maxConcurrentRequests) {
      dispatcher.maxConcurrentRequests(maxConcurrentRequests);
      return this;
    }

    public Builder burstThreshold(int burstThreshold) {
      dispatcher.burstThreshold(burstThreshold);
      return this;
    }

    public Builder burstWindow(Duration burstWindow) {
      dispatcher.burstWindow(burstWindow);
      return this;
    }

    public Builder circuitBreakerThreshold(int circuitBreakerThreshold) {
      dispatcher.circuitBreakerThreshold(circuitBreakerThreshold);
      return this;
    }

    public Builder circuitBreakerTimeout(Duration circuitBreakerTimeout) {
      dispatcher.circuitBreakerTimeout(circuitBreakerTimeout);
      return this;
    }

    public Builder requestTimeout(Duration requestTimeout) {
      dispatcher.requestTimeout(requestTimeout);
      return this;
    }

    public Builder defaultCacheTtl(Duration defaultCacheTtl) {
      dispatcher.defaultCacheTtl(defaultCacheTtl);
      return this;
    }

    public Builder cacheMaxEntries(int cacheMaxEntries) {
      dispatcher.cacheMaxEntries(cacheMaxEntries);
      return this;
    }

    public Builder historyCapacity(int historyCapacity) {
      dispatcher.historyCapacity(historyCapacity);
      return this;
    }

    public Builder drainTimeout(Duration drainTimeout) {
      dispatcher.drainTimeout(drainTimeout);
      return this;
    }

    public Builder autoStart(boolean autoStart) {
      dispatcher.autoStart(autoStart);
      return this;
    }

    /**
     * Builds the composite. A builder can only be used once.
     *
     * @return a new {@link Admission}
     * @throws IllegalStateException if build() was already called
     */
    public Admission build() {
      if (!built.compareAndSet(false, true)) {
        throw new IllegalStateException("build() already called on this builder");
      }
      return new Admission(dispatcher.build(), Objects.requireNonNullElse(metrics, MetricsExporter.NOOP));
    }
  }
}
