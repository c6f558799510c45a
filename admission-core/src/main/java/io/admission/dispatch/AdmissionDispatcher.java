package io.admission.dispatch;

import com.github.f4b6a3.ulid.UlidCreator;
import io.admission.AdmissionException;
import io.admission.AdmissionListener;
import io.admission.AdmissionRequest;
import io.admission.ExecutionFailedException;
import io.admission.ExecutionResult;
import io.admission.Priority;
import io.admission.RequestExecutor;
import io.admission.RequestTimeoutException;
import io.admission.Ticket;
import io.admission.breaker.CircuitBreaker;
import io.admission.burst.BurstDetector;
import io.admission.burst.HistoryEntry;
import io.admission.burst.RequestHistory;
import io.admission.cache.CacheKeyFunction;
import io.admission.cache.QueryCacheKeys;
import io.admission.cache.ResultCache;
import io.admission.spi.MetricsExporter;
import io.admission.stats.AdmissionStats;
import io.admission.stats.CacheStats;
import io.admission.stats.OperationStats;
import io.admission.stats.OperationStatsRecorder;
import io.admission.stats.StatsRecorder;
import io.admission.util.DaemonThreadFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Priority-lane scheduler that admits requests, dispatches them under a concurrency
 * ceiling and gates dispatch with a {@link CircuitBreaker}.
 *
 * <p>A single dispatcher thread selects tickets in strict priority order (FIFO within a
 * lane) and hands each to one of {@code maxConcurrentRequests} worker threads. A worker
 * runs the {@link RequestExecutor} through the result cache, races it against the request
 * timeout and records the outcome. While the breaker is open, or every slot is taken,
 * tickets simply wait in their lanes; neither condition is reported as a ticket failure.
 *
 * <p>Lanes, breaker, cache, history and counters are guarded by one lock. Executor calls,
 * listener notifications and metrics exports happen outside it.
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe and implements
 * {@link AutoCloseable} for graceful shutdown with a configurable drain timeout.
 *
 * @see AdmissionDispatcher.Builder
 * @see AdmissionListener
 */
public final class AdmissionDispatcher implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(AdmissionDispatcher.class.getName());

  static final long OPEN_BACKOFF_MS = 1000;
  static final long CAPACITY_BACKOFF_MS = 100;
  static final long IDLE_BACKOFF_MS = 100;
  static final long ERROR_BACKOFF_MS = 1000;

  private final ReentrantLock lock = new ReentrantLock();
  private final Condition stateChanged = lock.newCondition();

  private final PriorityLanes lanes = new PriorityLanes();
  private final CircuitBreaker breaker;
  private final ResultCache cache;
  private final RequestHistory history;
  private final BurstDetector burstDetector;
  private final StatsRecorder stats = new StatsRecorder();
  private final OperationStatsRecorder operationStats = new OperationStatsRecorder();
  private final CacheAwareExecutor cacheAwareExecutor;

  private final List<AdmissionListener> listeners;
  private final MetricsExporter metrics;
  private final Clock clock;
  private final int maxConcurrentRequests;
  private final Duration requestTimeout;
  private final long drainTimeoutMs;

  private final ExecutorService dispatcherThread;
  private final ExecutorService workers;
  private final ExecutorService executions;

  private final AtomicBoolean running = new AtomicBoolean(false);
  private volatile boolean closed;
  private Future<?> loopTask;

  private AdmissionDispatcher(Builder builder) {
    RequestExecutor executor = Objects.requireNonNull(builder.executor, "executor");
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.listeners = Collections.unmodifiableList(new ArrayList<>(builder.listeners));
    CacheKeyFunction cacheKeyFunction = builder.cacheKeyFunction != null
        ? builder.cacheKeyFunction : QueryCacheKeys.getDefault();

    if (builder.maxConcurrentRequests <= 0) {
      throw new IllegalArgumentException("maxConcurrentRequests must be > 0");
    }
    if (isNotPositive(builder.requestTimeout)) {
      throw new IllegalArgumentException("requestTimeout must be > 0");
    }
    if (isNotPositive(builder.defaultCacheTtl)) {
      throw new IllegalArgumentException("defaultCacheTtl must be > 0");
    }
    if (builder.drainTimeout == null || builder.drainTimeout.isNegative()) {
      throw new IllegalArgumentException("drainTimeout must be >= 0");
    }
    if (builder.burstThreshold > builder.historyCapacity) {
      throw new IllegalArgumentException("burstThreshold must be <= historyCapacity");
    }
    this.maxConcurrentRequests = builder.maxConcurrentRequests;
    this.requestTimeout = builder.requestTimeout;
    this.drainTimeoutMs = builder.drainTimeout.toMillis();

    this.breaker = new CircuitBreaker(builder.circuitBreakerThreshold, builder.circuitBreakerTimeout);
    this.burstDetector = new BurstDetector(builder.burstThreshold, builder.burstWindow);
    this.history = new RequestHistory(builder.historyCapacity);
    this.cache = new ResultCache(builder.cacheMaxEntries);
    this.cacheAwareExecutor = new CacheAwareExecutor(executor, cache, operationStats,
        cacheKeyFunction, builder.defaultCacheTtl, clock, lock, metrics);

    this.dispatcherThread = Executors.newSingleThreadExecutor(new DaemonThreadFactory("admission-dispatcher-"));
    this.workers = Executors.newFixedThreadPool(maxConcurrentRequests, new DaemonThreadFactory("admission-worker-"));
    // One slot per worker plus as many again for timed-out calls that ignore interruption.
    // Past that the downstream is hung and new executions fail fast.
    int maxExecutions = (int) Math.min(Integer.MAX_VALUE, 2L * maxConcurrentRequests);
    this.executions = new ThreadPoolExecutor(0, maxExecutions,
        60L, TimeUnit.SECONDS, new SynchronousQueue<>(), new DaemonThreadFactory("admission-exec-"));

    if (builder.autoStart) {
      startLoop();
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  private static boolean isNotPositive(Duration duration) {
    return duration == null || duration.isZero() || duration.isNegative();
  }

  // ── Admission ───────────────────────────────────────────────────

  /**
   * Admits a request into the lane for {@code priority}. Never blocks on dispatch and never
   * rejects for load reasons; bursts are reported but do not delay admission.
   *
   * @param request  the request
   * @param priority the lane
   * @return the ticket id
   * @throws IllegalStateException if the dispatcher has been closed
   */
  public String enqueue(AdmissionRequest request, Priority priority) {
    Objects.requireNonNull(request, "request");
    Objects.requireNonNull(priority, "priority");
    if (closed) {
      throw new IllegalStateException("AdmissionDispatcher has been closed");
    }
    long now = clock.millis();
    Ticket ticket = new Ticket(UlidCreator.getMonotonicUlid().toString(), request, priority,
        now, System.nanoTime(), -1L);

    int burstCount;
    int laneDepth;
    lock.lock();
    try {
      lanes.add(ticket);
      stats.onAdmitted();
      history.add(HistoryEntry.admitted(ticket.id(), now));
      burstCount = burstDetector.check(history, now);
      laneDepth = lanes.size(priority);
      stateChanged.signalAll();
    } finally {
      lock.unlock();
    }

    metrics.incrementAdmitted(priority);
    metrics.recordLaneDepth(priority, laneDepth);
    if (burstCount >= 0) {
      metrics.incrementBurstDetections();
      logger.log(Level.WARNING, "Burst detected: {0} requests in the last {1} ms (threshold {2})",
          new Object[]{burstCount, burstDetector.windowMs(), burstDetector.threshold()});
      int threshold = burstDetector.threshold();
      notifyListeners("burstDetected", l -> l.burstDetected(burstCount, threshold));
    }
    notifyListeners("requestAdded", l -> l.requestAdded(ticket));
    return ticket.id();
  }

  // ── Dispatch loop ───────────────────────────────────────────────

  private void dispatchLoop() {
    while (true) {
      if (!running.get() && exitLoop()) {
        return;
      }
      try {
        Ticket ticket = nextTicket();
        if (ticket != null) {
          submit(ticket);
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        running.set(false);
        exitLoop();
        return;
      } catch (Throwable t) {
        logger.log(Level.SEVERE, "Dispatcher loop error", t);
        try {
          Thread.sleep(ERROR_BACKOFF_MS);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          running.set(false);
          exitLoop();
          return;
        }
      }
    }
  }

  private synchronized boolean exitLoop() {
    if (running.get()) {
      return false;
    }
    loopTask = null;
    return true;
  }

  /**
   * Runs one scheduling step: heal or wait on the breaker, wait for a free slot, or take
   * the next ticket. Returns {@code null} whenever the step ended in a wait.
   */
  private Ticket nextTicket() throws InterruptedException {
    boolean reset = false;
    Ticket ticket = null;
    int inFlight = 0;
    lock.lock();
    try {
      long now = clock.millis();
      if (breaker.isOpen()) {
        if (breaker.tryClose(now)) {
          reset = true;
        } else {
          long waitMs = Math.min(OPEN_BACKOFF_MS, breaker.remainingCooldownMs(now));
          stateChanged.await(Math.max(1L, waitMs), TimeUnit.MILLISECONDS);
          return null;
        }
      }
      if (stats.inFlightRequests() >= maxConcurrentRequests) {
        stateChanged.await(CAPACITY_BACKOFF_MS, TimeUnit.MILLISECONDS);
      } else {
        ticket = lanes.poll();
        if (ticket == null) {
          stateChanged.await(IDLE_BACKOFF_MS, TimeUnit.MILLISECONDS);
        } else {
          stats.onDispatched();
          inFlight = stats.inFlightRequests();
          ticket = ticket.dispatched(now);
        }
      }
    } finally {
      lock.unlock();
    }

    if (reset) {
      logger.info("Circuit breaker reset; resuming dispatch");
      notifyListeners("circuitBreakerReset", AdmissionListener::circuitBreakerReset);
    }
    if (ticket != null) {
      metrics.recordInFlight(inFlight);
      metrics.recordLaneDepth(ticket.priority(), laneSize(ticket.priority()));
    }
    return ticket;
  }

  private void submit(Ticket ticket) {
    try {
      workers.execute(() -> runTicket(ticket));
    } catch (RejectedExecutionException e) {
      recordFailure(ticket, new ExecutionFailedException(e));
    }
  }

  private void runTicket(Ticket ticket) {
    if (logger.isLoggable(Level.FINE)) {
      logger.fine("Processing ticket " + ticket.id() + " (priority " + ticket.priority() + ")");
    }
    AtomicBoolean settled = new AtomicBoolean(false);
    Future<ExecutionResult> execution;
    try {
      execution = executions.submit(() -> cacheAwareExecutor.execute(ticket.request(), settled));
    } catch (RejectedExecutionException e) {
      recordFailure(ticket, new ExecutionFailedException(e));
      return;
    }
    try {
      ExecutionResult result = execution.get(requestTimeout.toMillis(), TimeUnit.MILLISECONDS);
      recordSuccess(ticket, result);
    } catch (TimeoutException e) {
      if (abandon(settled, execution)) {
        recordFailure(ticket, new RequestTimeoutException(requestTimeout));
      } else {
        // the outcome was committed before the timeout could claim it
        awaitCommitted(ticket, execution);
      }
    } catch (ExecutionException e) {
      recordFailure(ticket, new ExecutionFailedException(e.getCause()));
    } catch (InterruptedException e) {
      abandon(settled, execution);
      Thread.currentThread().interrupt();
      recordFailure(ticket, new ExecutionFailedException(e));
    }
  }

  /**
   * Claims the execution for the worker and cancels it.
   *
   * @return false if the execution had already committed its outcome
   */
  private boolean abandon(AtomicBoolean settled, Future<?> execution) {
    lock.lock();
    try {
      if (!settled.compareAndSet(false, true)) {
        return false;
      }
    } finally {
      lock.unlock();
    }
    execution.cancel(true);
    return true;
  }

  private void awaitCommitted(Ticket ticket, Future<ExecutionResult> execution) {
    try {
      recordSuccess(ticket, execution.get());
    } catch (ExecutionException e) {
      recordFailure(ticket, new ExecutionFailedException(e.getCause()));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      recordFailure(ticket, new ExecutionFailedException(e));
    }
  }

  // ── Outcome recording ───────────────────────────────────────────

  private void recordSuccess(Ticket ticket, ExecutionResult result) {
    double responseTime = elapsedMs(ticket);
    int inFlight;
    lock.lock();
    try {
      stats.onCompleted(responseTime);
      history.add(HistoryEntry.completed(ticket.id(), ticket.enqueuedAt(), responseTime));
      breaker.onSuccess();
      inFlight = stats.inFlightRequests();
      stateChanged.signalAll();
    } finally {
      lock.unlock();
    }

    metrics.incrementCompleted();
    metrics.recordInFlight(inFlight);
    metrics.recordResponseTimeMs((long) responseTime);
    notifyListeners("requestCompleted",
        l -> l.requestCompleted(ticket.id(), result, ticket.priority()));
  }

  private void recordFailure(Ticket ticket, AdmissionException error) {
    double responseTime = elapsedMs(ticket);
    boolean tripped;
    int failureCount;
    int inFlight;
    lock.lock();
    try {
      stats.onFailed();
      history.add(HistoryEntry.failed(ticket.id(), ticket.enqueuedAt(), responseTime, error.getMessage()));
      tripped = breaker.onFailure(clock.millis());
      if (tripped) {
        stats.onBreakerTripped();
      }
      failureCount = breaker.state().failureCount();
      inFlight = stats.inFlightRequests();
      stateChanged.signalAll();
    } finally {
      lock.unlock();
    }

    if (error instanceof RequestTimeoutException) {
      metrics.incrementTimedOut();
    } else {
      metrics.incrementFailed();
    }
    metrics.recordInFlight(inFlight);
    metrics.recordResponseTimeMs((long) responseTime);
    logger.log(Level.FINE, "Ticket " + ticket.id() + " failed", error);

    if (tripped) {
      metrics.incrementBreakerTrips();
      int threshold = breaker.threshold();
      logger.log(Level.WARNING, "Circuit breaker tripped after {0} failures; dispatch halted",
          failureCount);
      notifyListeners("circuitBreakerTripped", l -> l.circuitBreakerTripped(failureCount, threshold));
    }
    notifyListeners("requestFailed", l -> l.requestFailed(ticket.id(), error, ticket.priority()));
  }

  private static double elapsedMs(Ticket ticket) {
    return Math.max(0L, System.nanoTime() - ticket.enqueuedNanos()) / 1_000_000.0;
  }

  private void notifyListeners(String event, Consumer<AdmissionListener> action) {
    for (AdmissionListener listener : listeners) {
      try {
        action.accept(listener);
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Listener " + event + " failed", e);
      }
    }
  }

  // ── Queries ─────────────────────────────────────────────────────

  /**
   * Returns a consistent snapshot of counters, breaker, lanes, cache and operation stats.
   */
  public AdmissionStats getStats() {
    lock.lock();
    try {
      return new AdmissionStats(
          stats.totalRequests(),
          stats.activeRequests(),
          stats.inFlightRequests(),
          stats.completedRequests(),
          stats.failedRequests(),
          stats.averageResponseTime(),
          stats.circuitBreakerTrips(),
          burstDetector.detections(),
          burstDetector.lastBurstTime(),
          breaker.state(),
          lanes.sizes(),
          lanes.totalSize(),
          cacheStatsLocked(),
          operationStats.snapshot());
    } finally {
      lock.unlock();
    }
  }

  public CacheStats getCacheStats() {
    lock.lock();
    try {
      return cacheStatsLocked();
    } finally {
      lock.unlock();
    }
  }

  public Map<String, OperationStats> getQueryStats() {
    lock.lock();
    try {
      return operationStats.snapshot();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns the request history, oldest first.
   */
  public List<HistoryEntry> history() {
    lock.lock();
    try {
      return history.snapshot();
    } finally {
      lock.unlock();
    }
  }

  private CacheStats cacheStatsLocked() {
    return new CacheStats(cache.size(), cache.keys(), cache.hits(), cache.misses());
  }

  private int laneSize(Priority priority) {
    lock.lock();
    try {
      return lanes.size(priority);
    } finally {
      lock.unlock();
    }
  }

  public void clearCache() {
    lock.lock();
    try {
      cache.clear();
    } finally {
      lock.unlock();
    }
    logger.info("Result cache cleared");
  }

  // ── Lifecycle ───────────────────────────────────────────────────

  /**
   * Starts (or resumes) the dispatch loop and notifies listeners. Queued tickets are
   * picked up where they were left.
   *
   * @throws IllegalStateException if the dispatcher has been closed
   */
  public void enable() {
    startLoop();
    logger.info("Admission dispatcher enabled");
    notifyListeners("enabled", AdmissionListener::enabled);
  }

  /**
   * Halts the dispatch loop after its current step and notifies listeners. Admission
   * continues; running tickets finish normally.
   */
  public void disable() {
    running.set(false);
    signalStateChanged();
    logger.info("Admission dispatcher disabled");
    notifyListeners("disabled", AdmissionListener::disabled);
  }

  public void setEnabled(boolean enabled) {
    if (enabled) {
      enable();
    } else {
      disable();
    }
  }

  /**
   * Halts the dispatch loop without notifying listeners.
   */
  public void stop() {
    running.set(false);
    signalStateChanged();
    logger.info("Admission dispatcher stopped");
  }

  public boolean isEnabled() {
    return running.get();
  }

  private synchronized void startLoop() {
    if (closed) {
      throw new IllegalStateException("AdmissionDispatcher has been closed");
    }
    running.set(true);
    if (loopTask == null) {
      loopTask = dispatcherThread.submit(this::dispatchLoop);
    }
  }

  private void signalStateChanged() {
    lock.lock();
    try {
      stateChanged.signalAll();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Stops dispatch, waits up to the drain timeout for running tickets, then shuts down
   * all threads. Tickets still queued are dropped.
   */
  @Override
  public void close() {
    synchronized (this) {
      if (closed) {
        return;
      }
      closed = true;
    }
    running.set(false);
    signalStateChanged();
    dispatcherThread.shutdown();
    workers.shutdown();
    try {
      if (!workers.awaitTermination(drainTimeoutMs, TimeUnit.MILLISECONDS)) {
        logger.log(Level.WARNING, "Drain timeout exceeded; forcing shutdown. "
            + "In flight: " + getStats().inFlightRequests());
        workers.shutdownNow();
        workers.awaitTermination(5, TimeUnit.SECONDS);
      }
    } catch (InterruptedException e) {
      workers.shutdownNow();
      Thread.currentThread().interrupt();
    } finally {
      executions.shutdownNow();
      dispatcherThread.shutdownNow();
    }
    int dropped;
    lock.lock();
    try {
      dropped = lanes.totalSize();
    } finally {
      lock.unlock();
    }
    if (dropped > 0) {
      logger.log(Level.WARNING, "Closed with {0} queued tickets not dispatched", dropped);
    }
  }

  /** Builder for {@link AdmissionDispatcher}. */
  public static final class Builder {
    private RequestExecutor executor;
    private CacheKeyFunction cacheKeyFunction;
    private MetricsExporter metrics;
    private Clock clock;
    private final List<AdmissionListener> listeners = new ArrayList<>();
    private int maxConcurrentRequests = 150;
    private int burstThreshold = 50;
    private Duration burstWindow = BurstDetector.DEFAULT_WINDOW;
    private int circuitBreakerThreshold = 10;
    private Duration circuitBreakerTimeout = Duration.ofSeconds(30);
    private Duration requestTimeout = Duration.ofSeconds(10);
    private Duration defaultCacheTtl = Duration.ofMinutes(5);
    private int cacheMaxEntries = 0;
    private int historyCapacity = RequestHistory.DEFAULT_CAPACITY;
    private Duration drainTimeout = Duration.ofSeconds(5);
    private boolean autoStart = true;

    private Builder() {}

    /**
     * Sets the callback that executes admitted requests.
     *
     * <p><b>Required.</b>
     *
     * @param executor the request executor
     * @return this builder
     */
    public Builder executor(RequestExecutor executor) {
      this.executor = executor;
      return this;
    }

    /**
     * Sets how cache keys are derived for cacheable requests without an explicit key.
     *
     * <p>Optional. Defaults to {@link QueryCacheKeys#getDefault()}.
     *
     * @param cacheKeyFunction the key derivation
     * @return this builder
     */
    public Builder cacheKeyFunction(CacheKeyFunction cacheKeyFunction) {
      this.cacheKeyFunction = cacheKeyFunction;
      return this;
    }

    /**
     * Sets the metrics exporter.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Sets the wall clock used for breaker cooldown, cache freshness and burst windows.
     *
     * <p>Optional. Defaults to {@link Clock#systemUTC()}.
     *
     * @param clock the clock
     * @return this builder
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Appends a listener. Listeners are notified in registration order.
     *
     * @param listener the listener
     * @return this builder
     */
    public Builder listener(AdmissionListener listener) {
      this.listeners.add(Objects.requireNonNull(listener, "listener"));
      return this;
    }

    /**
     * Appends several listeners.
     *
     * @param listeners the listeners
     * @return this builder
     */
    public Builder listeners(List<AdmissionListener> listeners) {
      Objects.requireNonNull(listeners, "listeners");
      listeners.forEach(this::listener);
      return this;
    }

    /**
     * Sets how many tickets may execute at once.
     *
     * <p>Optional. Defaults to {@code 150}. Must be &gt; 0. {@code 1} serializes execution.
     *
     * @param maxConcurrentRequests the concurrency ceiling
     * @return this builder
     */
    public Builder maxConcurrentRequests(int maxConcurrentRequests) {
      this.maxConcurrentRequests = maxConcurrentRequests;
      return this;
    }

    /**
     * Sets how many admissions within the burst window count as a burst.
     *
     * <p>Optional. Defaults to {@code 50}. Must be &gt; 0 and no larger than
     * {@link #historyCapacity(int)}. Admissions are counted from the shared history ring,
     * which also holds outcome entries, so under steady traffic only about half the
     * capacity is available for counting.
     *
     * @param burstThreshold the burst threshold
     * @return this builder
     */
    public Builder burstThreshold(int burstThreshold) {
      this.burstThreshold = burstThreshold;
      return this;
    }

    /**
     * Sets the trailing window for burst detection.
     *
     * <p>Optional. Defaults to 60 seconds.
     *
     * @param burstWindow the window
     * @return this builder
     */
    public Builder burstWindow(Duration burstWindow) {
      this.burstWindow = burstWindow;
      return this;
    }

    /**
     * Sets the failure count that trips the circuit breaker.
     *
     * <p>Optional. Defaults to {@code 10}. Must be &gt; 0.
     *
     * @param circuitBreakerThreshold the trip threshold
     * @return this builder
     */
    public Builder circuitBreakerThreshold(int circuitBreakerThreshold) {
      this.circuitBreakerThreshold = circuitBreakerThreshold;
      return this;
    }

    /**
     * Sets the cooldown after the last failure before an open breaker closes.
     *
     * <p>Optional. Defaults to 30 seconds.
     *
     * @param circuitBreakerTimeout the cooldown
     * @return this builder
     */
    public Builder circuitBreakerTimeout(Duration circuitBreakerTimeout) {
      this.circuitBreakerTimeout = circuitBreakerTimeout;
      return this;
    }

    /**
     * Sets the maximum time one execution may take.
     *
     * <p>Optional. Defaults to 10 seconds. Queue wait does not count. A timed-out call is
     * interrupted; one that ignores the interrupt keeps its thread, and once
     * {@code maxConcurrentRequests} such calls are stuck further executions fail with
     * {@link ExecutionFailedException} until they return.
     *
     * @param requestTimeout the timeout
     * @return this builder
     */
    public Builder requestTimeout(Duration requestTimeout) {
      this.requestTimeout = requestTimeout;
      return this;
    }

    /**
     * Sets the cache freshness window for requests without their own ttl.
     *
     * <p>Optional. Defaults to 5 minutes.
     *
     * @param defaultCacheTtl the default ttl
     * @return this builder
     */
    public Builder defaultCacheTtl(Duration defaultCacheTtl) {
      this.defaultCacheTtl = defaultCacheTtl;
      return this;
    }

    /**
     * Bounds the result cache with least-recently-used eviction.
     *
     * <p>Optional. Defaults to {@code 0} (unbounded).
     *
     * @param cacheMaxEntries maximum entries, or {@code 0}
     * @return this builder
     */
    public Builder cacheMaxEntries(int cacheMaxEntries) {
      this.cacheMaxEntries = cacheMaxEntries;
      return this;
    }

    /**
     * Sets the capacity of the request history ring.
     *
     * <p>Optional. Defaults to {@code 1000}.
     *
     * @param historyCapacity maximum entries kept
     * @return this builder
     */
    public Builder historyCapacity(int historyCapacity) {
      this.historyCapacity = historyCapacity;
      return this;
    }

    /**
     * Sets how long {@link AdmissionDispatcher#close()} waits for running tickets.
     *
     * <p>Optional. Defaults to 5 seconds.
     *
     * @param drainTimeout the drain timeout
     * @return this builder
     */
    public Builder drainTimeout(Duration drainTimeout) {
      this.drainTimeout = drainTimeout;
      return this;
    }

    /**
     * Controls whether the dispatch loop starts on build.
     *
     * <p>Optional. Defaults to {@code true}. When {@code false}, call {@link AdmissionDispatcher#enable()}.
     *
     * @param autoStart whether to start immediately
     * @return this builder
     */
    public Builder autoStart(boolean autoStart) {
      this.autoStart = autoStart;
      return this;
    }

    /**
     * Builds the dispatcher and, unless disabled, starts dispatching.
     *
     * @return a new {@link AdmissionDispatcher}
     * @throws NullPointerException     if no executor is set
     * @throws IllegalArgumentException if any limit, threshold or duration is out of range
     */
    public AdmissionDispatcher build() {
      return new AdmissionDispatcher(this);
    }
  }
}
