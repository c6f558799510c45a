package io.admission.micrometer;

import io.admission.Priority;
import io.admission.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code admission.requests.admitted} (tag {@code priority}): tickets admitted</li>
 *   <li>{@code admission.requests.completed}: tickets that completed</li>
 *   <li>{@code admission.requests.failed}: tickets whose executor threw</li>
 *   <li>{@code admission.requests.timeout}: tickets that exceeded the request timeout</li>
 *   <li>{@code admission.breaker.trips}: circuit breaker trips</li>
 *   <li>{@code admission.burst.detections}: burst detections</li>
 *   <li>{@code admission.cache.hit} / {@code admission.cache.miss}: result cache lookups</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code admission.lane.depth} (tag {@code priority}): queued tickets per lane</li>
 *   <li>{@code admission.requests.inflight}: tickets currently executing</li>
 * </ul>
 *
 * <h3>Distribution Summaries</h3>
 * <ul>
 *   <li>{@code admission.response.time.ms}: admission-to-outcome time</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

    public static final String DEFAULT_PREFIX = "admission";

    private final MeterRegistry registry;
    private final Map<Priority, Counter> admitted = new EnumMap<>(Priority.class);
    private final Counter completed;
    private final Counter failed;
    private final Counter timedOut;
    private final Counter breakerTrips;
    private final Counter burstDetections;
    private final Counter cacheHit;
    private final Counter cacheMiss;
    private final Map<Priority, AtomicInteger> laneDepths = new EnumMap<>(Priority.class);
    private final AtomicInteger inFlight = new AtomicInteger();
    private final DistributionSummary responseTime;
    private final List<Meter> meters = new ArrayList<>();
    private volatile boolean closed;

    /**
     * Creates an exporter with the default metric name prefix {@code "admission"}.
     *
     * @param registry the Micrometer meter registry
     */
    public MicrometerMetricsExporter(MeterRegistry registry) {
        this(registry, DEFAULT_PREFIX);
    }

    /**
     * Creates an exporter with a custom metric name prefix for multi-instance use.
     *
     * @param registry   the Micrometer meter registry
     * @param namePrefix prefix for all meter names (e.g. {@code "reports.admission"})
     */
    public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(namePrefix, "namePrefix");
        if (namePrefix.isEmpty()) {
            throw new IllegalArgumentException("namePrefix must not be empty");
        }
        if (namePrefix.endsWith(".")) {
            throw new IllegalArgumentException("namePrefix must not end with '.'");
        }
        this.registry = registry;

        for (Priority priority : Priority.values()) {
            String tag = priority.name().toLowerCase(Locale.ROOT);
            admitted.put(priority, track(Counter.builder(namePrefix + ".requests.admitted")
                    .description("Tickets admitted into a lane")
                    .tag("priority", tag)
                    .register(registry)));
            AtomicInteger depth = new AtomicInteger();
            laneDepths.put(priority, depth);
            track(Gauge.builder(namePrefix + ".lane.depth", depth, AtomicInteger::get)
                    .description("Queued tickets per lane")
                    .tag("priority", tag)
                    .register(registry));
        }
        this.completed = counter(namePrefix + ".requests.completed", "Tickets completed successfully");
        this.failed = counter(namePrefix + ".requests.failed", "Tickets whose executor threw");
        this.timedOut = counter(namePrefix + ".requests.timeout", "Tickets that exceeded the request timeout");
        this.breakerTrips = counter(namePrefix + ".breaker.trips", "Circuit breaker trips");
        this.burstDetections = counter(namePrefix + ".burst.detections", "Admission bursts detected");
        this.cacheHit = counter(namePrefix + ".cache.hit", "Fresh result cache hits");
        this.cacheMiss = counter(namePrefix + ".cache.miss", "Result cache misses");

        track(Gauge.builder(namePrefix + ".requests.inflight", inFlight, AtomicInteger::get)
                .description("Tickets currently executing")
                .register(registry));
        this.responseTime = track(DistributionSummary.builder(namePrefix + ".response.time.ms")
                .description("Admission-to-outcome time in milliseconds")
                .register(registry));
    }

    private Counter counter(String name, String description) {
        return track(Counter.builder(name).description(description).register(registry));
    }

    private <M extends Meter> M track(M meter) {
        meters.add(meter);
        return meter;
    }

    @Override
    public void incrementAdmitted(Priority priority) {
        if (closed) return;
        admitted.get(priority).increment();
    }

    @Override
    public void incrementCompleted() {
        if (closed) return;
        completed.increment();
    }

    @Override
    public void incrementFailed() {
        if (closed) return;
        failed.increment();
    }

    @Override
    public void incrementTimedOut() {
        if (closed) return;
        timedOut.increment();
    }

    @Override
    public void incrementBreakerTrips() {
        if (closed) return;
        breakerTrips.increment();
    }

    @Override
    public void incrementBurstDetections() {
        if (closed) return;
        burstDetections.increment();
    }

    @Override
    public void incrementCacheHit() {
        if (closed) return;
        cacheHit.increment();
    }

    @Override
    public void incrementCacheMiss() {
        if (closed) return;
        cacheMiss.increment();
    }

    @Override
    public void recordLaneDepth(Priority priority, int depth) {
        if (closed) return;
        laneDepths.get(priority).set(depth);
    }

    @Override
    public void recordInFlight(int inFlight) {
        if (closed) return;
        this.inFlight.set(inFlight);
    }

    @Override
    public void recordResponseTimeMs(long responseTimeMs) {
        if (closed) return;
        responseTime.record(responseTimeMs);
    }

    /**
     * Removes all meters registered by this exporter from the registry.
     *
     * <p>Called by {@link io.admission.Admission#close()} so that closed instances leave
     * no stale gauges behind.
     */
    @Override
    public void close() {
        closed = true;
        RuntimeException first = null;
        for (Meter meter : meters) {
            try {
                registry.remove(meter);
            } catch (RuntimeException e) {
                if (first == null) first = e;
                else first.addSuppressed(e);
            }
        }
        if (first != null) throw first;
    }
}
