package io.admission.micrometer;

import io.admission.Admission;
import io.admission.AdmissionRequest;
import io.admission.Priority;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerMetricsExporterTest {

  private SimpleMeterRegistry registry;
  private MicrometerMetricsExporter exporter;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    exporter = new MicrometerMetricsExporter(registry);
  }

  @Test
  void admittedIsTaggedByPriority() {
    exporter.incrementAdmitted(Priority.CRITICAL);
    exporter.incrementAdmitted(Priority.CRITICAL);
    exporter.incrementAdmitted(Priority.LOW);

    assertEquals(2.0, registry.find("admission.requests.admitted").tag("priority", "critical").counter().count());
    assertEquals(1.0, registry.find("admission.requests.admitted").tag("priority", "low").counter().count());
  }

  @Test
  void outcomeCounters() {
    exporter.incrementCompleted();
    exporter.incrementFailed();
    exporter.incrementTimedOut();
    exporter.incrementTimedOut();

    assertEquals(1.0, counter("admission.requests.completed").count());
    assertEquals(1.0, counter("admission.requests.failed").count());
    assertEquals(2.0, counter("admission.requests.timeout").count());
  }

  @Test
  void breakerBurstAndCacheCounters() {
    exporter.incrementBreakerTrips();
    exporter.incrementBurstDetections();
    exporter.incrementCacheHit();
    exporter.incrementCacheMiss();
    exporter.incrementCacheMiss();

    assertEquals(1.0, counter("admission.breaker.trips").count());
    assertEquals(1.0, counter("admission.burst.detections").count());
    assertEquals(1.0, counter("admission.cache.hit").count());
    assertEquals(2.0, counter("admission.cache.miss").count());
  }

  @Test
  void laneDepthAndInFlightGauges() {
    exporter.recordLaneDepth(Priority.HIGH, 7);
    exporter.recordInFlight(3);

    assertEquals(7.0, registry.find("admission.lane.depth").tag("priority", "high").gauge().value());
    assertEquals(0.0, registry.find("admission.lane.depth").tag("priority", "normal").gauge().value());
    assertEquals(3.0, gauge("admission.requests.inflight").value());
  }

  @Test
  void responseTimeSummary() {
    exporter.recordResponseTimeMs(40);
    exporter.recordResponseTimeMs(60);

    DistributionSummary summary = registry.find("admission.response.time.ms").summary();
    assertNotNull(summary);
    assertEquals(2, summary.count());
    assertEquals(100.0, summary.totalAmount());
  }

  @Test
  void customNamePrefix() {
    var custom = new MicrometerMetricsExporter(registry, "reports.admission");
    custom.incrementCompleted();
    custom.recordInFlight(5);

    assertEquals(1.0, counter("reports.admission.requests.completed").count());
    assertEquals(5.0, gauge("reports.admission.requests.inflight").value());
  }

  @Test
  void closeRemovesMetersAndIgnoresLaterCalls() {
    exporter.close();
    exporter.incrementCompleted();

    assertNull(registry.find("admission.requests.completed").counter());
    assertNull(registry.find("admission.lane.depth").gauge());
  }

  @Test
  void invalidPrefixThrows() {
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, ""));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, "admission."));
  }

  @Test
  void nullRegistryThrows() {
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(null));
  }

  @Test
  void nullPrefixThrows() {
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(registry, null));
  }

  @Test
  void admissionReportsThroughExporter() throws Exception {
    CountDownLatch done = new CountDownLatch(1);
    try (Admission admission = Admission.builder()
        .executor(request -> "ok")
        .metrics(exporter)
        .listener(io.admission.AdmissionListener.onCompletion((id, result, priority) -> done.countDown()))
        .build()) {
      admission.enqueue(AdmissionRequest.query("SELECT 1").build(), Priority.HIGH);
      assertTrue(done.await(5, TimeUnit.SECONDS));

      assertEquals(1.0, registry.find("admission.requests.admitted").tag("priority", "high").counter().count());
      assertEquals(1.0, counter("admission.requests.completed").count());
      assertEquals(1.0, counter("admission.cache.miss").count());
    }
    assertNull(registry.find("admission.requests.completed").counter());
  }

  private Counter counter(String name) {
    Counter c = registry.find(name).counter();
    assertNotNull(c, "Counter not found: " + name);
    return c;
  }

  private Gauge gauge(String name) {
    Gauge g = registry.find(name).gauge();
    assertNotNull(g, "Gauge not found: " + name);
    return g;
  }
}
