package io.admission.spring.boot;

import io.admission.micrometer.MicrometerMetricsExporter;
import io.admission.spi.MetricsExporter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Publishes admission telemetry to the application's {@link MeterRegistry}.
 *
 * <p>Registers a {@link MicrometerMetricsExporter} under {@code admission.metrics.name-prefix}
 * (default {@code admission}): admitted requests tagged by priority, completed, failed and
 * timed-out requests, breaker trips, burst detections, cache hits and misses, per-lane depth
 * and in-flight gauges, and a {@code response.time.ms} distribution summary. The exporter
 * only exists when a registry bean is present and {@code admission.metrics.enabled} is not
 * {@code false}; a user-defined {@link MetricsExporter} bean replaces it.
 *
 * <p>Ordered before {@link AdmissionAutoConfiguration}, which picks the exporter up and
 * closes it together with the {@code Admission} bean.
 */
@AutoConfiguration(before = AdmissionAutoConfiguration.class,
    afterName = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnBean(MeterRegistry.class)
@ConditionalOnProperty(prefix = "admission.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(AdmissionProperties.class)
public class AdmissionMicrometerAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(MetricsExporter.class)
  public MicrometerMetricsExporter micrometerMetricsExporter(
      MeterRegistry meterRegistry, AdmissionProperties props) {
    return new MicrometerMetricsExporter(meterRegistry, props.getMetrics().getNamePrefix());
  }
}
