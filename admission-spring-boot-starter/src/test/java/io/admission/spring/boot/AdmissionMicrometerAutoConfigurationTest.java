package io.admission.spring.boot;

import io.admission.Admission;
import io.admission.AdmissionRequest;
import io.admission.Priority;
import io.admission.RequestExecutor;
import io.admission.micrometer.MicrometerMetricsExporter;
import io.admission.spi.MetricsExporter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Locale;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AdmissionMicrometerAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(
                    AdmissionMicrometerAutoConfiguration.class, AdmissionAutoConfiguration.class))
            .withUserConfiguration(MeterRegistryConfig.class);

    @Test
    void createsMicrometerExporterByDefault() {
        runner.run(ctx -> {
            assertTrue(ctx.containsBean("micrometerMetricsExporter"));
            assertInstanceOf(MicrometerMetricsExporter.class, ctx.getBean(MetricsExporter.class));
        });
    }

    @Test
    void respectsCustomNamePrefix() {
        runner.withPropertyValues("admission.metrics.name-prefix=sekolah.admission").run(ctx -> {
            var registry = ctx.getBean(MeterRegistry.class);
            assertNotNull(registry.find("sekolah.admission.requests.completed").counter());
        });
    }

    @Test
    void registersLaneGaugesAndResponseTimeSummary() {
        runner.run(ctx -> {
            var registry = ctx.getBean(MeterRegistry.class);
            for (Priority priority : Priority.values()) {
                assertNotNull(registry.find("admission.lane.depth")
                        .tag("priority", priority.name().toLowerCase(Locale.ROOT)).gauge());
            }
            assertNotNull(registry.find("admission.requests.inflight").gauge());
            assertNotNull(registry.find("admission.response.time.ms").summary());
        });
    }

    @Test
    void absentWithoutMeterRegistry() {
        new ApplicationContextRunner()
                .withConfiguration(AutoConfigurations.of(
                        AdmissionMicrometerAutoConfiguration.class, AdmissionAutoConfiguration.class))
                .run(ctx -> assertFalse(ctx.containsBean("micrometerMetricsExporter")));
    }

    @Test
    void disabledWhenPropertyFalse() {
        runner.withPropertyValues("admission.metrics.enabled=false").run(ctx ->
                assertFalse(ctx.containsBean("micrometerMetricsExporter")));
    }

    @Test
    void backsOffWhenCustomMetricsExporterPresent() {
        runner.withUserConfiguration(CustomExporterConfig.class).run(ctx -> {
            var exporter = ctx.getBean(MetricsExporter.class);
            assertFalse(exporter instanceof MicrometerMetricsExporter);
        });
    }

    @Test
    void admissionExportsThroughRegistry() {
        runner.withUserConfiguration(ExecutorConfig.class).run(ctx -> {
            Admission admission = ctx.getBean(Admission.class);
            admission.enqueue(AdmissionRequest.of("a").build(), Priority.CRITICAL);

            var registry = ctx.getBean(MeterRegistry.class);
            assertEquals(1.0, registry.find("admission.requests.admitted")
                    .tag("priority", "critical").counter().count());
        });
    }

    @Configuration
    static class MeterRegistryConfig {
        @Bean
        MeterRegistry meterRegistry() {
            return new SimpleMeterRegistry();
        }
    }

    @Configuration
    static class CustomExporterConfig {
        @Bean
        MetricsExporter customMetricsExporter() {
            return MetricsExporter.NOOP;
        }
    }

    @Configuration
    static class ExecutorConfig {
        @Bean
        RequestExecutor requestExecutor() {
            return request -> null;
        }
    }
}
