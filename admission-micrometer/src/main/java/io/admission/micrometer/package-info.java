/**
 * Micrometer bridge for exporting admission metrics to Prometheus, Grafana, and other backends.
 *
 * <p>{@link io.admission.micrometer.MicrometerMetricsExporter} implements the
 * {@link io.admission.spi.MetricsExporter} SPI using Micrometer counters, gauges and a
 * distribution summary.
 *
 * @see io.admission.micrometer.MicrometerMetricsExporter
 */
package io.admission.micrometer;
