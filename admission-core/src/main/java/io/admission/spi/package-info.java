/**
 * Service provider interfaces implemented outside the core module.
 *
 * @see io.admission.spi.MetricsExporter
 */
package io.admission.spi;
