/**
 * Spring Boot auto-configuration for admission control.
 *
 * <p>Declare a {@link io.admission.RequestExecutor} bean and an
 * {@link io.admission.Admission} is created from {@code admission.*} properties. With a
 * Micrometer {@code MeterRegistry} present, metrics are exported as well.
 *
 * @see io.admission.spring.boot.AdmissionAutoConfiguration
 * @see io.admission.spring.boot.AdmissionProperties
 */
package io.admission.spring.boot;
