package io.admission.spring.boot;

import io.admission.Admission;
import io.admission.AdmissionListener;
import io.admission.RequestExecutor;
import io.admission.cache.CacheKeyFunction;
import io.admission.spi.MetricsExporter;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for admission control.
 *
 * <p>Wires up an {@link Admission} composite around the application's
 * {@link RequestExecutor} bean, configured from {@link AdmissionProperties}.
 * {@link AdmissionListener} beans are subscribed in {@code @Order} order.
 *
 * @see AdmissionProperties
 * @see AdmissionMicrometerAutoConfiguration
 */
@AutoConfiguration
@ConditionalOnClass(Admission.class)
@ConditionalOnBean(RequestExecutor.class)
@EnableConfigurationProperties(AdmissionProperties.class)
public class AdmissionAutoConfiguration {

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public Admission admission(AdmissionProperties props,
                               RequestExecutor executor,
                               ObjectProvider<MetricsExporter> metricsProvider,
                               ObjectProvider<CacheKeyFunction> cacheKeyFunctionProvider,
                               ObjectProvider<AdmissionListener> listenerProvider) {
        var builder = Admission.builder()
                .executor(executor)
                .maxConcurrentRequests(props.getMaxConcurrentRequests())
                .requestTimeout(props.getRequestTimeout())
                .drainTimeout(props.getDrainTimeout())
                .historyCapacity(props.getHistoryCapacity())
                .burstThreshold(props.getBurst().getThreshold())
                .burstWindow(props.getBurst().getWindow())
                .circuitBreakerThreshold(props.getCircuitBreaker().getThreshold())
                .circuitBreakerTimeout(props.getCircuitBreaker().getTimeout())
                .defaultCacheTtl(props.getCache().getDefaultTtl())
                .cacheMaxEntries(props.getCache().getMaxEntries())
                .autoStart(props.isEnabled());

        MetricsExporter metrics = metricsProvider.getIfAvailable();
        if (metrics != null) {
            builder.metrics(metrics);
        }
        CacheKeyFunction cacheKeyFunction = cacheKeyFunctionProvider.getIfAvailable();
        if (cacheKeyFunction != null) {
            builder.cacheKeyFunction(cacheKeyFunction);
        }
        builder.listeners(listenerProvider.orderedStream().toList());
        return builder.build();
    }
}
