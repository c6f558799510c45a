package io.admission.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for admission control.
 *
 * @see AdmissionAutoConfiguration
 */
@ConfigurationProperties(prefix = "admission")
public class AdmissionProperties {

    /**
     * Whether the dispatch loop starts with the application context.
     */
    private boolean enabled = true;

    /**
     * Maximum number of tickets executing at once.
     */
    private int maxConcurrentRequests = 150;

    /**
     * Maximum time a single execution may take.
     */
    private Duration requestTimeout = Duration.ofSeconds(10);

    /**
     * How long shutdown waits for running tickets.
     */
    private Duration drainTimeout = Duration.ofSeconds(5);

    /**
     * Entries kept in the request history ring.
     */
    private int historyCapacity = 1000;

    private final Burst burst = new Burst();
    private final CircuitBreaker circuitBreaker = new CircuitBreaker();
    private final Cache cache = new Cache();
    private final Metrics metrics = new Metrics();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public int getMaxConcurrentRequests() {
        return maxConcurrentRequests;
    }

    public void setMaxConcurrentRequests(int maxConcurrentRequests) {
        this.maxConcurrentRequests = maxConcurrentRequests;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public void setRequestTimeout(Duration requestTimeout) {
        this.requestTimeout = requestTimeout;
    }

    public Duration getDrainTimeout() {
        return drainTimeout;
    }

    public void setDrainTimeout(Duration drainTimeout) {
        this.drainTimeout = drainTimeout;
    }

    public int getHistoryCapacity() {
        return historyCapacity;
    }

    public void setHistoryCapacity(int historyCapacity) {
        this.historyCapacity = historyCapacity;
    }

    public Burst getBurst() {
        return burst;
    }

    public CircuitBreaker getCircuitBreaker() {
        return circuitBreaker;
    }

    public Cache getCache() {
        return cache;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Burst {
        private int threshold = 50;
        private Duration window = Duration.ofSeconds(60);

        public int getThreshold() {
            return threshold;
        }

        public void setThreshold(int threshold) {
            this.threshold = threshold;
        }

        public Duration getWindow() {
            return window;
        }

        public void setWindow(Duration window) {
            this.window = window;
        }
    }

    public static class CircuitBreaker {
        private int threshold = 10;
        private Duration timeout = Duration.ofSeconds(30);

        public int getThreshold() {
            return threshold;
        }

        public void setThreshold(int threshold) {
            this.threshold = threshold;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }
    }

    public static class Cache {
        private Duration defaultTtl = Duration.ofMinutes(5);
        private int maxEntries = 0;

        public Duration getDefaultTtl() {
            return defaultTtl;
        }

        public void setDefaultTtl(Duration defaultTtl) {
            this.defaultTtl = defaultTtl;
        }

        public int getMaxEntries() {
            return maxEntries;
        }

        public void setMaxEntries(int maxEntries) {
            this.maxEntries = maxEntries;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "admission";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
