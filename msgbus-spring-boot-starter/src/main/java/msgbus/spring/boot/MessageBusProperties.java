package msgbus.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration properties for the message bus.
 *
 * @see MessageBusAutoConfiguration
 */
@ConfigurationProperties(prefix = "msgbus")
public class MessageBusProperties {

    /**
     * Whether publishing or subscribing to an unregistered type code fails.
     */
    private boolean requireRegisteredTypes = true;

    /**
     * Message types registered at startup, keyed by type code.
     */
    private final Map<Integer, String> types = new LinkedHashMap<>();

    private final Async async = new Async();
    private final Retry retry = new Retry();
    private final CircuitBreaker circuitBreaker = new CircuitBreaker();
    private final DeadLetter deadLetter = new DeadLetter();
    private final Health health = new Health();
    private final Metrics metrics = new Metrics();

    public boolean isRequireRegisteredTypes() {
        return requireRegisteredTypes;
    }

    public void setRequireRegisteredTypes(boolean requireRegisteredTypes) {
        this.requireRegisteredTypes = requireRegisteredTypes;
    }

    public Map<Integer, String> getTypes() {
        return types;
    }

    public Async getAsync() {
        return async;
    }

    public Retry getRetry() {
        return retry;
    }

    public CircuitBreaker getCircuitBreaker() {
        return circuitBreaker;
    }

    public DeadLetter getDeadLetter() {
        return deadLetter;
    }

    public Health getHealth() {
        return health;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Async {
        private int threads = 4;
        private long drainTimeoutMs = 5000;

        public int getThreads() {
            return threads;
        }

        public void setThreads(int threads) {
            this.threads = threads;
        }

        public long getDrainTimeoutMs() {
            return drainTimeoutMs;
        }

        public void setDrainTimeoutMs(long drainTimeoutMs) {
            this.drainTimeoutMs = drainTimeoutMs;
        }
    }

    public static class Retry {
        private int maxAttempts = 3;
        private Duration initialDelay = Duration.ofMillis(200);
        private double multiplier = 2.0;
        private Duration maxDelay = Duration.ofSeconds(60);
        private double jitter = 0.0;

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getInitialDelay() {
            return initialDelay;
        }

        public void setInitialDelay(Duration initialDelay) {
            this.initialDelay = initialDelay;
        }

        public double getMultiplier() {
            return multiplier;
        }

        public void setMultiplier(double multiplier) {
            this.multiplier = multiplier;
        }

        public Duration getMaxDelay() {
            return maxDelay;
        }

        public void setMaxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
        }

        public double getJitter() {
            return jitter;
        }

        public void setJitter(double jitter) {
            this.jitter = jitter;
        }
    }

    public static class CircuitBreaker {
        private int failureThreshold = 5;
        private int successThreshold = 2;
        private Duration openTimeout = Duration.ofSeconds(60);

        /**
         * Trial deliveries admitted while half-open. Unset means the success threshold.
         */
        private Integer halfOpenMaxTrialCalls;

        public int getFailureThreshold() {
            return failureThreshold;
        }

        public void setFailureThreshold(int failureThreshold) {
            this.failureThreshold = failureThreshold;
        }

        public int getSuccessThreshold() {
            return successThreshold;
        }

        public void setSuccessThreshold(int successThreshold) {
            this.successThreshold = successThreshold;
        }

        public Duration getOpenTimeout() {
            return openTimeout;
        }

        public void setOpenTimeout(Duration openTimeout) {
            this.openTimeout = openTimeout;
        }

        public Integer getHalfOpenMaxTrialCalls() {
            return halfOpenMaxTrialCalls;
        }

        public void setHalfOpenMaxTrialCalls(Integer halfOpenMaxTrialCalls) {
            this.halfOpenMaxTrialCalls = halfOpenMaxTrialCalls;
        }
    }

    public static class DeadLetter {
        private int capacityPerType = 1000;

        public int getCapacityPerType() {
            return capacityPerType;
        }

        public void setCapacityPerType(int capacityPerType) {
            this.capacityPerType = capacityPerType;
        }
    }

    public static class Health {
        /**
         * Period of the background health evaluation. Zero disables it.
         */
        private Duration checkInterval = Duration.ofSeconds(30);
        private double unhealthyErrorRate = 0.5;
        private double degradedErrorRate = 0.1;
        private Duration degradedLatency = Duration.ofSeconds(1);
        private boolean orphanedPublishersDegrade = true;
        private int minimumSamples = 1;

        public Duration getCheckInterval() {
            return checkInterval;
        }

        public void setCheckInterval(Duration checkInterval) {
            this.checkInterval = checkInterval;
        }

        public double getUnhealthyErrorRate() {
            return unhealthyErrorRate;
        }

        public void setUnhealthyErrorRate(double unhealthyErrorRate) {
            this.unhealthyErrorRate = unhealthyErrorRate;
        }

        public double getDegradedErrorRate() {
            return degradedErrorRate;
        }

        public void setDegradedErrorRate(double degradedErrorRate) {
            this.degradedErrorRate = degradedErrorRate;
        }

        public Duration getDegradedLatency() {
            return degradedLatency;
        }

        public void setDegradedLatency(Duration degradedLatency) {
            this.degradedLatency = degradedLatency;
        }

        public boolean isOrphanedPublishersDegrade() {
            return orphanedPublishersDegrade;
        }

        public void setOrphanedPublishersDegrade(boolean orphanedPublishersDegrade) {
            this.orphanedPublishersDegrade = orphanedPublishersDegrade;
        }

        public int getMinimumSamples() {
            return minimumSamples;
        }

        public void setMinimumSamples(int minimumSamples) {
            this.minimumSamples = minimumSamples;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "msgbus";

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
