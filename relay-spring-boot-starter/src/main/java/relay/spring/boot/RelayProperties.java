package relay.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for outbound dispatch.
 *
 * @see RelayAutoConfiguration
 */
@ConfigurationProperties(prefix = "relay")
public class RelayProperties {

    private final Dispatch dispatch = new Dispatch();
    private final DeadLetter deadLetter = new DeadLetter();
    private final Dedupe dedupe = new Dedupe();
    private final RateLimit rateLimit = new RateLimit();
    private final CircuitBreaker circuitBreaker = new CircuitBreaker();
    private final Metrics metrics = new Metrics();

    public Dispatch getDispatch() {
        return dispatch;
    }

    public DeadLetter getDeadLetter() {
        return deadLetter;
    }

    public Dedupe getDedupe() {
        return dedupe;
    }

    public RateLimit getRateLimit() {
        return rateLimit;
    }

    public CircuitBreaker getCircuitBreaker() {
        return circuitBreaker;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Dispatch {
        /**
         * Extra transmission attempts made inside a single send call.
         */
        private int inlineRetries = 0;
        /**
         * Out-of-band retries (re-publications on the bus) before dead-lettering.
         */
        private int retryMax = 3;
        private long retryBaseMs = 700;
        private long retryMaxMs = 25000;
        private long retryJitterMs = 250;
        /**
         * How long the consume loop blocks on the outbound lane per iteration.
         */
        private long consumeTimeoutMs = 2000;
        /**
         * Start the consume loop when the context starts.
         */
        private boolean autoStart = true;

        public int getInlineRetries() {
            return inlineRetries;
        }

        public void setInlineRetries(int inlineRetries) {
            this.inlineRetries = inlineRetries;
        }

        public int getRetryMax() {
            return retryMax;
        }

        public void setRetryMax(int retryMax) {
            this.retryMax = retryMax;
        }

        public long getRetryBaseMs() {
            return retryBaseMs;
        }

        public void setRetryBaseMs(long retryBaseMs) {
            this.retryBaseMs = retryBaseMs;
        }

        public long getRetryMaxMs() {
            return retryMaxMs;
        }

        public void setRetryMaxMs(long retryMaxMs) {
            this.retryMaxMs = retryMaxMs;
        }

        public long getRetryJitterMs() {
            return retryJitterMs;
        }

        public void setRetryJitterMs(long retryJitterMs) {
            this.retryJitterMs = retryJitterMs;
        }

        public long getConsumeTimeoutMs() {
            return consumeTimeoutMs;
        }

        public void setConsumeTimeoutMs(long consumeTimeoutMs) {
            this.consumeTimeoutMs = consumeTimeoutMs;
        }

        public boolean isAutoStart() {
            return autoStart;
        }

        public void setAutoStart(boolean autoStart) {
            this.autoStart = autoStart;
        }
    }

    public static class DeadLetter {
        private boolean enabled = true;
        /**
         * Embedded H2 database file, without the {@code .mv.db} suffix.
         */
        private String path = "data/dlq/dlq";
        private String tableName = "outbound_dlq";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }

        public String getTableName() {
            return tableName;
        }

        public void setTableName(String tableName) {
            this.tableName = tableName;
        }
    }

    public static class Dedupe {
        private long ttlMs = 25000;
        private int maxSize = 20000;

        public long getTtlMs() {
            return ttlMs;
        }

        public void setTtlMs(long ttlMs) {
            this.ttlMs = ttlMs;
        }

        public int getMaxSize() {
            return maxSize;
        }

        public void setMaxSize(int maxSize) {
            this.maxSize = maxSize;
        }
    }

    public static class RateLimit {
        private long capacity = 30;
        private long refillRate = 1;
        private long refillIntervalMs = 1000;

        public long getCapacity() {
            return capacity;
        }

        public void setCapacity(long capacity) {
            this.capacity = capacity;
        }

        public long getRefillRate() {
            return refillRate;
        }

        public void setRefillRate(long refillRate) {
            this.refillRate = refillRate;
        }

        public long getRefillIntervalMs() {
            return refillIntervalMs;
        }

        public void setRefillIntervalMs(long refillIntervalMs) {
            this.refillIntervalMs = refillIntervalMs;
        }
    }

    public static class CircuitBreaker {
        private boolean enabled = false;
        private int failureThreshold = 5;
        private long resetTimeoutMs = 30000;
        private int halfOpenMax = 1;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getFailureThreshold() {
            return failureThreshold;
        }

        public void setFailureThreshold(int failureThreshold) {
            this.failureThreshold = failureThreshold;
        }

        public long getResetTimeoutMs() {
            return resetTimeoutMs;
        }

        public void setResetTimeoutMs(long resetTimeoutMs) {
            this.resetTimeoutMs = resetTimeoutMs;
        }

        public int getHalfOpenMax() {
            return halfOpenMax;
        }

        public void setHalfOpenMax(int halfOpenMax) {
            this.halfOpenMax = halfOpenMax;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "relay";

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
