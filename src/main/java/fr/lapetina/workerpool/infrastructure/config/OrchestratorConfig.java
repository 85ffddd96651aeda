package fr.lapetina.workerpool.infrastructure.config;

import fr.lapetina.workerpool.pool.PoolConfig;

import java.time.Duration;

/**
 * Root configuration object for the orchestrator.
 * Designed to be populated from YAML.
 */
public class OrchestratorConfig {

    private PoolSection pool = new PoolSection();
    private StrategyConfig strategy = new StrategyConfig();
    private DispatcherConfig dispatcher = new DispatcherConfig();
    private RetryConfig retry = new RetryConfig();
    private RateLimitConfig rateLimit = new RateLimitConfig();
    private MetricsConfig metrics = new MetricsConfig();

    // Getters and Setters
    public PoolSection getPool() { return pool; }
    public void setPool(PoolSection pool) { this.pool = pool; }

    public StrategyConfig getStrategy() { return strategy; }
    public void setStrategy(StrategyConfig strategy) { this.strategy = strategy; }

    public DispatcherConfig getDispatcher() { return dispatcher; }
    public void setDispatcher(DispatcherConfig dispatcher) { this.dispatcher = dispatcher; }

    public RetryConfig getRetry() { return retry; }
    public void setRetry(RetryConfig retry) { this.retry = retry; }

    public RateLimitConfig getRateLimit() { return rateLimit; }
    public void setRateLimit(RateLimitConfig rateLimit) { this.rateLimit = rateLimit; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * Converts the pool section into the validated, immutable pool configuration.
     *
     * @throws IllegalArgumentException if a bound is invalid
     */
    public PoolConfig toPoolConfig() {
        return PoolConfig.builder()
                .minInstances(pool.getMinInstances())
                .maxInstances(pool.getMaxInstances())
                .maxMessagesPerInstance(pool.getMaxMessagesPerInstance())
                .maxInstanceAge(Duration.ofMillis(pool.getMaxInstanceAgeMs()))
                .staleTimeout(Duration.ofMillis(pool.getStaleTimeoutMs()))
                .healthCheckInterval(Duration.ofMillis(pool.getHealthCheckIntervalMs()))
                .acquireTimeout(Duration.ofMillis(pool.getAcquireTimeoutMs()))
                .probeTimeout(Duration.ofMillis(pool.getProbeTimeoutMs()))
                .failureThreshold(pool.getFailureThreshold())
                .instanceIdPrefix(pool.getInstanceIdPrefix())
                .warmupOnStart(pool.isWarmupOnStart())
                .build();
    }

    /**
     * Worker pool sizing and lifecycle.
     */
    public static class PoolSection {
        private int minInstances = 2;
        private int maxInstances = 5;
        private int maxMessagesPerInstance = 100;
        private long maxInstanceAgeMs = 3_600_000;
        private long staleTimeoutMs = 600_000;
        private long healthCheckIntervalMs = 30_000;
        private long acquireTimeoutMs = 30_000;
        private long probeTimeoutMs = 5_000;
        private int failureThreshold = 3;
        private String instanceIdPrefix = "worker";
        private boolean warmupOnStart = true;

        public int getMinInstances() { return minInstances; }
        public void setMinInstances(int minInstances) { this.minInstances = minInstances; }

        public int getMaxInstances() { return maxInstances; }
        public void setMaxInstances(int maxInstances) { this.maxInstances = maxInstances; }

        public int getMaxMessagesPerInstance() { return maxMessagesPerInstance; }
        public void setMaxMessagesPerInstance(int maxMessagesPerInstance) { this.maxMessagesPerInstance = maxMessagesPerInstance; }

        public long getMaxInstanceAgeMs() { return maxInstanceAgeMs; }
        public void setMaxInstanceAgeMs(long maxInstanceAgeMs) { this.maxInstanceAgeMs = maxInstanceAgeMs; }

        public long getStaleTimeoutMs() { return staleTimeoutMs; }
        public void setStaleTimeoutMs(long staleTimeoutMs) { this.staleTimeoutMs = staleTimeoutMs; }

        public long getHealthCheckIntervalMs() { return healthCheckIntervalMs; }
        public void setHealthCheckIntervalMs(long healthCheckIntervalMs) { this.healthCheckIntervalMs = healthCheckIntervalMs; }

        public long getAcquireTimeoutMs() { return acquireTimeoutMs; }
        public void setAcquireTimeoutMs(long acquireTimeoutMs) { this.acquireTimeoutMs = acquireTimeoutMs; }

        public long getProbeTimeoutMs() { return probeTimeoutMs; }
        public void setProbeTimeoutMs(long probeTimeoutMs) { this.probeTimeoutMs = probeTimeoutMs; }

        public int getFailureThreshold() { return failureThreshold; }
        public void setFailureThreshold(int failureThreshold) { this.failureThreshold = failureThreshold; }

        public String getInstanceIdPrefix() { return instanceIdPrefix; }
        public void setInstanceIdPrefix(String instanceIdPrefix) { this.instanceIdPrefix = instanceIdPrefix; }

        public boolean isWarmupOnStart() { return warmupOnStart; }
        public void setWarmupOnStart(boolean warmupOnStart) { this.warmupOnStart = warmupOnStart; }
    }

    /**
     * Load balancing strategy configuration.
     */
    public static class StrategyConfig {
        private String type = "least-connections";

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }
    }

    /**
     * Job queue (LMAX Disruptor) and processing configuration.
     */
    public static class DispatcherConfig {
        private int ringBufferSize = 1024;
        private String waitStrategy = "blocking";
        private int maxConcurrent = 4;
        private long executionTimeoutMs = 120_000;
        private int maxPayloadLength = 100_000;
        private int completedJobRetention = 1000;

        public int getRingBufferSize() { return ringBufferSize; }
        public void setRingBufferSize(int ringBufferSize) { this.ringBufferSize = ringBufferSize; }

        public String getWaitStrategy() { return waitStrategy; }
        public void setWaitStrategy(String waitStrategy) { this.waitStrategy = waitStrategy; }

        public int getMaxConcurrent() { return maxConcurrent; }
        public void setMaxConcurrent(int maxConcurrent) { this.maxConcurrent = maxConcurrent; }

        public long getExecutionTimeoutMs() { return executionTimeoutMs; }
        public void setExecutionTimeoutMs(long executionTimeoutMs) { this.executionTimeoutMs = executionTimeoutMs; }

        public int getMaxPayloadLength() { return maxPayloadLength; }
        public void setMaxPayloadLength(int maxPayloadLength) { this.maxPayloadLength = maxPayloadLength; }

        public int getCompletedJobRetention() { return completedJobRetention; }
        public void setCompletedJobRetention(int completedJobRetention) { this.completedJobRetention = completedJobRetention; }
    }

    /**
     * Retry policy configuration.
     */
    public static class RetryConfig {
        private int maxAttempts = 3;
        private long baseDelayMs = 2_000;
        private long maxBackoffMs = 30_000;

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }

        public long getBaseDelayMs() { return baseDelayMs; }
        public void setBaseDelayMs(long baseDelayMs) { this.baseDelayMs = baseDelayMs; }

        public long getMaxBackoffMs() { return maxBackoffMs; }
        public void setMaxBackoffMs(long maxBackoffMs) { this.maxBackoffMs = maxBackoffMs; }
    }

    /**
     * Per-caller sliding window rate limit.
     */
    public static class RateLimitConfig {
        private boolean enabled = true;
        private int maxRequests = 100;
        private long windowMs = 3_600_000;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public int getMaxRequests() { return maxRequests; }
        public void setMaxRequests(int maxRequests) { this.maxRequests = maxRequests; }

        public long getWindowMs() { return windowMs; }
        public void setWindowMs(long windowMs) { this.windowMs = windowMs; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private String prefix = "worker_pool";
        private boolean jvmMetrics = true;

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }

        public boolean isJvmMetrics() { return jvmMetrics; }
        public void setJvmMetrics(boolean jvmMetrics) { this.jvmMetrics = jvmMetrics; }
    }
}
