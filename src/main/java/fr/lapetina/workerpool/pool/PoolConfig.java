package fr.lapetina.workerpool.pool;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable pool sizing and lifecycle limits. Validated on construction.
 */
public final class PoolConfig {

    private final int minInstances;
    private final int maxInstances;
    private final int maxMessagesPerInstance;
    private final Duration maxInstanceAge;
    private final Duration staleTimeout;
    private final Duration healthCheckInterval;
    private final Duration acquireTimeout;
    private final Duration probeTimeout;
    private final int failureThreshold;
    private final String instanceIdPrefix;
    private final boolean warmupOnStart;

    private PoolConfig(Builder builder) {
        if (builder.minInstances < 0) {
            throw new IllegalArgumentException("minInstances must be >= 0: " + builder.minInstances);
        }
        if (builder.maxInstances < 1) {
            throw new IllegalArgumentException("maxInstances must be >= 1: " + builder.maxInstances);
        }
        if (builder.minInstances > builder.maxInstances) {
            throw new IllegalArgumentException("minInstances (" + builder.minInstances
                    + ") must not exceed maxInstances (" + builder.maxInstances + ")");
        }
        if (builder.maxMessagesPerInstance < 1) {
            throw new IllegalArgumentException("maxMessagesPerInstance must be >= 1: "
                    + builder.maxMessagesPerInstance);
        }
        if (builder.failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1: " + builder.failureThreshold);
        }
        this.minInstances = builder.minInstances;
        this.maxInstances = builder.maxInstances;
        this.maxMessagesPerInstance = builder.maxMessagesPerInstance;
        this.maxInstanceAge = positive("maxInstanceAge", builder.maxInstanceAge);
        this.staleTimeout = positive("staleTimeout", builder.staleTimeout);
        this.healthCheckInterval = positive("healthCheckInterval", builder.healthCheckInterval);
        this.acquireTimeout = positive("acquireTimeout", builder.acquireTimeout);
        this.probeTimeout = positive("probeTimeout", builder.probeTimeout);
        this.failureThreshold = builder.failureThreshold;
        if (builder.instanceIdPrefix == null || builder.instanceIdPrefix.isBlank()) {
            throw new IllegalArgumentException("instanceIdPrefix must not be blank");
        }
        this.instanceIdPrefix = builder.instanceIdPrefix;
        this.warmupOnStart = builder.warmupOnStart;
    }

    private static Duration positive(String name, Duration value) {
        Objects.requireNonNull(value, name + " is required");
        if (value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive: " + value);
        }
        return value;
    }

    public int getMinInstances() {
        return minInstances;
    }

    public int getMaxInstances() {
        return maxInstances;
    }

    public int getMaxMessagesPerInstance() {
        return maxMessagesPerInstance;
    }

    public Duration getMaxInstanceAge() {
        return maxInstanceAge;
    }

    public Duration getStaleTimeout() {
        return staleTimeout;
    }

    public Duration getHealthCheckInterval() {
        return healthCheckInterval;
    }

    public Duration getAcquireTimeout() {
        return acquireTimeout;
    }

    public Duration getProbeTimeout() {
        return probeTimeout;
    }

    public int getFailureThreshold() {
        return failureThreshold;
    }

    public String getInstanceIdPrefix() {
        return instanceIdPrefix;
    }

    /**
     * Whether the initial instances are probed before the orchestrator reports ready.
     */
    public boolean isWarmupOnStart() {
        return warmupOnStart;
    }

    @Override
    public String toString() {
        return "PoolConfig{" +
                "min=" + minInstances +
                ", max=" + maxInstances +
                ", maxMessages=" + maxMessagesPerInstance +
                ", maxAge=" + maxInstanceAge +
                ", staleTimeout=" + staleTimeout +
                ", healthCheckInterval=" + healthCheckInterval +
                ", acquireTimeout=" + acquireTimeout +
                ", warmupOnStart=" + warmupOnStart +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int minInstances = 2;
        private int maxInstances = 5;
        private int maxMessagesPerInstance = 100;
        private Duration maxInstanceAge = Duration.ofHours(1);
        private Duration staleTimeout = Duration.ofMinutes(10);
        private Duration healthCheckInterval = Duration.ofSeconds(30);
        private Duration acquireTimeout = Duration.ofSeconds(30);
        private Duration probeTimeout = Duration.ofSeconds(5);
        private int failureThreshold = 3;
        private String instanceIdPrefix = "worker";
        private boolean warmupOnStart = true;

        public Builder minInstances(int minInstances) {
            this.minInstances = minInstances;
            return this;
        }

        public Builder maxInstances(int maxInstances) {
            this.maxInstances = maxInstances;
            return this;
        }

        public Builder maxMessagesPerInstance(int maxMessagesPerInstance) {
            this.maxMessagesPerInstance = maxMessagesPerInstance;
            return this;
        }

        public Builder maxInstanceAge(Duration maxInstanceAge) {
            this.maxInstanceAge = maxInstanceAge;
            return this;
        }

        public Builder staleTimeout(Duration staleTimeout) {
            this.staleTimeout = staleTimeout;
            return this;
        }

        public Builder healthCheckInterval(Duration healthCheckInterval) {
            this.healthCheckInterval = healthCheckInterval;
            return this;
        }

        public Builder acquireTimeout(Duration acquireTimeout) {
            this.acquireTimeout = acquireTimeout;
            return this;
        }

        public Builder probeTimeout(Duration probeTimeout) {
            this.probeTimeout = probeTimeout;
            return this;
        }

        public Builder failureThreshold(int failureThreshold) {
            this.failureThreshold = failureThreshold;
            return this;
        }

        public Builder instanceIdPrefix(String instanceIdPrefix) {
            this.instanceIdPrefix = instanceIdPrefix;
            return this;
        }

        public Builder warmupOnStart(boolean warmupOnStart) {
            this.warmupOnStart = warmupOnStart;
            return this;
        }

        public PoolConfig build() {
            return new PoolConfig(this);
        }
    }
}
