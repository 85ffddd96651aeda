package fr.lapetina.workerpool.domain.model;

import fr.lapetina.workerpool.spi.WorkerCapability;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Represents one worker in the pool.
 *
 * Busy/health/usage state is mutated by the pool manager under its lock; the
 * counters used by strategies are atomic so selection can read them from any thread.
 */
public final class WorkerInstance {
    private final String id;
    private final WorkerCapability capability;
    private final int weight;
    private final Instant createdAt;
    private final ConversationState conversation = new ConversationState();

    // Mutable state - thread-safe
    private final AtomicBoolean busy = new AtomicBoolean(false);
    private final AtomicReference<InstanceHealth> health;
    private final AtomicInteger messageCount = new AtomicInteger(0);
    private final AtomicInteger currentLoad = new AtomicInteger(0);
    private final AtomicInteger consecutiveFailures = new AtomicInteger(0);
    private volatile Instant lastUsedAt;
    private volatile Instant lastHealthCheck;
    private volatile double averageResponseTime;
    private volatile long completedExecutions;

    private WorkerInstance(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "Instance ID is required");
        this.capability = Objects.requireNonNull(builder.capability, "Capability is required");
        if (builder.weight < 1) {
            throw new IllegalArgumentException("Weight must be >= 1: " + builder.weight);
        }
        this.weight = builder.weight;
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
        this.lastUsedAt = createdAt;
        this.lastHealthCheck = createdAt;
        this.health = new AtomicReference<>(InstanceHealth.HEALTHY);
    }

    public String getId() {
        return id;
    }

    public WorkerCapability getCapability() {
        return capability;
    }

    public int getWeight() {
        return weight;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getLastUsedAt() {
        return lastUsedAt;
    }

    public ConversationState getConversation() {
        return conversation;
    }

    public boolean isBusy() {
        return busy.get();
    }

    public InstanceHealth getHealth() {
        return health.get();
    }

    /**
     * Sets the health and stamps the time of the check that decided it.
     */
    public void setHealth(InstanceHealth newHealth, Instant checkedAt) {
        this.health.set(newHealth);
        this.lastHealthCheck = checkedAt;
    }

    public boolean isHealthy() {
        return health.get() == InstanceHealth.HEALTHY;
    }

    public Instant getLastHealthCheck() {
        return lastHealthCheck;
    }

    public void recordHealthCheck(Instant at) {
        this.lastHealthCheck = at;
    }

    public int getMessageCount() {
        return messageCount.get();
    }

    public int getCurrentLoad() {
        return currentLoad.get();
    }

    public double getAverageResponseTime() {
        return averageResponseTime;
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures.get();
    }

    /**
     * Idle and healthy: the only instances a strategy may pick.
     */
    public boolean isEligible() {
        return !busy.get() && health.get() == InstanceHealth.HEALTHY;
    }

    /**
     * Marks the instance as held by one job.
     *
     * @throws IllegalStateException if another holder already has it
     */
    public void markAcquired(Instant now) {
        if (!busy.compareAndSet(false, true)) {
            throw new IllegalStateException("Instance already busy: " + id);
        }
        currentLoad.incrementAndGet();
        lastUsedAt = now;
    }

    /**
     * Returns the instance to the idle set and counts the finished job.
     */
    public void markReleased(Instant now) {
        if (busy.compareAndSet(true, false)) {
            currentLoad.decrementAndGet();
        }
        messageCount.incrementAndGet();
        lastUsedAt = now;
    }

    /**
     * Clears the busy flag without counting a job, for an instance handed out but never used.
     */
    public void markReturned() {
        if (busy.compareAndSet(true, false)) {
            currentLoad.decrementAndGet();
        }
    }

    /**
     * Message budget or age exceeded, or health lost.
     */
    public boolean shouldRecycle(int maxMessages, Duration maxAge, Instant now) {
        return messageCount.get() > maxMessages
                || Duration.between(createdAt, now).compareTo(maxAge) > 0
                || health.get() == InstanceHealth.UNHEALTHY;
    }

    /**
     * Idle for longer than the stale timeout.
     */
    public boolean isStale(Duration staleTimeout, Instant now) {
        return !busy.get() && Duration.between(lastUsedAt, now).compareTo(staleTimeout) > 0;
    }

    /**
     * Folds a successful execution latency into the running mean.
     */
    public synchronized void recordSuccess(long latencyMs) {
        consecutiveFailures.set(0);
        completedExecutions++;
        averageResponseTime += (latencyMs - averageResponseTime) / completedExecutions;
    }

    public int recordFailure() {
        return consecutiveFailures.incrementAndGet();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkerInstance that = (WorkerInstance) o;
        return id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "WorkerInstance{" +
                "id='" + id + '\'' +
                ", busy=" + busy.get() +
                ", health=" + health.get() +
                ", messages=" + messageCount.get() +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private WorkerCapability capability;
        private int weight = 1;
        private Instant createdAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder capability(WorkerCapability capability) {
            this.capability = capability;
            return this;
        }

        public Builder weight(int weight) {
            this.weight = weight;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public WorkerInstance build() {
            return new WorkerInstance(this);
        }
    }
}
