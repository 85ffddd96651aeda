package fr.lapetina.workerpool.domain.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A unit of work submitted by a caller.
 *
 * Owned by the dispatcher from submission until it reaches a terminal state.
 * State changes go through compare-and-set so a cancel racing a dispatch has
 * exactly one winner.
 */
public final class Job {
    private final String id;
    private final String callerId;
    private final String payload;
    private final Integer priority;
    private final int maxAttempts;
    private final String strategy;
    private final Duration executionTimeout;
    private final Instant createdAt;
    private final CompletableFuture<JobResult> result = new CompletableFuture<>();

    private final AtomicReference<JobState> state = new AtomicReference<>(JobState.QUEUED);
    private final AtomicInteger attempts = new AtomicInteger(0);
    private volatile Instant enqueuedAt;
    private volatile ErrorType lastErrorType;
    private volatile String lastErrorMessage;

    public Job(String callerId, String payload, SubmitOptions options, int defaultMaxAttempts) {
        this.id = UUID.randomUUID().toString();
        this.callerId = Objects.requireNonNull(callerId, "Caller ID is required");
        this.payload = payload;
        this.priority = options.priority();
        this.maxAttempts = options.maxAttempts() != null ? options.maxAttempts() : defaultMaxAttempts;
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1: " + maxAttempts);
        }
        this.strategy = options.strategy();
        this.executionTimeout = options.executionTimeout();
        this.createdAt = Instant.now();
        this.enqueuedAt = createdAt;
    }

    public String getId() {
        return id;
    }

    public String getCallerId() {
        return callerId;
    }

    public String getPayload() {
        return payload;
    }

    public Integer getPriority() {
        return priority;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /** Strategy override for this job, or null to use the pool default. */
    public String getStrategy() {
        return strategy;
    }

    /** Execution timeout override for this job, or null to use the dispatcher default. */
    public Duration getExecutionTimeout() {
        return executionTimeout;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    /** Last time the job was published to the queue, on submission or for a retry. */
    public Instant getEnqueuedAt() {
        return enqueuedAt;
    }

    public void markEnqueued(Instant at) {
        this.enqueuedAt = at;
    }

    public CompletableFuture<JobResult> getResult() {
        return result;
    }

    public JobState getState() {
        return state.get();
    }

    public boolean transition(JobState expected, JobState next) {
        return state.compareAndSet(expected, next);
    }

    public int getAttempts() {
        return attempts.get();
    }

    public int incrementAttempts() {
        return attempts.incrementAndGet();
    }

    public boolean hasAttemptsLeft() {
        return attempts.get() < maxAttempts;
    }

    public ErrorType getLastErrorType() {
        return lastErrorType;
    }

    public String getLastErrorMessage() {
        return lastErrorMessage;
    }

    public void recordError(ErrorType type, String message) {
        this.lastErrorType = type;
        this.lastErrorMessage = message;
    }

    /**
     * Moves the job to COMPLETED, runs {@code onTransition}, then completes its future.
     *
     * @return false if the job was already terminal; {@code onTransition} does not run then
     */
    public boolean complete(String output, String instanceId, Runnable onTransition) {
        if (!state.compareAndSet(JobState.DISPATCHED, JobState.COMPLETED)) {
            return false;
        }
        onTransition.run();
        result.complete(JobResult.success(id, output, instanceId, attempts.get(), createdAt));
        return true;
    }

    /**
     * Moves the job to FAILED from any non-terminal state, runs {@code onTransition},
     * then completes its future.
     *
     * @return false if the job was already terminal; {@code onTransition} does not run then
     */
    public boolean fail(ErrorType type, String message, String instanceId, Runnable onTransition) {
        while (true) {
            JobState current = state.get();
            if (current.isTerminal()) {
                return false;
            }
            if (state.compareAndSet(current, JobState.FAILED)) {
                recordError(type, message);
                onTransition.run();
                result.complete(JobResult.failure(id, type, message, instanceId, attempts.get(), createdAt));
                return true;
            }
        }
    }

    @Override
    public String toString() {
        return "Job{" +
                "id='" + id + '\'' +
                ", callerId='" + callerId + '\'' +
                ", state=" + state.get() +
                ", attempts=" + attempts.get() + "/" + maxAttempts +
                '}';
    }
}
