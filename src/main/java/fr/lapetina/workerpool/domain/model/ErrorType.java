package fr.lapetina.workerpool.domain.model;

/**
 * Error taxonomy for pool operations and job outcomes.
 * Provides clear categorization for retry decisions and metrics.
 */
public enum ErrorType {
    /** Pool is at its maximum size and no instance can be created */
    CAPACITY_ERROR(true),

    /** The provisioner failed to materialize a worker */
    PROVISIONING_ERROR(true),

    /** Acquire timed out waiting for a free instance */
    NO_INSTANCE_AVAILABLE(true),

    /** Caller exceeded its request quota for the current window */
    RATE_LIMIT_EXCEEDED(false),

    /** The worker did not answer before the execution deadline */
    EXECUTION_TIMEOUT(true),

    /** The worker failed while executing the job */
    EXECUTION_ERROR(true),

    /** Job payload rejected before dispatch */
    VALIDATION_ERROR(false),

    /** Job queue has no free slot */
    QUEUE_FULL(false),

    /** Job cancelled by the caller before it ran */
    CANCELLED(false),

    /** Referenced instance or job does not exist */
    NOT_FOUND(false),

    /** Pool or dispatcher is shutting down */
    SHUTTING_DOWN(false),

    /** Internal system error */
    INTERNAL_ERROR(false);

    private final boolean retryable;

    ErrorType(boolean retryable) {
        this.retryable = retryable;
    }

    /**
     * Whether a job failing with this error may be dispatched again.
     */
    public boolean isRetryable() {
        return retryable;
    }
}
