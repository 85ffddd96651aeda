package fr.lapetina.workerpool.domain.event;

/**
 * Kinds of notification emitted by the pool and the dispatcher.
 */
public enum PoolEventType {
    INSTANCE_CREATED,
    INSTANCE_RECYCLED,
    HEALTH_CHECK_COMPLETED,
    JOB_QUEUED,
    JOB_DISPATCHED,
    JOB_RETRY_SCHEDULED,
    JOB_COMPLETED,
    JOB_FAILED,
    POOL_INITIALIZED,
    POOL_SHUTDOWN
}
