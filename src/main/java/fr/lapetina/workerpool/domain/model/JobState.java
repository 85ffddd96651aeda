package fr.lapetina.workerpool.domain.model;

/**
 * Lifecycle of a job owned by the dispatcher.
 *
 * QUEUED -> DISPATCHED -> COMPLETED
 * QUEUED -> DISPATCHED -> RETRY_PENDING -> QUEUED (attempts left)
 * any non-terminal state -> FAILED
 */
public enum JobState {
    QUEUED,
    DISPATCHED,
    RETRY_PENDING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
