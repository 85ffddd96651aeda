package fr.lapetina.workerpool.spi;

import fr.lapetina.workerpool.domain.model.JobResult;

/**
 * External persistence for terminal job outcomes, keyed by job id.
 * The orchestrator never reads it back.
 */
@FunctionalInterface
public interface JobHistoryStore {

    /** Store that keeps nothing. */
    JobHistoryStore NONE = (callerId, result) -> { };

    /**
     * Called once per job when it reaches a terminal state.
     */
    void record(String callerId, JobResult result);
}
