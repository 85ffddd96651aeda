package fr.lapetina.workerpool.dispatcher;

import fr.lapetina.workerpool.domain.model.ErrorType;
import fr.lapetina.workerpool.domain.model.Job;

import java.time.Instant;

/**
 * Event object for the LMAX Disruptor ring buffer.
 *
 * Mutable holder reused across the ring buffer. Only the handler stages touch it;
 * the {@link Job} it carries is what outlives the slot.
 */
public final class JobEvent {

    private Job job;
    private ErrorType errorType;
    private String errorMessage;
    private Instant publishedAt;
    private long sequence;

    /**
     * Clears the event for reuse.
     */
    public void clear() {
        this.job = null;
        this.errorType = null;
        this.errorMessage = null;
        this.publishedAt = null;
        this.sequence = -1;
    }

    public void initialize(Job job) {
        clear();
        this.job = job;
        this.publishedAt = Instant.now();
    }

    public Job getJob() {
        return job;
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public Instant getPublishedAt() {
        return publishedAt;
    }

    public long getSequence() {
        return sequence;
    }

    public void setSequence(long sequence) {
        this.sequence = sequence;
    }

    public void setError(ErrorType errorType, String message) {
        this.errorType = errorType;
        this.errorMessage = message;
    }

    public boolean hasError() {
        return errorType != null;
    }

    @Override
    public String toString() {
        return "JobEvent{" +
                "jobId=" + (job != null ? job.getId() : "null") +
                ", error=" + errorType +
                ", seq=" + sequence +
                '}';
    }
}
