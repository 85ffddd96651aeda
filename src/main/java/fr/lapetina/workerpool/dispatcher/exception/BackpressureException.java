package fr.lapetina.workerpool.dispatcher.exception;

import fr.lapetina.workerpool.domain.exception.WorkerPoolException;
import fr.lapetina.workerpool.domain.model.ErrorType;

/**
 * Exception thrown when the job queue cannot take another job.
 * The rejected job is never enqueued.
 */
public final class BackpressureException extends WorkerPoolException {

    private final BackpressureReason reason;

    public BackpressureException(BackpressureReason reason, String details) {
        super(ErrorType.QUEUE_FULL, "Backpressure: " + reason.getMessage() + " - " + details);
        this.reason = reason;
    }

    public BackpressureReason getReason() {
        return reason;
    }

    public enum BackpressureReason {
        RING_BUFFER_FULL("Job queue is full");

        private final String message;

        BackpressureReason(String message) {
            this.message = message;
        }

        public String getMessage() {
            return message;
        }
    }
}
