package fr.lapetina.workerpool.domain.exception;

import fr.lapetina.workerpool.domain.model.ErrorType;

/**
 * Base class for every error raised by the orchestrator.
 * Carries an {@link ErrorType} so callers and the dispatcher can classify it
 * without inspecting the concrete class.
 */
public class WorkerPoolException extends RuntimeException {

    private final ErrorType errorType;

    public WorkerPoolException(ErrorType errorType, String message) {
        super(message);
        this.errorType = errorType;
    }

    public WorkerPoolException(ErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    /**
     * Whether the dispatcher may retry a job that failed with this error.
     */
    public boolean isRetryable() {
        return errorType.isRetryable();
    }
}
