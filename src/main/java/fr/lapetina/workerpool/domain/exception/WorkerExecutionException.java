package fr.lapetina.workerpool.domain.exception;

import fr.lapetina.workerpool.domain.model.ErrorType;

/**
 * Downstream failure while a worker executes a job.
 *
 * Retryable by default. Capabilities throw {@link #terminal(String)} when
 * retrying cannot help (bad input, explicit refusal).
 */
public final class WorkerExecutionException extends WorkerPoolException {

    private final boolean terminal;

    public WorkerExecutionException(String message, Throwable cause) {
        this(message, cause, false);
    }

    private WorkerExecutionException(String message, Throwable cause, boolean terminal) {
        super(ErrorType.EXECUTION_ERROR, message, cause);
        this.terminal = terminal;
    }

    /**
     * Creates an error that stops any further attempt of the job.
     */
    public static WorkerExecutionException terminal(String message) {
        return new WorkerExecutionException(message, null, true);
    }

    public boolean isTerminal() {
        return terminal;
    }

    @Override
    public boolean isRetryable() {
        return !terminal;
    }
}
