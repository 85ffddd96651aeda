package fr.lapetina.workerpool.domain.exception;

import fr.lapetina.workerpool.domain.model.ErrorType;

import java.time.Duration;

/**
 * Thrown when a worker does not answer before the execution deadline.
 * The instance that timed out is recycled, never released.
 */
public final class ExecutionTimeoutException extends WorkerPoolException {

    public ExecutionTimeoutException(String instanceId, Duration timeout) {
        super(ErrorType.EXECUTION_TIMEOUT,
                "Timeout waiting for response from instance " + instanceId
                        + " after " + timeout.toMillis() + "ms");
    }
}
