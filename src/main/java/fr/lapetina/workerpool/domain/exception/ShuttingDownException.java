package fr.lapetina.workerpool.domain.exception;

import fr.lapetina.workerpool.domain.model.ErrorType;

/**
 * Raised to every outstanding waiter and job when the pool shuts down.
 */
public final class ShuttingDownException extends WorkerPoolException {

    public ShuttingDownException(String message) {
        super(ErrorType.SHUTTING_DOWN, message);
    }
}
