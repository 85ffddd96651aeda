package fr.lapetina.workerpool.domain.exception;

import fr.lapetina.workerpool.domain.model.ErrorType;

import java.time.Duration;

/**
 * Thrown when acquire times out before any instance frees up.
 */
public final class NoInstanceAvailableException extends WorkerPoolException {

    public NoInstanceAvailableException(Duration timeout) {
        super(ErrorType.NO_INSTANCE_AVAILABLE,
                "No worker instance available within " + timeout.toMillis() + "ms");
    }
}
