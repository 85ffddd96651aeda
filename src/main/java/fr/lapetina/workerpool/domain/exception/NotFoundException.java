package fr.lapetina.workerpool.domain.exception;

import fr.lapetina.workerpool.domain.model.ErrorType;

/**
 * Thrown when an instance or job id is unknown.
 */
public final class NotFoundException extends WorkerPoolException {

    public NotFoundException(String what, String id) {
        super(ErrorType.NOT_FOUND, what + " not found: " + id);
    }
}
