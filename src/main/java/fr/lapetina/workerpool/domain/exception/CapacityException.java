package fr.lapetina.workerpool.domain.exception;

import fr.lapetina.workerpool.domain.model.ErrorType;

/**
 * Thrown when the pool is at its maximum size and no instance can be created.
 */
public final class CapacityException extends WorkerPoolException {

    public CapacityException(int poolSize, int maxInstances) {
        super(ErrorType.CAPACITY_ERROR,
                "Maximum pool size reached: " + poolSize + "/" + maxInstances);
    }
}
