package fr.lapetina.workerpool.domain.exception;

import fr.lapetina.workerpool.domain.model.ErrorType;

/**
 * Thrown when the provisioner fails to materialize a worker.
 */
public final class ProvisioningException extends WorkerPoolException {

    private final String instanceId;

    public ProvisioningException(String instanceId, Throwable cause) {
        super(ErrorType.PROVISIONING_ERROR,
                "Failed to provision instance " + instanceId + ": " + cause.getMessage(), cause);
        this.instanceId = instanceId;
    }

    public String getInstanceId() {
        return instanceId;
    }
}
