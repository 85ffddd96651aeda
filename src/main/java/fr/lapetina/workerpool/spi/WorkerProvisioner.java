package fr.lapetina.workerpool.spi;

/**
 * Materializes the capability behind a new worker instance.
 */
@FunctionalInterface
public interface WorkerProvisioner {

    /**
     * @param instanceId id assigned by the pool to the new instance
     * @return a ready-to-use capability
     * @throws Exception if the worker could not be started
     */
    WorkerCapability provision(String instanceId) throws Exception;
}
