package fr.lapetina.workerpool.domain.strategy;

import fr.lapetina.workerpool.domain.model.WorkerInstance;

import java.util.List;
import java.util.Optional;

/**
 * Strategy interface for load balancing across worker instances.
 *
 * Implementations must be thread-safe. They only ever see eligible
 * (idle and healthy) instances.
 */
public interface LoadBalancingStrategy {

    /**
     * Returns the name of this strategy for configuration and metrics.
     */
    String getName();

    /**
     * Selects an instance among eligible ones.
     *
     * @param eligible idle, healthy instances in pool order
     * @return selected instance, or empty if the list is empty
     */
    Optional<WorkerInstance> select(List<WorkerInstance> eligible);

    /**
     * Called when an instance successfully completes a job. Strategies that
     * only look at the current snapshot ignore it.
     *
     * @param instance  the instance that completed the job
     * @param latencyMs the execution latency in milliseconds
     */
    default void recordSuccess(WorkerInstance instance, long latencyMs) {
    }

    /**
     * Called when an instance fails to complete a job.
     */
    default void recordFailure(WorkerInstance instance) {
    }
}
