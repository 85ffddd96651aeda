package fr.lapetina.workerpool.domain.strategy;

import fr.lapetina.workerpool.domain.model.WorkerInstance;

import java.util.List;
import java.util.Optional;

/**
 * Picks the instance a job should run on.
 *
 * Called by the pool manager while it holds its lock, with every instance that is
 * not due for recycling. The returned instance is only used if it is eligible.
 */
@FunctionalInterface
public interface InstanceSelector {

    Optional<WorkerInstance> select(List<WorkerInstance> candidates);
}
