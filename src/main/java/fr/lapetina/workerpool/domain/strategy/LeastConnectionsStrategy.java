package fr.lapetina.workerpool.domain.strategy;

import fr.lapetina.workerpool.domain.model.WorkerInstance;

import java.util.List;
import java.util.Optional;

/**
 * Least-connections strategy.
 *
 * Selects the instance with the fewest in-flight jobs; ties go to the
 * first instance in pool order.
 */
public final class LeastConnectionsStrategy implements LoadBalancingStrategy {

    @Override
    public String getName() {
        return "least-connections";
    }

    @Override
    public Optional<WorkerInstance> select(List<WorkerInstance> eligible) {
        if (eligible == null || eligible.isEmpty()) {
            return Optional.empty();
        }

        WorkerInstance selected = null;
        int minLoad = Integer.MAX_VALUE;
        for (WorkerInstance instance : eligible) {
            int load = instance.getCurrentLoad();
            if (load < minLoad) {
                minLoad = load;
                selected = instance;
            }
        }
        return Optional.ofNullable(selected);
    }
}
