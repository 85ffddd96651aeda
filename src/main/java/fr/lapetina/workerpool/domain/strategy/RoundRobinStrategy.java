package fr.lapetina.workerpool.domain.strategy;

import fr.lapetina.workerpool.domain.model.WorkerInstance;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Round-robin over eligible instances.
 *
 * A single monotonic cursor is shared by all selections; two concurrent
 * calls always observe different cursor values.
 */
public final class RoundRobinStrategy implements LoadBalancingStrategy {

    private final AtomicLong cursor = new AtomicLong(0);

    @Override
    public String getName() {
        return "round-robin";
    }

    @Override
    public Optional<WorkerInstance> select(List<WorkerInstance> eligible) {
        if (eligible == null || eligible.isEmpty()) {
            return Optional.empty();
        }
        int index = (int) Math.floorMod(cursor.getAndIncrement(), (long) eligible.size());
        return Optional.of(eligible.get(index));
    }
}
