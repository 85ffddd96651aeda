package fr.lapetina.workerpool.domain.strategy;

import fr.lapetina.workerpool.domain.model.WorkerInstance;

import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;

/**
 * Weighted random strategy.
 *
 * Draws uniformly on [0, totalWeight) and walks the cumulative weights, so an
 * instance of weight 2 is picked twice as often as one of weight 1.
 */
public final class WeightedRandomStrategy implements LoadBalancingStrategy {

    private final Supplier<Random> random;

    public WeightedRandomStrategy() {
        this(ThreadLocalRandom::current);
    }

    /**
     * @param random source of randomness, injectable for deterministic tests
     */
    public WeightedRandomStrategy(Supplier<Random> random) {
        this.random = random;
    }

    @Override
    public String getName() {
        return "weighted-random";
    }

    @Override
    public Optional<WorkerInstance> select(List<WorkerInstance> eligible) {
        if (eligible == null || eligible.isEmpty()) {
            return Optional.empty();
        }

        long totalWeight = 0;
        for (WorkerInstance instance : eligible) {
            totalWeight += instance.getWeight();
        }

        double draw = random.get().nextDouble() * totalWeight;
        double cumulative = 0;
        for (WorkerInstance instance : eligible) {
            cumulative += instance.getWeight();
            if (draw < cumulative) {
                return Optional.of(instance);
            }
        }
        // Rounding on the last bucket
        return Optional.of(eligible.get(eligible.size() - 1));
    }
}
