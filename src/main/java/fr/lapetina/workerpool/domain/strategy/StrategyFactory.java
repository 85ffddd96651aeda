package fr.lapetina.workerpool.domain.strategy;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Factory for creating load balancing strategies by name.
 */
public final class StrategyFactory {

    private static final Map<String, Supplier<LoadBalancingStrategy>> REGISTRY = new ConcurrentHashMap<>();

    static {
        // Register built-in strategies
        register("round-robin", RoundRobinStrategy::new);
        register("least-connections", LeastConnectionsStrategy::new);
        register("weighted-random", WeightedRandomStrategy::new);
        register("weighted", WeightedRandomStrategy::new);
        register("response-time", ResponseTimeStrategy::new);
    }

    private StrategyFactory() {
        // Utility class
    }

    /**
     * Registers a custom strategy.
     *
     * @param name     Strategy name (used in configuration and per-job options)
     * @param supplier Factory for creating strategy instances
     */
    public static void register(String name, Supplier<LoadBalancingStrategy> supplier) {
        REGISTRY.put(name.toLowerCase(), supplier);
    }

    /**
     * Creates a strategy by name.
     *
     * @return Strategy instance, or empty if not found
     */
    public static Optional<LoadBalancingStrategy> create(String name) {
        if (name == null) {
            return Optional.empty();
        }
        Supplier<LoadBalancingStrategy> supplier = REGISTRY.get(name.toLowerCase());
        if (supplier == null) {
            return Optional.empty();
        }
        return Optional.of(supplier.get());
    }

    /**
     * Creates a strategy by name, with default fallback.
     */
    public static LoadBalancingStrategy createOrDefault(String name, LoadBalancingStrategy defaultStrategy) {
        return create(name).orElse(defaultStrategy);
    }

    /**
     * Returns all registered strategy names.
     */
    public static Iterable<String> getRegisteredNames() {
        return REGISTRY.keySet();
    }
}
