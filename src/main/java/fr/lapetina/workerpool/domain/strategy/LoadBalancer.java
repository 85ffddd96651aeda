package fr.lapetina.workerpool.domain.strategy;

import fr.lapetina.workerpool.domain.model.WorkerInstance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Applies the active {@link LoadBalancingStrategy} to the eligible subset of candidates.
 *
 * When nothing is eligible, returns the least-loaded instance overall (healthy
 * first) as a best-effort target. That target is busy or unhealthy, so the pool
 * manager will not hand it out; it only tells the caller where it would have gone.
 */
public final class LoadBalancer implements InstanceSelector {

    private static final Logger log = LoggerFactory.getLogger(LoadBalancer.class);

    private static final Comparator<WorkerInstance> FALLBACK_ORDER = Comparator
            .comparing((WorkerInstance i) -> !i.isHealthy())
            .thenComparingInt(WorkerInstance::getCurrentLoad);

    private final AtomicReference<LoadBalancingStrategy> strategy;
    private final Map<String, LoadBalancingStrategy> overrides = new ConcurrentHashMap<>();

    public LoadBalancer(LoadBalancingStrategy strategy) {
        this.strategy = new AtomicReference<>(Objects.requireNonNull(strategy, "Strategy is required"));
    }

    public LoadBalancer(String strategyName) {
        this(StrategyFactory.create(strategyName)
                .orElseThrow(() -> new IllegalArgumentException("Unknown strategy: " + strategyName)));
    }

    public LoadBalancingStrategy getStrategy() {
        return strategy.get();
    }

    /**
     * Swaps the default strategy at runtime.
     */
    public void setStrategy(LoadBalancingStrategy newStrategy) {
        LoadBalancingStrategy previous = strategy.getAndSet(Objects.requireNonNull(newStrategy));
        log.info("Load balancing strategy changed: previous={}, current={}",
                previous.getName(), newStrategy.getName());
    }

    @Override
    public Optional<WorkerInstance> select(List<WorkerInstance> candidates) {
        return select(candidates, strategy.get());
    }

    /**
     * Returns a selector that uses the named strategy instead of the default one.
     * Unknown or null names fall back to the default strategy.
     */
    public InstanceSelector selector(String strategyName) {
        if (strategyName == null) {
            return this;
        }
        LoadBalancingStrategy override = resolve(strategyName);
        if (override == null) {
            log.warn("Unknown strategy requested, using default: strategy={}, default={}",
                    strategyName, strategy.get().getName());
            return this;
        }
        return candidates -> select(candidates, override);
    }

    private LoadBalancingStrategy resolve(String strategyName) {
        String key = strategyName.toLowerCase();
        LoadBalancingStrategy cached = overrides.get(key);
        if (cached != null) {
            return cached;
        }
        Optional<LoadBalancingStrategy> created = StrategyFactory.create(key);
        if (created.isEmpty()) {
            return null;
        }
        LoadBalancingStrategy existing = overrides.putIfAbsent(key, created.get());
        return existing != null ? existing : created.get();
    }

    private Optional<WorkerInstance> select(List<WorkerInstance> candidates, LoadBalancingStrategy active) {
        if (candidates == null || candidates.isEmpty()) {
            return Optional.empty();
        }

        List<WorkerInstance> eligible = candidates.stream()
                .filter(WorkerInstance::isEligible)
                .toList();

        if (!eligible.isEmpty()) {
            return active.select(eligible);
        }

        Optional<WorkerInstance> fallback = candidates.stream().min(FALLBACK_ORDER);
        fallback.ifPresent(instance -> log.debug(
                "No eligible instance, least-loaded fallback: instanceId={}, busy={}, health={}",
                instance.getId(), instance.isBusy(), instance.getHealth()));
        return fallback;
    }

    public void recordSuccess(WorkerInstance instance, long latencyMs) {
        strategy.get().recordSuccess(instance, latencyMs);
        overrides.values().forEach(s -> s.recordSuccess(instance, latencyMs));
    }

    public void recordFailure(WorkerInstance instance) {
        strategy.get().recordFailure(instance);
        overrides.values().forEach(s -> s.recordFailure(instance));
    }
}
