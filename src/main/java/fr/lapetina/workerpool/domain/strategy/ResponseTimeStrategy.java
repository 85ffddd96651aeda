package fr.lapetina.workerpool.domain.strategy;

import fr.lapetina.workerpool.domain.model.WorkerInstance;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.WeakHashMap;

/**
 * Picks the instance with the lowest average response time.
 *
 * Instances that have not completed a job yet average 0 and are tried first.
 * Each failure reported since an instance's last success adds a fixed penalty
 * to its score; the next success clears it. Ties go to the first instance in
 * pool order.
 */
public final class ResponseTimeStrategy implements LoadBalancingStrategy {

    static final long DEFAULT_FAILURE_PENALTY_MS = 5_000;

    private final long failurePenaltyMs;

    // Weak keys: recycled instances drop out once the pool releases them.
    private final Map<WorkerInstance, Integer> recentFailures =
            Collections.synchronizedMap(new WeakHashMap<>());

    public ResponseTimeStrategy() {
        this(DEFAULT_FAILURE_PENALTY_MS);
    }

    /**
     * @param failurePenaltyMs milliseconds added to an instance's score per unrecovered failure
     */
    public ResponseTimeStrategy(long failurePenaltyMs) {
        if (failurePenaltyMs < 0) {
            throw new IllegalArgumentException("failurePenaltyMs must be >= 0");
        }
        this.failurePenaltyMs = failurePenaltyMs;
    }

    @Override
    public String getName() {
        return "response-time";
    }

    @Override
    public Optional<WorkerInstance> select(List<WorkerInstance> eligible) {
        if (eligible == null || eligible.isEmpty()) {
            return Optional.empty();
        }

        WorkerInstance selected = null;
        double best = Double.MAX_VALUE;
        for (WorkerInstance instance : eligible) {
            double score = score(instance);
            if (score < best) {
                best = score;
                selected = instance;
            }
        }
        return Optional.ofNullable(selected);
    }

    @Override
    public void recordSuccess(WorkerInstance instance, long latencyMs) {
        recentFailures.remove(instance);
    }

    @Override
    public void recordFailure(WorkerInstance instance) {
        recentFailures.merge(instance, 1, Integer::sum);
    }

    double score(WorkerInstance instance) {
        int failures = recentFailures.getOrDefault(instance, 0);
        return instance.getAverageResponseTime() + (double) failures * failurePenaltyMs;
    }
}
