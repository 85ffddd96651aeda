package fr.lapetina.workerpool.infrastructure.metrics;

import fr.lapetina.workerpool.domain.model.InstanceSnapshot;
import fr.lapetina.workerpool.domain.model.PoolStats;
import fr.lapetina.workerpool.domain.model.WorkerInstance;
import fr.lapetina.workerpool.pool.PoolConfig;
import fr.lapetina.workerpool.pool.PoolManager;

import java.util.ArrayList;
import java.util.List;
import java.util.function.IntSupplier;

/**
 * Computes {@link PoolStats} on demand from the live instance set and the job counters.
 * Has no write path.
 */
public final class StatsAggregator {

    private final PoolManager pool;
    private final JobCounters counters;
    private final IntSupplier queueDepth;

    public StatsAggregator(PoolManager pool, JobCounters counters, IntSupplier queueDepth) {
        this.pool = pool;
        this.counters = counters;
        this.queueDepth = queueDepth;
    }

    public StatsAggregator(PoolManager pool, JobCounters counters) {
        this(pool, counters, () -> 0);
    }

    public PoolStats snapshot() {
        List<WorkerInstance> instances = pool.instances();
        List<InstanceSnapshot> snapshots = new ArrayList<>(instances.size());
        int busy = 0;
        int healthy = 0;
        for (WorkerInstance instance : instances) {
            InstanceSnapshot snapshot = InstanceSnapshot.of(instance);
            snapshots.add(snapshot);
            if (snapshot.busy()) {
                busy++;
            }
            if (instance.isHealthy()) {
                healthy++;
            }
        }

        PoolConfig config = pool.getConfig();
        return new PoolStats(
                instances.size(),
                config.getMinInstances(),
                config.getMaxInstances(),
                busy,
                healthy,
                PoolStats.utilization(busy, instances.size()),
                counters.getAverageLatency(),
                counters.getTotalRequests(),
                counters.getSuccessCount(),
                counters.getFailureCount(),
                counters.getRejectedCount(),
                counters.getRetryCount(),
                pool.getRecycledCount(),
                queueDepth.getAsInt(),
                snapshots
        );
    }
}
