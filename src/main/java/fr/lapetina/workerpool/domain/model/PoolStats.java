package fr.lapetina.workerpool.domain.model;

import java.util.List;

/**
 * Derived, read-only view of the pool and dispatcher counters.
 */
public record PoolStats(
        int poolSize,
        int minInstances,
        int maxInstances,
        int busyCount,
        int healthyCount,
        double utilization,
        double averageLatency,
        long totalRequests,
        long successCount,
        long failureCount,
        long rejectedCount,
        long retryCount,
        long recycledCount,
        int queueDepth,
        List<InstanceSnapshot> instances
) {
    public PoolStats {
        instances = instances != null ? List.copyOf(instances) : List.of();
    }

    /**
     * busyCount / poolSize, 0 for an empty pool.
     */
    public static double utilization(int busyCount, int poolSize) {
        return poolSize == 0 ? 0.0 : (double) busyCount / poolSize;
    }
}
