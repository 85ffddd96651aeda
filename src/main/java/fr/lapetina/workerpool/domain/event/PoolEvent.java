package fr.lapetina.workerpool.domain.event;

import fr.lapetina.workerpool.domain.model.PoolStats;

import java.time.Instant;
import java.util.Objects;

/**
 * Notification delivered to {@link PoolEventListener}s.
 *
 * @param type       what happened
 * @param instanceId instance involved, or null
 * @param jobId      job involved, or null
 * @param poolSize   pool size when the event was emitted
 * @param stats      full snapshot, only set for health-check and lifecycle events
 * @param timestamp  emission time
 */
public record PoolEvent(
        PoolEventType type,
        String instanceId,
        String jobId,
        int poolSize,
        PoolStats stats,
        Instant timestamp
) {
    public PoolEvent {
        Objects.requireNonNull(type, "Event type is required");
        if (timestamp == null) {
            timestamp = Instant.now();
        }
    }

    public static PoolEvent instance(PoolEventType type, String instanceId, int poolSize) {
        return new PoolEvent(type, instanceId, null, poolSize, null, null);
    }

    public static PoolEvent job(PoolEventType type, String jobId, String instanceId) {
        return new PoolEvent(type, instanceId, jobId, -1, null, null);
    }

    public static PoolEvent withStats(PoolEventType type, PoolStats stats) {
        return new PoolEvent(type, null, null, stats.poolSize(), stats, null);
    }
}
