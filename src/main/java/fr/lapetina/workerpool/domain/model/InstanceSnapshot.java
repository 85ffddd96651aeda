package fr.lapetina.workerpool.domain.model;

import java.time.Instant;

/**
 * Point-in-time view of one instance, for stats and events.
 */
public record InstanceSnapshot(
        String id,
        boolean busy,
        InstanceHealth health,
        int messageCount,
        int currentLoad,
        double averageResponseTime,
        Instant createdAt,
        Instant lastUsedAt,
        Instant lastHealthCheck,
        int conversationLength
) {
    public static InstanceSnapshot of(WorkerInstance instance) {
        return new InstanceSnapshot(
                instance.getId(),
                instance.isBusy(),
                instance.getHealth(),
                instance.getMessageCount(),
                instance.getCurrentLoad(),
                instance.getAverageResponseTime(),
                instance.getCreatedAt(),
                instance.getLastUsedAt(),
                instance.getLastHealthCheck(),
                instance.getConversation().size()
        );
    }
}
