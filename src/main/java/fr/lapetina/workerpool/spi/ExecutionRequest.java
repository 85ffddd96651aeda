package fr.lapetina.workerpool.spi;

import fr.lapetina.workerpool.domain.model.ConversationTurn;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Input handed to a {@link WorkerCapability} for one job attempt.
 *
 * @param jobId      the job being executed
 * @param instanceId the instance executing it
 * @param payload    opaque job input
 * @param history    earlier turns on the same instance, oldest first
 * @param deadline   point in time after which the call is cancelled
 */
public record ExecutionRequest(
        String jobId,
        String instanceId,
        String payload,
        List<ConversationTurn> history,
        Instant deadline
) {
    public ExecutionRequest {
        Objects.requireNonNull(jobId, "Job ID is required");
        Objects.requireNonNull(instanceId, "Instance ID is required");
        Objects.requireNonNull(deadline, "Deadline is required");
        history = history != null ? List.copyOf(history) : List.of();
    }
}
