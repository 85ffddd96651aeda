package fr.lapetina.workerpool.domain.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Terminal outcome of a job. Immutable and thread-safe.
 *
 * Failed results carry an {@link ErrorType} and a message, never a downstream stack trace.
 */
public record JobResult(
        String jobId,
        boolean success,
        String output,
        String instanceId,
        int attempts,
        Instant submittedAt,
        Instant completedAt,
        ErrorType errorType,
        String errorMessage
) {
    public JobResult {
        Objects.requireNonNull(jobId, "Job ID is required");
        if (completedAt == null) {
            completedAt = Instant.now();
        }
    }

    public boolean isSuccess() {
        return success;
    }

    public static JobResult success(String jobId, String output, String instanceId,
                                    int attempts, Instant submittedAt) {
        return new JobResult(jobId, true, output, instanceId, attempts, submittedAt,
                Instant.now(), null, null);
    }

    public static JobResult failure(String jobId, ErrorType errorType, String errorMessage,
                                    String instanceId, int attempts, Instant submittedAt) {
        return new JobResult(jobId, false, null, instanceId, attempts, submittedAt,
                Instant.now(), Objects.requireNonNull(errorType, "Error type is required"), errorMessage);
    }
}
