package fr.lapetina.workerpool.domain.model;

import java.time.Instant;
import java.util.Objects;

/**
 * One exchange held by a worker instance: the job input and the output it produced.
 */
public record ConversationTurn(String jobId, String input, String output, Instant timestamp) {
    public ConversationTurn {
        Objects.requireNonNull(jobId, "Job ID is required");
        Objects.requireNonNull(timestamp, "Timestamp is required");
    }
}
