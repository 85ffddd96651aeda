package fr.lapetina.workerpool.dispatcher.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.workerpool.dispatcher.JobEvent;
import fr.lapetina.workerpool.domain.model.ErrorType;
import fr.lapetina.workerpool.domain.model.Job;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * First stage handler: validates job payloads before dispatch.
 *
 * Validates:
 * - Job is present
 * - Payload is not blank
 * - Payload is within the maximum length
 *
 * Retried jobs pass through again; a payload never changes so they always pass.
 */
public final class ValidationHandler implements EventHandler<JobEvent> {

    private static final Logger log = LoggerFactory.getLogger(ValidationHandler.class);

    private final int maxPayloadLength;

    public ValidationHandler(int maxPayloadLength) {
        if (maxPayloadLength < 1) {
            throw new IllegalArgumentException("maxPayloadLength must be >= 1: " + maxPayloadLength);
        }
        this.maxPayloadLength = maxPayloadLength;
    }

    /**
     * Creates a handler with the default payload length.
     */
    public static ValidationHandler withDefaults() {
        return new ValidationHandler(100_000);
    }

    @Override
    public void onEvent(JobEvent event, long sequence, boolean endOfBatch) {
        event.setSequence(sequence);
        Job job = event.getJob();

        String reason = validate(job);
        if (reason == null) {
            log.debug("Job validated: jobId={}, sequence={}", job.getId(), sequence);
            return;
        }

        event.setError(ErrorType.VALIDATION_ERROR, reason);
        log.warn("Validation failed: jobId={}, callerId={}, reason={}, sequence={}",
                job != null ? job.getId() : "null",
                job != null ? job.getCallerId() : "null",
                reason,
                sequence);
    }

    private String validate(Job job) {
        if (job == null) {
            return "Job is null";
        }
        String payload = job.getPayload();
        if (payload == null || payload.isBlank()) {
            return "Payload is required";
        }
        if (payload.length() > maxPayloadLength) {
            return "Payload exceeds maximum length of " + maxPayloadLength;
        }
        return null;
    }

    public int getMaxPayloadLength() {
        return maxPayloadLength;
    }
}
