package fr.lapetina.workerpool.domain.model;

import java.time.Duration;

/**
 * Returned to the caller when a job is accepted.
 *
 * @param jobId         id to pass to awaitResult or cancel
 * @param queuePosition jobs ahead of this one, including itself
 * @param estimatedWait queuePosition * averageLatency / concurrency limit
 */
public record SubmitReceipt(String jobId, int queuePosition, Duration estimatedWait) {
}
