package fr.lapetina.workerpool.domain.model;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Snapshot of the jobs that have not started executing.
 *
 * @param length            number of jobs listed
 * @param remainingCapacity submissions the queue can still take
 * @param jobs              queued jobs in dispatch order, then jobs waiting for a retry
 */
public record QueueStatus(int length, long remainingCapacity, List<QueuedJob> jobs) {

    public QueueStatus {
        jobs = jobs != null ? List.copyOf(jobs) : List.of();
    }

    /**
     * One waiting job.
     *
     * @param position    1-based place in the listing
     * @param submittedAt when the caller submitted the job
     * @param waitTime    time since submission
     */
    public record QueuedJob(
            String jobId,
            String callerId,
            int position,
            JobState state,
            int attempts,
            Integer priority,
            Instant submittedAt,
            Duration waitTime
    ) {
    }
}
