package fr.lapetina.workerpool.dispatcher;

import java.time.Duration;

/**
 * Delay before a failed job is put back on the queue.
 */
@FunctionalInterface
public interface RetryPolicy {

    /**
     * @param attempt number of attempts already made, starting at 1
     */
    Duration nextBackoff(long attempt);

    /** Fixed backoff */
    static RetryPolicy fixed(Duration backoff) {
        return attempt -> backoff;
    }
}
