package fr.lapetina.workerpool.spi;

import java.time.Duration;

/**
 * Per-caller admission control checked before a job is enqueued.
 *
 * The default implementation is in-memory; a shared store can be plugged in
 * when several orchestrators serve the same callers.
 */
public interface RateLimiter {

    /**
     * Records one request for the caller if it is within its quota.
     *
     * @return false if the caller exhausted its window; nothing is recorded then
     */
    boolean tryAcquire(String callerId);

    /**
     * Gives back the request most recently recorded for the caller, for a submission
     * that was admitted by the limiter but refused further on.
     */
    void refund(String callerId);

    /**
     * Requests the caller may still make in the current window.
     */
    int remaining(String callerId);

    int getLimit();

    Duration getWindow();

    /**
     * Limiter that admits everything.
     */
    static RateLimiter unlimited() {
        return new RateLimiter() {
            @Override
            public boolean tryAcquire(String callerId) {
                return true;
            }

            @Override
            public void refund(String callerId) {
            }

            @Override
            public int remaining(String callerId) {
                return Integer.MAX_VALUE;
            }

            @Override
            public int getLimit() {
                return Integer.MAX_VALUE;
            }

            @Override
            public Duration getWindow() {
                return Duration.ZERO;
            }
        };
    }
}
