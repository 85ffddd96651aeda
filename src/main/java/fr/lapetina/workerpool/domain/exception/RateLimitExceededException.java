package fr.lapetina.workerpool.domain.exception;

import fr.lapetina.workerpool.domain.model.ErrorType;

import java.time.Duration;

/**
 * Thrown at submission when the caller has exhausted its sliding window.
 * Rejected jobs are never enqueued.
 */
public final class RateLimitExceededException extends WorkerPoolException {

    private final String callerId;
    private final int limit;
    private final Duration window;

    public RateLimitExceededException(String callerId, int limit, Duration window) {
        super(ErrorType.RATE_LIMIT_EXCEEDED,
                "Rate limit exceeded for caller " + callerId + ": " + limit
                        + " requests per " + window);
        this.callerId = callerId;
        this.limit = limit;
        this.window = window;
    }

    public String getCallerId() {
        return callerId;
    }

    public int getLimit() {
        return limit;
    }

    public Duration getWindow() {
        return window;
    }
}
