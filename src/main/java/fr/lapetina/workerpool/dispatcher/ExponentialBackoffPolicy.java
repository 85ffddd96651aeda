package fr.lapetina.workerpool.dispatcher;

import java.time.Duration;

/**
 * {@code baseDelay * 2^(attempt-1)}, capped at {@code maxBackoff}.
 */
public final class ExponentialBackoffPolicy implements RetryPolicy {

    private final Duration baseDelay;
    private final Duration maxBackoff;

    public ExponentialBackoffPolicy(Duration baseDelay, Duration maxBackoff) {
        if (baseDelay.isNegative() || maxBackoff.isNegative()) {
            throw new IllegalArgumentException("Backoff durations must not be negative");
        }
        this.baseDelay = baseDelay;
        this.maxBackoff = maxBackoff;
    }

    @Override
    public Duration nextBackoff(long attempt) {
        long exponent = Math.max(0, attempt - 1);
        // 2^62 ms is far beyond any cap
        if (exponent >= 62) {
            return maxBackoff;
        }
        long multiplier = 1L << exponent;
        long baseMs = baseDelay.toMillis();
        if (baseMs > 0 && multiplier > Long.MAX_VALUE / baseMs) {
            return maxBackoff;
        }
        Duration delay = Duration.ofMillis(baseMs * multiplier);
        return delay.compareTo(maxBackoff) > 0 ? maxBackoff : delay;
    }

    public Duration getBaseDelay() {
        return baseDelay;
    }

    public Duration getMaxBackoff() {
        return maxBackoff;
    }
}
