package fr.lapetina.workerpool.dispatcher;

import fr.lapetina.workerpool.spi.RateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-memory sliding window: at most {@code maxRequests} per caller within any
 * {@code window}-long interval.
 *
 * A caller is tracked only while it has requests inside the window. Callers that
 * stop calling are dropped by a sweep that runs at most once per window.
 */
public final class SlidingWindowRateLimiter implements RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(SlidingWindowRateLimiter.class);

    private final int maxRequests;
    private final Duration window;
    private final Clock clock;
    private final ConcurrentMap<String, Deque<Instant>> requests = new ConcurrentHashMap<>();
    private final AtomicReference<Instant> lastSweep;

    public SlidingWindowRateLimiter(int maxRequests, Duration window, Clock clock) {
        if (maxRequests < 1) {
            throw new IllegalArgumentException("maxRequests must be >= 1: " + maxRequests);
        }
        if (window == null || window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be positive: " + window);
        }
        this.maxRequests = maxRequests;
        this.window = window;
        this.clock = clock;
        this.lastSweep = new AtomicReference<>(clock.instant());
        log.info("SlidingWindowRateLimiter initialized: maxRequests={}, window={}", maxRequests, window);
    }

    public SlidingWindowRateLimiter(int maxRequests, Duration window) {
        this(maxRequests, window, Clock.systemUTC());
    }

    @Override
    public boolean tryAcquire(String callerId) {
        Instant now = clock.instant();
        sweepIfDue(now);

        boolean[] admitted = new boolean[1];
        requests.compute(callerId, (id, timestamps) -> {
            Deque<Instant> current = timestamps != null ? timestamps : new ArrayDeque<>();
            evictExpired(current, now);
            if (current.size() < maxRequests) {
                current.addLast(now);
                admitted[0] = true;
            }
            return current.isEmpty() ? null : current;
        });

        if (!admitted[0]) {
            log.debug("Rate limit reached: callerId={}, limit={}", callerId, maxRequests);
        }
        return admitted[0];
    }

    @Override
    public void refund(String callerId) {
        requests.computeIfPresent(callerId, (id, timestamps) -> {
            timestamps.pollLast();
            return timestamps.isEmpty() ? null : timestamps;
        });
    }

    @Override
    public int remaining(String callerId) {
        Instant now = clock.instant();
        int[] used = new int[1];
        requests.computeIfPresent(callerId, (id, timestamps) -> {
            evictExpired(timestamps, now);
            used[0] = timestamps.size();
            return timestamps.isEmpty() ? null : timestamps;
        });
        return Math.max(0, maxRequests - used[0]);
    }

    /**
     * Drops every caller whose requests have all left the window.
     */
    public void evictIdleCallers() {
        Instant now = clock.instant();
        lastSweep.set(now);
        int before = requests.size();
        for (String callerId : requests.keySet()) {
            requests.computeIfPresent(callerId, (id, timestamps) -> {
                evictExpired(timestamps, now);
                return timestamps.isEmpty() ? null : timestamps;
            });
        }
        log.debug("Idle callers evicted: before={}, after={}", before, requests.size());
    }

    int trackedCallers() {
        return requests.size();
    }

    private void sweepIfDue(Instant now) {
        Instant previous = lastSweep.get();
        if (now.isAfter(previous.plus(window)) && lastSweep.compareAndSet(previous, now)) {
            evictIdleCallers();
        }
    }

    private void evictExpired(Deque<Instant> timestamps, Instant now) {
        Instant cutoff = now.minus(window);
        while (!timestamps.isEmpty() && !timestamps.peekFirst().isAfter(cutoff)) {
            timestamps.pollFirst();
        }
    }

    @Override
    public int getLimit() {
        return maxRequests;
    }

    @Override
    public Duration getWindow() {
        return window;
    }
}
