package fr.lapetina.workerpool.infrastructure.metrics;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Job outcome counters written by the dispatcher and read by the stats aggregator.
 */
public final class JobCounters {

    private final AtomicLong totalRequests = new AtomicLong();
    private final AtomicLong successCount = new AtomicLong();
    private final AtomicLong failureCount = new AtomicLong();
    private final AtomicLong rejectedCount = new AtomicLong();
    private final AtomicLong retryCount = new AtomicLong();
    private final RunningAverage latency = new RunningAverage();

    /** A job was accepted into the queue. */
    public void recordSubmitted() {
        totalRequests.incrementAndGet();
    }

    /** A submission was refused before enqueue (rate limit, full queue). */
    public void recordRejected() {
        rejectedCount.incrementAndGet();
    }

    public void recordSuccess(long latencyMs) {
        successCount.incrementAndGet();
        latency.add(latencyMs);
    }

    public void recordFailure() {
        failureCount.incrementAndGet();
    }

    public void recordRetry() {
        retryCount.incrementAndGet();
    }

    public long getTotalRequests() {
        return totalRequests.get();
    }

    public long getSuccessCount() {
        return successCount.get();
    }

    public long getFailureCount() {
        return failureCount.get();
    }

    public long getRejectedCount() {
        return rejectedCount.get();
    }

    public long getRetryCount() {
        return retryCount.get();
    }

    /** Mean execution latency of successful jobs, in milliseconds. */
    public double getAverageLatency() {
        return latency.get();
    }
}
