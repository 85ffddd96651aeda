package fr.lapetina.workerpool.dispatcher;

import fr.lapetina.workerpool.domain.event.EventPublisher;
import fr.lapetina.workerpool.domain.event.PoolEvent;
import fr.lapetina.workerpool.domain.event.PoolEventType;
import fr.lapetina.workerpool.domain.model.ErrorType;
import fr.lapetina.workerpool.domain.model.Job;
import fr.lapetina.workerpool.infrastructure.metrics.JobCounters;
import fr.lapetina.workerpool.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.workerpool.spi.JobHistoryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Applies job state changes and reports them everywhere they are observed:
 * counters, Micrometer, listeners and the history store.
 */
public final class JobOutcomeRecorder {

    private static final Logger log = LoggerFactory.getLogger(JobOutcomeRecorder.class);

    private final JobCounters counters;
    private final MetricsRegistry metrics;
    private final EventPublisher events;
    private final JobHistoryStore history;

    public JobOutcomeRecorder(JobCounters counters, MetricsRegistry metrics,
                              EventPublisher events, JobHistoryStore history) {
        this.counters = counters;
        this.metrics = metrics;
        this.events = events;
        this.history = history != null ? history : JobHistoryStore.NONE;
    }

    public void queued(Job job) {
        events.publish(PoolEvent.job(PoolEventType.JOB_QUEUED, job.getId(), null));
    }

    public void rejected() {
        counters.recordRejected();
        metrics.incrementRejected();
    }

    public void dispatched(Job job) {
        events.publish(PoolEvent.job(PoolEventType.JOB_DISPATCHED, job.getId(), null));
    }

    public void retryScheduled(Job job, String instanceId, Duration delay) {
        counters.recordRetry();
        metrics.incrementRetry();
        log.info("Job retry scheduled: jobId={}, attempt={}/{}, delayMs={}, errorType={}",
                job.getId(), job.getAttempts(), job.getMaxAttempts(), delay.toMillis(), job.getLastErrorType());
        events.publish(PoolEvent.job(PoolEventType.JOB_RETRY_SCHEDULED, job.getId(), instanceId));
    }

    /**
     * Completes a dispatched job. A job already failed elsewhere, by shutdown or
     * cancellation, is left as it is and not counted again.
     */
    public void completed(Job job, String output, String instanceId, long latencyMs) {
        boolean completed = job.complete(output, instanceId, () -> {
            counters.recordSuccess(latencyMs);
            metrics.recordExecution(Duration.ofMillis(latencyMs));
            metrics.recordOutcome(null);
        });
        if (!completed) {
            log.warn("Completion ignored, job already terminal: jobId={}, state={}", job.getId(), job.getState());
            return;
        }
        log.info("Job completed: jobId={}, instanceId={}, attempts={}, latencyMs={}",
                job.getId(), instanceId, job.getAttempts(), latencyMs);
        events.publish(PoolEvent.job(PoolEventType.JOB_COMPLETED, job.getId(), instanceId));
        store(job);
    }

    /**
     * Fails a job from any non-terminal state.
     *
     * @return false if the job was already terminal
     */
    public boolean failed(Job job, ErrorType errorType, String message, String instanceId) {
        boolean failed = job.fail(errorType, message, instanceId, () -> {
            counters.recordFailure();
            metrics.recordOutcome(errorType);
        });
        if (!failed) {
            return false;
        }
        log.warn("Job failed: jobId={}, callerId={}, errorType={}, attempts={}, error={}",
                job.getId(), job.getCallerId(), errorType, job.getAttempts(), message);
        events.publish(PoolEvent.job(PoolEventType.JOB_FAILED, job.getId(), instanceId));
        store(job);
        return true;
    }

    private void store(Job job) {
        try {
            history.record(job.getCallerId(), job.getResult().getNow(null));
        } catch (Exception e) {
            log.error("Error recording job history: jobId={}", job.getId(), e);
        }
    }
}
