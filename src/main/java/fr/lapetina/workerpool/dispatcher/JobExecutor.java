package fr.lapetina.workerpool.dispatcher;

import fr.lapetina.workerpool.domain.exception.ExecutionTimeoutException;
import fr.lapetina.workerpool.domain.exception.NotFoundException;
import fr.lapetina.workerpool.domain.exception.ShuttingDownException;
import fr.lapetina.workerpool.domain.exception.WorkerExecutionException;
import fr.lapetina.workerpool.domain.exception.WorkerPoolException;
import fr.lapetina.workerpool.domain.model.ConversationTurn;
import fr.lapetina.workerpool.domain.model.ErrorType;
import fr.lapetina.workerpool.domain.model.Job;
import fr.lapetina.workerpool.domain.model.JobState;
import fr.lapetina.workerpool.domain.model.WorkerInstance;
import fr.lapetina.workerpool.domain.strategy.LoadBalancer;
import fr.lapetina.workerpool.pool.PoolManager;
import fr.lapetina.workerpool.spi.ExecutionRequest;
import fr.lapetina.workerpool.spi.WorkerCapability;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.BooleanSupplier;

/**
 * Runs one dispatch attempt of a job: acquire, execute under a deadline, release,
 * then complete, retry or fail.
 *
 * A timed-out call is cancelled and its instance recycled rather than released,
 * since the worker may still be busy with the abandoned job.
 */
public final class JobExecutor {

    private static final Logger log = LoggerFactory.getLogger(JobExecutor.class);

    private final PoolManager pool;
    private final LoadBalancer loadBalancer;
    private final RetryPolicy retryPolicy;
    private final JobOutcomeRecorder outcomes;
    private final Duration defaultExecutionTimeout;
    private final ExecutorService executionPool;
    private final ScheduledExecutorService retryScheduler;
    private final RetryQueue retryQueue;
    private final BooleanSupplier running;

    JobExecutor(
            PoolManager pool,
            LoadBalancer loadBalancer,
            RetryPolicy retryPolicy,
            JobOutcomeRecorder outcomes,
            Duration defaultExecutionTimeout,
            ExecutorService executionPool,
            ScheduledExecutorService retryScheduler,
            RetryQueue retryQueue,
            BooleanSupplier running
    ) {
        this.pool = pool;
        this.loadBalancer = loadBalancer;
        this.retryPolicy = retryPolicy;
        this.outcomes = outcomes;
        this.defaultExecutionTimeout = defaultExecutionTimeout;
        this.executionPool = executionPool;
        this.retryScheduler = retryScheduler;
        this.retryQueue = retryQueue;
        this.running = running;
    }

    /**
     * Executes a job that has just moved to DISPATCHED.
     */
    public void execute(Job job) {
        int attempt = job.incrementAttempts();
        MDC.put("jobId", job.getId());
        MDC.put("callerId", job.getCallerId());

        WorkerInstance instance = null;
        boolean held = false;
        try {
            outcomes.dispatched(job);
            instance = pool.acquire(pool.getConfig().getAcquireTimeout(), loadBalancer.selector(job.getStrategy()));
            held = true;
            MDC.put("instanceId", instance.getId());

            Duration timeout = job.getExecutionTimeout() != null ? job.getExecutionTimeout() : defaultExecutionTimeout;
            log.debug("Executing job: jobId={}, instanceId={}, attempt={}/{}, timeoutMs={}",
                    job.getId(), instance.getId(), attempt, job.getMaxAttempts(), timeout.toMillis());

            long start = System.nanoTime();
            String output;
            Future<String> call = submitCall(job, instance, timeout);
            try {
                output = call.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                call.cancel(true);
                held = false;
                recycleAfterTimeout(instance);
                throw new ExecutionTimeoutException(instance.getId(), timeout);
            } catch (ExecutionException e) {
                throw translate(e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                call.cancel(true);
                throw new ShuttingDownException("Interrupted while executing job " + job.getId());
            }
            long latencyMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

            instance.getConversation().append(
                    new ConversationTurn(job.getId(), job.getPayload(), output, Instant.now()));
            instance.recordSuccess(latencyMs);
            loadBalancer.recordSuccess(instance, latencyMs);
            held = false;
            pool.release(instance.getId());
            outcomes.completed(job, output, instance.getId(), latencyMs);

        } catch (WorkerPoolException e) {
            onFailure(job, attempt, instance, held, e);
        } catch (RuntimeException e) {
            log.error("Unexpected error executing job: jobId={}", job.getId(), e);
            onFailure(job, attempt, instance, held,
                    new WorkerPoolException(ErrorType.INTERNAL_ERROR, e.getMessage(), e));
        } finally {
            MDC.remove("jobId");
            MDC.remove("callerId");
            MDC.remove("instanceId");
        }
    }

    private Future<String> submitCall(Job job, WorkerInstance instance, Duration timeout) {
        ExecutionRequest request = new ExecutionRequest(
                job.getId(),
                instance.getId(),
                job.getPayload(),
                instance.getConversation().turns(),
                Instant.now().plus(timeout)
        );
        WorkerCapability capability = instance.getCapability();
        try {
            return executionPool.submit(() -> capability.execute(request));
        } catch (RejectedExecutionException e) {
            throw new ShuttingDownException("Execution pool is shut down");
        }
    }

    private WorkerPoolException translate(Throwable cause) {
        if (cause instanceof WorkerPoolException poolError) {
            return poolError;
        }
        String message = cause != null && cause.getMessage() != null
                ? cause.getMessage()
                : String.valueOf(cause);
        return new WorkerExecutionException(message, cause);
    }

    private void recycleAfterTimeout(WorkerInstance instance) {
        log.warn("Execution timed out, recycling instance: instanceId={}", instance.getId());
        try {
            pool.recycle(instance.getId());
        } catch (NotFoundException e) {
            log.debug("Timed-out instance already recycled: instanceId={}", instance.getId());
        }
    }

    private void onFailure(Job job, int attempt, WorkerInstance instance, boolean held, WorkerPoolException e) {
        String instanceId = instance != null ? instance.getId() : null;
        if (instance != null) {
            loadBalancer.recordFailure(instance);
            if (held) {
                if (e.getErrorType() == ErrorType.EXECUTION_ERROR) {
                    pool.recordExecutionFailure(instance.getId());
                }
                pool.release(instance.getId());
            }
        }

        job.recordError(e.getErrorType(), e.getMessage());
        if (e.isRetryable() && job.hasAttemptsLeft()) {
            if (running.getAsBoolean()) {
                scheduleRetry(job, attempt, instanceId);
            } else {
                outcomes.failed(job, ErrorType.SHUTTING_DOWN, "Dispatcher is shutting down", instanceId);
            }
            return;
        }
        outcomes.failed(job, e.getErrorType(), e.getMessage(), instanceId);
    }

    private void scheduleRetry(Job job, int attempt, String instanceId) {
        if (!job.transition(JobState.DISPATCHED, JobState.RETRY_PENDING)) {
            return;
        }
        Duration delay = retryPolicy.nextBackoff(attempt);
        outcomes.retryScheduled(job, instanceId, delay);
        schedule(job, delay);
    }

    private void schedule(Job job, Duration delay) {
        try {
            retryScheduler.schedule(() -> requeue(job), delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            outcomes.failed(job, ErrorType.SHUTTING_DOWN, "Dispatcher is shutting down", null);
        }
    }

    private void requeue(Job job) {
        if (!running.getAsBoolean()) {
            outcomes.failed(job, ErrorType.SHUTTING_DOWN, "Dispatcher is shutting down", null);
            return;
        }
        if (!job.transition(JobState.RETRY_PENDING, JobState.QUEUED)) {
            log.debug("Retry dropped, job no longer pending: jobId={}, state={}", job.getId(), job.getState());
            return;
        }
        if (!retryQueue.offer(job)) {
            if (job.transition(JobState.QUEUED, JobState.RETRY_PENDING)) {
                Duration delay = retryPolicy.nextBackoff(job.getAttempts());
                log.warn("Queue full, retry postponed: jobId={}, delayMs={}", job.getId(), delay.toMillis());
                schedule(job, delay);
            }
        }
    }
}
