package fr.lapetina.workerpool.dispatcher;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.BusySpinWaitStrategy;
import com.lmax.disruptor.ExceptionHandler;
import com.lmax.disruptor.InsufficientCapacityException;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.SleepingWaitStrategy;
import com.lmax.disruptor.TimeoutException;
import com.lmax.disruptor.WaitStrategy;
import com.lmax.disruptor.YieldingWaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import fr.lapetina.workerpool.dispatcher.exception.BackpressureException;
import fr.lapetina.workerpool.dispatcher.handlers.DispatchHandler;
import fr.lapetina.workerpool.dispatcher.handlers.ValidationHandler;
import fr.lapetina.workerpool.domain.exception.NotFoundException;
import fr.lapetina.workerpool.domain.exception.RateLimitExceededException;
import fr.lapetina.workerpool.domain.exception.ShuttingDownException;
import fr.lapetina.workerpool.domain.exception.WorkerPoolException;
import fr.lapetina.workerpool.domain.model.ErrorType;
import fr.lapetina.workerpool.domain.model.Job;
import fr.lapetina.workerpool.domain.model.JobResult;
import fr.lapetina.workerpool.domain.model.JobState;
import fr.lapetina.workerpool.domain.model.QueueStatus;
import fr.lapetina.workerpool.domain.model.SubmitOptions;
import fr.lapetina.workerpool.domain.model.SubmitReceipt;
import fr.lapetina.workerpool.domain.strategy.LoadBalancer;
import fr.lapetina.workerpool.infrastructure.config.OrchestratorConfig;
import fr.lapetina.workerpool.infrastructure.metrics.JobCounters;
import fr.lapetina.workerpool.pool.PoolManager;
import fr.lapetina.workerpool.spi.RateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Job queue and processing loop built on an LMAX Disruptor ring buffer.
 *
 * The ring buffer is the FIFO job queue; its size is the queue capacity, and a
 * full ring rejects new submissions instead of growing. Two stages consume it:
 * validation, then dispatch, which admits at most {@code maxConcurrent} jobs to
 * the processing pool at a time. Retried jobs are published again at the tail.
 *
 * PRODUCER TYPE: MULTI, since callers and the retry scheduler publish concurrently.
 */
public final class JobDispatcher implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(JobDispatcher.class);

    private static final Comparator<Waiting> QUEUE_ORDER = Comparator
            .comparing((Waiting waiting) -> waiting.state() == JobState.RETRY_PENDING)
            .thenComparing(Waiting::enqueuedAt)
            .thenComparing(waiting -> waiting.job().getCreatedAt());

    // Sort keys read once, so a job changing state mid-sort cannot break the ordering.
    private record Waiting(Job job, JobState state, Instant enqueuedAt) {
    }

    private final Disruptor<JobEvent> disruptor;
    private final RingBuffer<JobEvent> ringBuffer;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean accepting = new AtomicBoolean(false);

    private final ValidationHandler validationHandler;
    private final DispatchHandler dispatchHandler;

    private final ExecutorService processingPool;
    private final ExecutorService executionPool;
    private final ScheduledExecutorService retryScheduler;

    private final RateLimiter rateLimiter;
    private final JobOutcomeRecorder outcomes;
    private final JobCounters counters;
    private final int maxConcurrent;
    private final int defaultMaxAttempts;
    private final int completedJobRetention;

    private final AtomicInteger queued = new AtomicInteger(0);
    private final Map<String, Job> jobs = new ConcurrentHashMap<>();
    private final Queue<String> terminalJobs = new ConcurrentLinkedQueue<>();
    private final AtomicInteger terminalCount = new AtomicInteger(0);

    private JobDispatcher(Builder builder) {
        this.rateLimiter = builder.rateLimiter;
        this.outcomes = builder.outcomes;
        this.counters = builder.counters;
        this.maxConcurrent = builder.maxConcurrent;
        this.defaultMaxAttempts = builder.maxAttempts;
        this.completedJobRetention = builder.completedJobRetention;

        this.processingPool = Executors.newFixedThreadPool(maxConcurrent, new NamedThreadFactory("job-processor"));
        this.executionPool = Executors.newCachedThreadPool(new NamedThreadFactory("worker-call"));
        this.retryScheduler = Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory("job-retry"));

        this.disruptor = new Disruptor<>(
                new JobEventFactory(),
                builder.ringBufferSize,
                new NamedThreadFactory("dispatcher-handler"),
                ProducerType.MULTI,
                createWaitStrategy(builder.waitStrategy)
        );

        JobExecutor executor = new JobExecutor(
                builder.pool,
                builder.loadBalancer,
                builder.retryPolicy,
                outcomes,
                builder.executionTimeout,
                executionPool,
                retryScheduler,
                this::republish,
                running::get
        );
        this.validationHandler = new ValidationHandler(builder.maxPayloadLength);
        this.dispatchHandler = new DispatchHandler(
                executor,
                outcomes,
                processingPool,
                new Semaphore(maxConcurrent),
                queued,
                running
        );

        // Validation -> Dispatch
        disruptor.handleEventsWith(validationHandler).then(dispatchHandler);
        disruptor.setDefaultExceptionHandler(new DispatcherExceptionHandler(outcomes));
        this.ringBuffer = disruptor.getRingBuffer();

        log.info("JobDispatcher created: ringBufferSize={}, waitStrategy={}, maxConcurrent={}, maxAttempts={}",
                builder.ringBufferSize, builder.waitStrategy, maxConcurrent, defaultMaxAttempts);
    }

    /**
     * Starts the Disruptor processing.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            disruptor.start();
            accepting.set(true);
            log.info("JobDispatcher started");
        }
    }

    /**
     * Enqueues a job.
     *
     * <p>The caller's rate limit is checked first; a rejected job never takes a queue slot,
     * and a job refused for a full queue does not use up the caller's quota.
     *
     * @throws RateLimitExceededException if the caller exhausted its window
     * @throws BackpressureException      if the queue is full
     * @throws ShuttingDownException      if the dispatcher no longer accepts jobs
     */
    public SubmitReceipt submit(String payload, String callerId, SubmitOptions options) {
        if (!accepting.get()) {
            throw new ShuttingDownException("Dispatcher is not accepting jobs");
        }
        Job job = new Job(callerId, payload, options != null ? options : SubmitOptions.defaults(), defaultMaxAttempts);

        if (!rateLimiter.tryAcquire(callerId)) {
            outcomes.rejected();
            log.warn("Submission rate limited: callerId={}, limit={}, window={}",
                    callerId, rateLimiter.getLimit(), rateLimiter.getWindow());
            throw new RateLimitExceededException(callerId, rateLimiter.getLimit(), rateLimiter.getWindow());
        }

        long sequence;
        try {
            sequence = ringBuffer.tryNext();
        } catch (InsufficientCapacityException e) {
            // Never enqueued, so it does not count against the caller's window
            rateLimiter.refund(callerId);
            outcomes.rejected();
            throw new BackpressureException(
                    BackpressureException.BackpressureReason.RING_BUFFER_FULL,
                    "remaining capacity: " + ringBuffer.remainingCapacity()
            );
        }

        int position;
        try {
            register(job);
            counters.recordSubmitted();
            position = queued.incrementAndGet();
            ringBuffer.get(sequence).initialize(job);
            outcomes.queued(job);
        } finally {
            ringBuffer.publish(sequence);
        }

        Duration estimatedWait = Duration.ofMillis(
                (long) (position * counters.getAverageLatency() / maxConcurrent));
        log.debug("Job submitted: jobId={}, callerId={}, sequence={}, queuePosition={}",
                job.getId(), callerId, sequence, position);
        return new SubmitReceipt(job.getId(), position, estimatedWait);
    }

    public SubmitReceipt submit(String payload, String callerId) {
        return submit(payload, callerId, SubmitOptions.defaults());
    }

    /**
     * Submits independent jobs and joins on all of them.
     *
     * <p>A member refused at submission (rate limit, full queue) becomes a failed result
     * in the returned list instead of aborting the batch. Results keep the input order.
     */
    public CompletableFuture<List<JobResult>> submitBatch(List<String> payloads, String callerId,
                                                          SubmitOptions options) {
        List<CompletableFuture<JobResult>> futures = new ArrayList<>(payloads.size());
        for (String payload : payloads) {
            try {
                SubmitReceipt receipt = submit(payload, callerId, options);
                futures.add(awaitResult(receipt.jobId()));
            } catch (WorkerPoolException e) {
                futures.add(CompletableFuture.completedFuture(JobResult.failure(
                        UUID.randomUUID().toString(), e.getErrorType(), e.getMessage(), null, 0, Instant.now())));
            }
        }
        return CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .thenApply(ignored -> futures.stream().map(CompletableFuture::join).toList());
    }

    /**
     * Future of a job's terminal result. Terminal jobs stay available up to the retention limit.
     *
     * @throws NotFoundException if the id is unknown or no longer retained
     */
    public CompletableFuture<JobResult> awaitResult(String jobId) {
        Job job = jobs.get(jobId);
        if (job == null) {
            throw new NotFoundException("Job", jobId);
        }
        return job.getResult();
    }

    public Optional<Job> getJob(String jobId) {
        return Optional.ofNullable(jobs.get(jobId));
    }

    /**
     * Cancels a job that has not started executing.
     *
     * @return true if the job was queued or waiting for a retry and is now FAILED with CANCELLED
     * @throws NotFoundException if the id is unknown
     */
    public boolean cancel(String jobId) {
        Job job = jobs.get(jobId);
        if (job == null) {
            throw new NotFoundException("Job", jobId);
        }
        JobState state = job.getState();
        if (state != JobState.QUEUED && state != JobState.RETRY_PENDING) {
            log.debug("Cancel refused: jobId={}, state={}", jobId, state);
            return false;
        }
        boolean cancelled = outcomes.failed(job, ErrorType.CANCELLED, "Cancelled by caller", null);
        if (cancelled) {
            log.info("Job cancelled: jobId={}, previousState={}", jobId, state);
        }
        return cancelled;
    }

    /**
     * Jobs published and not yet handed to a processing slot.
     */
    public int queueDepth() {
        return Math.max(0, queued.get());
    }

    /**
     * Jobs that have not started executing: queued ones in dispatch order, then those
     * waiting out a retry backoff.
     */
    public QueueStatus queueStatus() {
        Instant now = Instant.now();
        List<Waiting> waiting = jobs.values().stream()
                .map(job -> new Waiting(job, job.getState(), job.getEnqueuedAt()))
                .filter(entry -> entry.state() == JobState.QUEUED || entry.state() == JobState.RETRY_PENDING)
                .sorted(QUEUE_ORDER)
                .toList();

        List<QueueStatus.QueuedJob> entries = new ArrayList<>(waiting.size());
        for (Waiting entry : waiting) {
            Job job = entry.job();
            entries.add(new QueueStatus.QueuedJob(
                    job.getId(),
                    job.getCallerId(),
                    entries.size() + 1,
                    entry.state(),
                    job.getAttempts(),
                    job.getPriority(),
                    job.getCreatedAt(),
                    Duration.between(job.getCreatedAt(), now)
            ));
        }
        return new QueueStatus(entries.size(), ringBuffer.remainingCapacity(), entries);
    }

    public int getMaxConcurrent() {
        return maxConcurrent;
    }

    public boolean isAccepting() {
        return accepting.get();
    }

    /**
     * Refuses new submissions; queued jobs keep flowing.
     */
    public void stopAccepting() {
        if (accepting.compareAndSet(true, false)) {
            log.info("JobDispatcher stopped accepting jobs");
        }
    }

    /**
     * Stops processing and fails every job that is not terminal with SHUTTING_DOWN.
     */
    @Override
    public void close() {
        accepting.set(false);
        if (running.compareAndSet(true, false)) {
            log.info("Shutting down JobDispatcher...");
            retryScheduler.shutdownNow();
            try {
                disruptor.shutdown(5, TimeUnit.SECONDS);
            } catch (TimeoutException e) {
                log.warn("JobDispatcher shutdown timed out, halting...");
                disruptor.halt();
            }
            shutdownExecutor(processingPool);
            executionPool.shutdownNow();

            int failed = 0;
            for (Job job : jobs.values()) {
                if (outcomes.failed(job, ErrorType.SHUTTING_DOWN, "Dispatcher is shutting down", null)) {
                    failed++;
                }
            }
            log.info("JobDispatcher shut down: pendingJobsFailed={}", failed);
        }
    }

    private void shutdownExecutor(ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Publishes a retried job at the tail of the queue.
     */
    private boolean republish(Job job) {
        long sequence;
        try {
            sequence = ringBuffer.tryNext();
        } catch (InsufficientCapacityException e) {
            return false;
        }
        try {
            queued.incrementAndGet();
            job.markEnqueued(Instant.now());
            ringBuffer.get(sequence).initialize(job);
            outcomes.queued(job);
        } finally {
            ringBuffer.publish(sequence);
        }
        log.debug("Job requeued: jobId={}, sequence={}, attempts={}", job.getId(), sequence, job.getAttempts());
        return true;
    }

    private void register(Job job) {
        jobs.put(job.getId(), job);
        job.getResult().whenComplete((result, error) -> retain(job.getId()));
    }

    private void retain(String jobId) {
        terminalJobs.add(jobId);
        if (terminalCount.incrementAndGet() > completedJobRetention) {
            String oldest = terminalJobs.poll();
            if (oldest != null) {
                terminalCount.decrementAndGet();
                jobs.remove(oldest);
            }
        }
    }

    private WaitStrategy createWaitStrategy(String name) {
        return switch (name.toLowerCase()) {
            case "blocking" -> new BlockingWaitStrategy();
            case "yielding" -> new YieldingWaitStrategy();
            case "busy-spin" -> new BusySpinWaitStrategy();
            case "sleeping" -> new SleepingWaitStrategy();
            default -> {
                log.warn("Unknown wait strategy '{}', using BlockingWaitStrategy", name);
                yield new BlockingWaitStrategy();
            }
        };
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Thread factory for dispatcher threads.
     */
    private static class NamedThreadFactory implements ThreadFactory {
        private final String namePrefix;
        private final AtomicInteger counter = new AtomicInteger(0);

        NamedThreadFactory(String namePrefix) {
            this.namePrefix = namePrefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, namePrefix + "-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }

    /**
     * Exception handler for Disruptor.
     */
    private static class DispatcherExceptionHandler implements ExceptionHandler<JobEvent> {

        private static final Logger log = LoggerFactory.getLogger(DispatcherExceptionHandler.class);

        private final JobOutcomeRecorder outcomes;

        DispatcherExceptionHandler(JobOutcomeRecorder outcomes) {
            this.outcomes = outcomes;
        }

        @Override
        public void handleEventException(Throwable ex, long sequence, JobEvent event) {
            log.error("Exception in event handler: sequence={}, event={}", sequence, event, ex);
            if (event.getJob() != null) {
                outcomes.failed(event.getJob(), ErrorType.INTERNAL_ERROR, ex.getMessage(), null);
            }
        }

        @Override
        public void handleOnStartException(Throwable ex) {
            log.error("Exception during Disruptor start", ex);
        }

        @Override
        public void handleOnShutdownException(Throwable ex) {
            log.error("Exception during Disruptor shutdown", ex);
        }
    }

    /**
     * Builder for JobDispatcher.
     */
    public static final class Builder {
        private int ringBufferSize = 1024;
        private String waitStrategy = "blocking";
        private int maxConcurrent = 4;
        private int maxAttempts = 3;
        private Duration executionTimeout = Duration.ofMinutes(2);
        private int maxPayloadLength = 100_000;
        private int completedJobRetention = 1000;
        private RetryPolicy retryPolicy = new ExponentialBackoffPolicy(Duration.ofSeconds(2), Duration.ofSeconds(30));
        private RateLimiter rateLimiter = RateLimiter.unlimited();
        private PoolManager pool;
        private LoadBalancer loadBalancer;
        private JobOutcomeRecorder outcomes;
        private JobCounters counters;

        public Builder ringBufferSize(int size) {
            // Must be power of 2
            if (Integer.bitCount(size) != 1) {
                throw new IllegalArgumentException("Ring buffer size must be power of 2");
            }
            this.ringBufferSize = size;
            return this;
        }

        public Builder waitStrategy(String strategy) {
            this.waitStrategy = strategy;
            return this;
        }

        public Builder maxConcurrent(int maxConcurrent) {
            if (maxConcurrent < 1) {
                throw new IllegalArgumentException("maxConcurrent must be >= 1: " + maxConcurrent);
            }
            this.maxConcurrent = maxConcurrent;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            if (maxAttempts < 1) {
                throw new IllegalArgumentException("maxAttempts must be >= 1: " + maxAttempts);
            }
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder executionTimeout(Duration timeout) {
            this.executionTimeout = timeout;
            return this;
        }

        public Builder maxPayloadLength(int maxLength) {
            this.maxPayloadLength = maxLength;
            return this;
        }

        public Builder completedJobRetention(int retention) {
            this.completedJobRetention = retention;
            return this;
        }

        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        public Builder rateLimiter(RateLimiter rateLimiter) {
            this.rateLimiter = rateLimiter;
            return this;
        }

        public Builder pool(PoolManager pool) {
            this.pool = pool;
            return this;
        }

        public Builder loadBalancer(LoadBalancer loadBalancer) {
            this.loadBalancer = loadBalancer;
            return this;
        }

        public Builder outcomes(JobOutcomeRecorder outcomes) {
            this.outcomes = outcomes;
            return this;
        }

        public Builder counters(JobCounters counters) {
            this.counters = counters;
            return this;
        }

        public Builder fromConfig(OrchestratorConfig config) {
            OrchestratorConfig.DispatcherConfig dispatcher = config.getDispatcher();
            OrchestratorConfig.RetryConfig retry = config.getRetry();
            ringBufferSize(dispatcher.getRingBufferSize());
            this.waitStrategy = dispatcher.getWaitStrategy();
            maxConcurrent(dispatcher.getMaxConcurrent());
            this.executionTimeout = Duration.ofMillis(dispatcher.getExecutionTimeoutMs());
            this.maxPayloadLength = dispatcher.getMaxPayloadLength();
            this.completedJobRetention = dispatcher.getCompletedJobRetention();
            maxAttempts(retry.getMaxAttempts());
            this.retryPolicy = new ExponentialBackoffPolicy(
                    Duration.ofMillis(retry.getBaseDelayMs()),
                    Duration.ofMillis(retry.getMaxBackoffMs()));
            return this;
        }

        public JobDispatcher build() {
            if (pool == null) {
                throw new IllegalStateException("PoolManager is required");
            }
            if (loadBalancer == null) {
                throw new IllegalStateException("LoadBalancer is required");
            }
            if (outcomes == null) {
                throw new IllegalStateException("JobOutcomeRecorder is required");
            }
            if (counters == null) {
                throw new IllegalStateException("JobCounters is required");
            }
            if (executionTimeout == null || executionTimeout.isZero() || executionTimeout.isNegative()) {
                throw new IllegalStateException("Execution timeout must be positive");
            }
            if (completedJobRetention < 0) {
                throw new IllegalStateException("completedJobRetention must be >= 0");
            }
            return new JobDispatcher(this);
        }
    }
}
