package fr.lapetina.workerpool.dispatcher;

import fr.lapetina.workerpool.dispatcher.exception.BackpressureException;
import fr.lapetina.workerpool.domain.event.EventPublisher;
import fr.lapetina.workerpool.domain.event.PoolEvent;
import fr.lapetina.workerpool.domain.event.PoolEventType;
import fr.lapetina.workerpool.domain.exception.NotFoundException;
import fr.lapetina.workerpool.domain.exception.RateLimitExceededException;
import fr.lapetina.workerpool.domain.exception.ShuttingDownException;
import fr.lapetina.workerpool.domain.exception.WorkerExecutionException;
import fr.lapetina.workerpool.domain.model.ErrorType;
import fr.lapetina.workerpool.domain.model.Job;
import fr.lapetina.workerpool.domain.model.JobResult;
import fr.lapetina.workerpool.domain.model.JobState;
import fr.lapetina.workerpool.domain.model.QueueStatus;
import fr.lapetina.workerpool.domain.model.SubmitOptions;
import fr.lapetina.workerpool.domain.model.SubmitReceipt;
import fr.lapetina.workerpool.domain.strategy.LoadBalancer;
import fr.lapetina.workerpool.infrastructure.metrics.JobCounters;
import fr.lapetina.workerpool.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.workerpool.pool.PoolConfig;
import fr.lapetina.workerpool.pool.PoolManager;
import fr.lapetina.workerpool.spi.JobHistoryStore;
import fr.lapetina.workerpool.support.StubProvisioner;
import fr.lapetina.workerpool.support.StubWorkerCapability;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

import static fr.lapetina.workerpool.support.Conditions.awaitTrue;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JobDispatcherTest {

    private StubProvisioner provisioner;
    private EventPublisher events;
    private List<PoolEvent> received;
    private List<JobResult> history;
    private JobCounters counters;
    private MetricsRegistry metrics;
    private PoolManager pool;
    private JobDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        provisioner = new StubProvisioner();
        events = new EventPublisher();
        received = new CopyOnWriteArrayList<>();
        events.addListener(received::add);
        history = new CopyOnWriteArrayList<>();
        counters = new JobCounters();
        metrics = new MetricsRegistry("test_pool", false);
    }

    @AfterEach
    void tearDown() {
        if (dispatcher != null) {
            dispatcher.close();
        }
        if (pool != null) {
            pool.shutdown();
        }
        metrics.close();
    }

    private JobDispatcher start(Consumer<JobDispatcher.Builder> customizer) {
        LoadBalancer loadBalancer = new LoadBalancer("round-robin");
        pool = new PoolManager(
                PoolConfig.builder().minInstances(1).maxInstances(2).acquireTimeout(Duration.ofSeconds(2)).build(),
                provisioner, loadBalancer, events);
        pool.initialize();

        JobHistoryStore store = (callerId, result) -> history.add(result);
        JobDispatcher.Builder builder = JobDispatcher.builder()
                .pool(pool)
                .loadBalancer(loadBalancer)
                .outcomes(new JobOutcomeRecorder(counters, metrics, events, store))
                .counters(counters)
                .ringBufferSize(64)
                .maxConcurrent(2)
                .retryPolicy(RetryPolicy.fixed(Duration.ofMillis(20)));
        customizer.accept(builder);
        dispatcher = builder.build();
        dispatcher.start();
        return dispatcher;
    }

    private JobDispatcher start() {
        return start(builder -> { });
    }

    private JobResult await(SubmitReceipt receipt) throws Exception {
        return dispatcher.awaitResult(receipt.jobId()).get(10, TimeUnit.SECONDS);
    }

    private List<PoolEventType> eventsFor(String jobId) {
        return received.stream()
                .filter(e -> jobId.equals(e.jobId()))
                .map(PoolEvent::type)
                .toList();
    }

    @Nested
    @DisplayName("Execution")
    class ExecutionTests {

        @Test
        @DisplayName("should complete a job on an instance")
        void shouldCompleteJob() throws Exception {
            start();

            SubmitReceipt receipt = dispatcher.submit("hello", "caller-1");
            JobResult result = await(receipt);

            assertThat(receipt.queuePosition()).isGreaterThanOrEqualTo(1);
            assertThat(result.isSuccess()).isTrue();
            assertThat(result.output()).isEqualTo("echo:hello");
            assertThat(result.attempts()).isEqualTo(1);
            assertThat(result.instanceId()).isNotNull();
            assertThat(counters.getSuccessCount()).isEqualTo(1);
            assertThat(history).extracting(JobResult::jobId).containsExactly(receipt.jobId());
            assertThat(eventsFor(receipt.jobId())).containsExactly(
                    PoolEventType.JOB_QUEUED, PoolEventType.JOB_DISPATCHED, PoolEventType.JOB_COMPLETED);
        }

        @Test
        @DisplayName("should carry conversation state across jobs on the same instance")
        void shouldCarryConversation() throws Exception {
            AtomicInteger lastHistorySize = new AtomicInteger(-1);
            provisioner.setBehavior(request -> {
                lastHistorySize.set(request.history().size());
                return "ok";
            });
            start();

            JobResult first = await(dispatcher.submit("one", "caller-1"));
            JobResult second = await(dispatcher.submit("two", "caller-1"));

            assertThat(second.instanceId()).isEqualTo(first.instanceId());
            assertThat(lastHistorySize.get()).isEqualTo(1);
        }

        @Test
        @DisplayName("should fail validation without dispatching")
        void shouldFailValidation() throws Exception {
            start();

            JobResult result = await(dispatcher.submit("  ", "caller-1"));

            assertThat(result.isSuccess()).isFalse();
            assertThat(result.errorType()).isEqualTo(ErrorType.VALIDATION_ERROR);
            assertThat(result.attempts()).isZero();
            assertThat(provisioner.all()).allMatch(c -> c.getExecutions() == 0);
        }

        @Test
        @DisplayName("should report unknown job ids")
        void shouldRejectUnknownJob() {
            start();

            assertThatThrownBy(() -> dispatcher.awaitResult("nope")).isInstanceOf(NotFoundException.class);
            assertThatThrownBy(() -> dispatcher.cancel("nope")).isInstanceOf(NotFoundException.class);
        }
    }

    @Nested
    @DisplayName("Retries")
    class RetryTests {

        @Test
        @DisplayName("should retry a transient failure and then succeed")
        void shouldRetryThenSucceed() throws Exception {
            AtomicInteger calls = new AtomicInteger();
            provisioner.setBehavior(request -> {
                if (calls.incrementAndGet() <= 2) {
                    throw new IllegalStateException("worker hiccup");
                }
                return "recovered";
            });
            start();

            SubmitReceipt receipt = dispatcher.submit("hello", "caller-1");
            JobResult result = await(receipt);

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.output()).isEqualTo("recovered");
            assertThat(result.attempts()).isEqualTo(3);
            assertThat(counters.getRetryCount()).isEqualTo(2);
            assertThat(eventsFor(receipt.jobId()))
                    .filteredOn(type -> type == PoolEventType.JOB_RETRY_SCHEDULED)
                    .hasSize(2);
        }

        @Test
        @DisplayName("should fail terminally after max attempts and never retry again")
        void shouldStopAfterMaxAttempts() throws Exception {
            AtomicInteger calls = new AtomicInteger();
            provisioner.setBehavior(request -> {
                calls.incrementAndGet();
                throw new IllegalStateException("always broken");
            });
            start();

            JobResult result = await(dispatcher.submit("hello", "caller-1"));
            Thread.sleep(200);

            assertThat(result.isSuccess()).isFalse();
            assertThat(result.errorType()).isEqualTo(ErrorType.EXECUTION_ERROR);
            assertThat(result.errorMessage()).contains("always broken");
            assertThat(result.attempts()).isEqualTo(3);
            assertThat(calls.get()).isEqualTo(3);
            assertThat(counters.getFailureCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("should not retry a non-retryable failure")
        void shouldNotRetryTerminalError() throws Exception {
            AtomicInteger calls = new AtomicInteger();
            provisioner.setBehavior(request -> {
                calls.incrementAndGet();
                throw WorkerExecutionException.terminal("payload refused");
            });
            start();

            JobResult result = await(dispatcher.submit("hello", "caller-1"));

            assertThat(result.isSuccess()).isFalse();
            assertThat(result.attempts()).isEqualTo(1);
            assertThat(calls.get()).isEqualTo(1);
        }

        @Test
        @DisplayName("should honor a per-job attempt budget")
        void shouldHonorPerJobAttempts() throws Exception {
            AtomicInteger calls = new AtomicInteger();
            provisioner.setBehavior(request -> {
                calls.incrementAndGet();
                throw new IllegalStateException("broken");
            });
            start();

            JobResult result = await(dispatcher.submit("hello", "caller-1", SubmitOptions.defaults().withMaxAttempts(1)));

            assertThat(result.attempts()).isEqualTo(1);
            assertThat(calls.get()).isEqualTo(1);
        }

        @Test
        @DisplayName("should recycle the instance when execution times out")
        void shouldRecycleOnTimeout() throws Exception {
            provisioner.setBehavior(StubProvisioner.sleeping(2_000));
            start(builder -> builder.executionTimeout(Duration.ofMillis(100)).maxAttempts(1));

            JobResult result = await(dispatcher.submit("slow", "caller-1"));

            assertThat(result.isSuccess()).isFalse();
            assertThat(result.errorType()).isEqualTo(ErrorType.EXECUTION_TIMEOUT);
            assertThat(pool.getRecycledCount()).isEqualTo(1);
            StubWorkerCapability timedOut = provisioner.get(result.instanceId());
            assertThat(timedOut.isDisposed()).isTrue();
            assertThat(pool.getInstance(result.instanceId())).isEmpty();
        }
    }

    @Nested
    @DisplayName("Admission")
    class AdmissionTests {

        @Test
        @DisplayName("should reject submissions 6 to 10 over the rate limit without enqueuing them")
        void shouldRateLimit() {
            provisioner.setBehavior(StubProvisioner.sleeping(10));
            start(builder -> builder.rateLimiter(new SlidingWindowRateLimiter(5, Duration.ofHours(1))));

            int accepted = 0;
            List<Integer> rejected = new ArrayList<>();
            for (int i = 1; i <= 10; i++) {
                try {
                    dispatcher.submit("job-" + i, "caller-1");
                    accepted++;
                } catch (RateLimitExceededException e) {
                    rejected.add(i);
                }
            }

            assertThat(accepted).isEqualTo(5);
            assertThat(rejected).containsExactly(6, 7, 8, 9, 10);
            assertThat(counters.getTotalRequests()).isEqualTo(5);
            assertThat(counters.getRejectedCount()).isEqualTo(5);
        }

        @Test
        @DisplayName("should apply backpressure when the ring buffer is full")
        void shouldApplyBackpressure() {
            provisioner.setBehavior(StubProvisioner.sleeping(1_000));
            start(builder -> builder.ringBufferSize(2).maxConcurrent(1));

            int backpressured = 0;
            for (int i = 0; i < 4; i++) {
                try {
                    dispatcher.submit("job-" + i, "caller-1");
                } catch (BackpressureException e) {
                    backpressured++;
                }
            }

            assertThat(backpressured).isGreaterThanOrEqualTo(1);
            assertThat(counters.getRejectedCount()).isEqualTo(backpressured);
        }

        @Test
        @DisplayName("should not charge the caller's quota for submissions refused by a full queue")
        void shouldNotChargeQuotaOnBackpressure() {
            provisioner.setBehavior(StubProvisioner.sleeping(1_000));
            SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter(5, Duration.ofHours(1));
            start(builder -> builder.ringBufferSize(2).maxConcurrent(1).rateLimiter(limiter));

            int accepted = 0;
            int backpressured = 0;
            for (int i = 0; i < 5; i++) {
                try {
                    dispatcher.submit("job-" + i, "caller-1");
                    accepted++;
                } catch (BackpressureException e) {
                    backpressured++;
                }
            }

            assertThat(backpressured).isGreaterThanOrEqualTo(1);
            assertThat(accepted + backpressured).isEqualTo(5);
            assertThat(limiter.remaining("caller-1")).isEqualTo(5 - accepted);
        }

        @Test
        @DisplayName("should turn a rate-limited batch member into a failed result")
        void shouldKeepBatchGoing() throws Exception {
            start(builder -> builder.rateLimiter(new SlidingWindowRateLimiter(2, Duration.ofHours(1))));

            List<JobResult> results = dispatcher
                    .submitBatch(List.of("a", "b", "c"), "caller-1", SubmitOptions.defaults())
                    .get(10, TimeUnit.SECONDS);

            assertThat(results).hasSize(3);
            assertThat(results.get(0).isSuccess()).isTrue();
            assertThat(results.get(1).isSuccess()).isTrue();
            assertThat(results.get(2).isSuccess()).isFalse();
            assertThat(results.get(2).errorType()).isEqualTo(ErrorType.RATE_LIMIT_EXCEEDED);
        }
    }

    @Nested
    @DisplayName("Cancellation and shutdown")
    class LifecycleTests {

        @Test
        @DisplayName("should list waiting jobs in dispatch order")
        void shouldReportQueueStatus() throws Exception {
            provisioner.setBehavior(StubProvisioner.sleeping(300));
            start(builder -> builder.maxConcurrent(1));

            SubmitReceipt running = dispatcher.submit("first", "caller-1");
            awaitTrue(() -> dispatcher.getJob(running.jobId()).map(Job::getState).orElse(null) == JobState.DISPATCHED,
                    Duration.ofSeconds(5), "first job dispatched");
            SubmitReceipt second = dispatcher.submit("second", "caller-1");
            SubmitReceipt third = dispatcher.submit("third", "caller-2", SubmitOptions.defaults().withPriority(7));

            QueueStatus status = dispatcher.queueStatus();

            assertThat(status.length()).isEqualTo(2);
            assertThat(status.remainingCapacity()).isLessThanOrEqualTo(64);
            assertThat(status.jobs()).extracting(QueueStatus.QueuedJob::jobId)
                    .containsExactly(second.jobId(), third.jobId());
            assertThat(status.jobs()).extracting(QueueStatus.QueuedJob::position).containsExactly(1, 2);
            QueueStatus.QueuedJob last = status.jobs().get(1);
            assertThat(last.callerId()).isEqualTo("caller-2");
            assertThat(last.state()).isEqualTo(JobState.QUEUED);
            assertThat(last.priority()).isEqualTo(7);
            assertThat(last.submittedAt()).isNotNull();
            assertThat(last.waitTime()).isGreaterThanOrEqualTo(Duration.ZERO);

            await(third);
            assertThat(dispatcher.queueStatus().length()).isZero();
        }

        @Test
        @DisplayName("should cancel a queued job before it runs")
        void shouldCancelQueuedJob() throws Exception {
            provisioner.setBehavior(StubProvisioner.sleeping(300));
            start(builder -> builder.maxConcurrent(1));

            SubmitReceipt running = dispatcher.submit("first", "caller-1");
            SubmitReceipt queued = dispatcher.submit("second", "caller-1");

            assertThat(dispatcher.cancel(queued.jobId())).isTrue();

            JobResult cancelled = await(queued);
            JobResult completed = await(running);
            Thread.sleep(100);

            assertThat(cancelled.errorType()).isEqualTo(ErrorType.CANCELLED);
            assertThat(completed.isSuccess()).isTrue();
            assertThat(provisioner.all().stream().mapToInt(StubWorkerCapability::getExecutions).sum())
                    .isEqualTo(1);
            assertThat(dispatcher.cancel(running.jobId())).isFalse();
        }

        @Test
        @DisplayName("should fail queued jobs with SHUTTING_DOWN on close")
        void shouldFailQueuedJobsOnClose() throws Exception {
            provisioner.setBehavior(StubProvisioner.sleeping(300));
            start(builder -> builder.maxConcurrent(1));

            dispatcher.submit("first", "caller-1");
            SubmitReceipt second = dispatcher.submit("second", "caller-1");
            SubmitReceipt third = dispatcher.submit("third", "caller-1");

            dispatcher.close();

            assertThat(await(second).errorType()).isEqualTo(ErrorType.SHUTTING_DOWN);
            assertThat(await(third).errorType()).isEqualTo(ErrorType.SHUTTING_DOWN);
            assertThatThrownBy(() -> dispatcher.submit("late", "caller-1"))
                    .isInstanceOf(ShuttingDownException.class);
        }
    }
}
