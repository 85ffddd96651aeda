package fr.lapetina.workerpool;

import fr.lapetina.workerpool.dispatcher.JobDispatcher;
import fr.lapetina.workerpool.dispatcher.JobOutcomeRecorder;
import fr.lapetina.workerpool.dispatcher.SlidingWindowRateLimiter;
import fr.lapetina.workerpool.domain.event.EventPublisher;
import fr.lapetina.workerpool.domain.event.PoolEvent;
import fr.lapetina.workerpool.domain.event.PoolEventListener;
import fr.lapetina.workerpool.domain.event.PoolEventType;
import fr.lapetina.workerpool.domain.exception.ShuttingDownException;
import fr.lapetina.workerpool.domain.model.JobResult;
import fr.lapetina.workerpool.domain.model.PoolStats;
import fr.lapetina.workerpool.domain.model.QueueStatus;
import fr.lapetina.workerpool.domain.model.SubmitOptions;
import fr.lapetina.workerpool.domain.model.SubmitReceipt;
import fr.lapetina.workerpool.domain.strategy.LoadBalancer;
import fr.lapetina.workerpool.infrastructure.config.ConfigLoader;
import fr.lapetina.workerpool.infrastructure.config.OrchestratorConfig;
import fr.lapetina.workerpool.infrastructure.health.HealthMonitor;
import fr.lapetina.workerpool.infrastructure.metrics.JobCounters;
import fr.lapetina.workerpool.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.workerpool.infrastructure.metrics.StatsAggregator;
import fr.lapetina.workerpool.pool.PoolManager;
import fr.lapetina.workerpool.spi.JobHistoryStore;
import fr.lapetina.workerpool.spi.RateLimiter;
import fr.lapetina.workerpool.spi.WorkerProvisioner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Single logical service in front of a pool of stateful workers.
 *
 * Wires the pool manager, load balancer, job dispatcher, health monitor and
 * metrics from one configuration. Callers construct as many orchestrators as
 * they need; nothing is global.
 *
 * <p>Usage:
 * <pre>{@code
 * try (WorkerPoolOrchestrator orchestrator = WorkerPoolOrchestrator.fromConfig("worker-pool.yaml", provisioner)) {
 *     orchestrator.initialize();
 *     SubmitReceipt receipt = orchestrator.submit("hello", "caller-1");
 *     JobResult result = orchestrator.awaitResult(receipt.jobId()).join();
 * }
 * }</pre>
 */
public class WorkerPoolOrchestrator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WorkerPoolOrchestrator.class);

    private final OrchestratorConfig config;
    private final EventPublisher events;
    private final LoadBalancer loadBalancer;
    private final PoolManager pool;
    private final JobCounters counters;
    private final MetricsRegistry metricsRegistry;
    private final JobDispatcher dispatcher;
    private final StatsAggregator stats;
    private final HealthMonitor healthMonitor;

    private final AtomicBoolean initialized = new AtomicBoolean(false);
    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    private WorkerPoolOrchestrator(Builder builder) {
        this.config = builder.config;
        this.events = new EventPublisher();
        builder.listeners.forEach(events::addListener);

        this.loadBalancer = new LoadBalancer(config.getStrategy().getType());
        log.info("Using load balancing strategy: {}", loadBalancer.getStrategy().getName());

        this.pool = new PoolManager(config.toPoolConfig(), builder.provisioner, loadBalancer, events, builder.clock);
        this.counters = new JobCounters();
        this.metricsRegistry = new MetricsRegistry(
                config.getMetrics().getPrefix(),
                config.getMetrics().isJvmMetrics()
        );

        JobOutcomeRecorder outcomes = new JobOutcomeRecorder(counters, metricsRegistry, events, builder.historyStore);
        this.dispatcher = JobDispatcher.builder()
                .fromConfig(config)
                .pool(pool)
                .loadBalancer(loadBalancer)
                .outcomes(outcomes)
                .counters(counters)
                .rateLimiter(builder.rateLimiter != null ? builder.rateLimiter : createRateLimiter(builder.clock))
                .build();

        this.stats = new StatsAggregator(pool, counters, dispatcher::queueDepth);
        this.healthMonitor = new HealthMonitor(pool, stats, events, builder.clock);
        metricsRegistry.bindPool(pool, dispatcher::queueDepth);
    }

    /**
     * Creates an orchestrator from a YAML file on the file system or the classpath.
     *
     * @throws ConfigLoader.ConfigurationException if the file cannot be loaded
     */
    public static WorkerPoolOrchestrator fromConfig(String configPath, WorkerProvisioner provisioner) {
        log.info("Loading orchestrator configuration: {}", configPath);
        OrchestratorConfig config = new ConfigLoader(configPath).load();
        return builder().config(config).provisioner(provisioner).build();
    }

    /**
     * Creates the minimum number of instances, warms them up unless disabled, and starts
     * the dispatcher and health monitor.
     *
     * @return pool stats right after initialization
     * @throws IllegalStateException if already initialized
     * @throws ShuttingDownException if the orchestrator was shut down
     */
    public PoolStats initialize() {
        if (shutdown.get()) {
            throw new ShuttingDownException("Orchestrator is shut down");
        }
        if (!initialized.compareAndSet(false, true)) {
            throw new IllegalStateException("Orchestrator already initialized");
        }
        int created = pool.initialize();
        if (pool.getConfig().isWarmupOnStart()) {
            healthMonitor.warmUp();
        }
        dispatcher.start();
        healthMonitor.start();

        PoolStats snapshot = stats.snapshot();
        events.publish(PoolEvent.withStats(PoolEventType.POOL_INITIALIZED, snapshot));
        log.info("Orchestrator initialized: instances={}, minInstances={}, maxInstances={}, maxConcurrent={}",
                created, snapshot.minInstances(), snapshot.maxInstances(), dispatcher.getMaxConcurrent());
        return snapshot;
    }

    /**
     * Enqueues a job for the caller.
     *
     * @throws fr.lapetina.workerpool.domain.exception.RateLimitExceededException if the caller is over quota
     * @throws fr.lapetina.workerpool.dispatcher.exception.BackpressureException  if the queue is full
     * @throws ShuttingDownException                                                if not accepting jobs
     */
    public SubmitReceipt submit(String payload, String callerId, SubmitOptions options) {
        requireInitialized();
        return dispatcher.submit(payload, callerId, options);
    }

    public SubmitReceipt submit(String payload, String callerId) {
        return submit(payload, callerId, SubmitOptions.defaults());
    }

    /**
     * Submits independent jobs and completes once all of them are terminal.
     */
    public CompletableFuture<List<JobResult>> submitBatch(List<String> payloads, String callerId,
                                                          SubmitOptions options) {
        requireInitialized();
        return dispatcher.submitBatch(new ArrayList<>(payloads), callerId, options);
    }

    public CompletableFuture<List<JobResult>> submitBatch(List<String> payloads, String callerId) {
        return submitBatch(payloads, callerId, SubmitOptions.defaults());
    }

    /**
     * @throws fr.lapetina.workerpool.domain.exception.NotFoundException for unknown job ids
     */
    public CompletableFuture<JobResult> awaitResult(String jobId) {
        return dispatcher.awaitResult(jobId);
    }

    /**
     * Cancels a job that is queued or waiting for a retry.
     */
    public boolean cancel(String jobId) {
        return dispatcher.cancel(jobId);
    }

    /**
     * Jobs waiting to start, with their position, submission time and wait so far.
     */
    public QueueStatus queueStatus() {
        return dispatcher.queueStatus();
    }

    public PoolStats stats() {
        return stats.snapshot();
    }

    /**
     * Forces an instance out of the pool, busy or not.
     *
     * @throws fr.lapetina.workerpool.domain.exception.NotFoundException for unknown instance ids
     */
    public void recycle(String instanceId) {
        log.info("Recycle requested: instanceId={}", instanceId);
        pool.recycle(instanceId);
    }

    public void addListener(PoolEventListener listener) {
        events.addListener(listener);
    }

    public void removeListener(PoolEventListener listener) {
        events.removeListener(listener);
    }

    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    public LoadBalancer getLoadBalancer() {
        return loadBalancer;
    }

    public PoolManager getPool() {
        return pool;
    }

    public HealthMonitor getHealthMonitor() {
        return healthMonitor;
    }

    public OrchestratorConfig getConfig() {
        return config;
    }

    /**
     * Stops the health monitor, recycles every instance and fails whatever is
     * still queued or waiting with SHUTTING_DOWN.
     */
    public void shutdown() {
        if (!shutdown.compareAndSet(false, true)) {
            return;
        }
        log.info("Shutting down orchestrator...");

        try {
            healthMonitor.close();
        } catch (Exception e) {
            log.warn("Error closing health monitor", e);
        }

        dispatcher.stopAccepting();
        pool.shutdown();

        try {
            dispatcher.close();
        } catch (Exception e) {
            log.warn("Error closing dispatcher", e);
        }

        try {
            metricsRegistry.close();
        } catch (Exception e) {
            log.warn("Error closing metrics registry", e);
        }

        log.info("Orchestrator shut down");
    }

    @Override
    public void close() {
        shutdown();
    }

    private void requireInitialized() {
        if (!initialized.get()) {
            throw new IllegalStateException("Orchestrator not initialized");
        }
    }

    private RateLimiter createRateLimiter(Clock clock) {
        OrchestratorConfig.RateLimitConfig rateLimit = config.getRateLimit();
        if (!rateLimit.isEnabled()) {
            return RateLimiter.unlimited();
        }
        return new SlidingWindowRateLimiter(rateLimit.getMaxRequests(), Duration.ofMillis(rateLimit.getWindowMs()), clock);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for WorkerPoolOrchestrator.
     */
    public static final class Builder {
        private OrchestratorConfig config = ConfigLoader.createDefault();
        private WorkerProvisioner provisioner;
        private RateLimiter rateLimiter;
        private JobHistoryStore historyStore = JobHistoryStore.NONE;
        private final List<PoolEventListener> listeners = new ArrayList<>();
        private Clock clock = Clock.systemUTC();

        public Builder config(OrchestratorConfig config) {
            this.config = config;
            return this;
        }

        public Builder provisioner(WorkerProvisioner provisioner) {
            this.provisioner = provisioner;
            return this;
        }

        /**
         * Replaces the in-memory limiter built from the {@code rateLimit} section.
         */
        public Builder rateLimiter(RateLimiter rateLimiter) {
            this.rateLimiter = rateLimiter;
            return this;
        }

        public Builder historyStore(JobHistoryStore historyStore) {
            this.historyStore = historyStore;
            return this;
        }

        public Builder listener(PoolEventListener listener) {
            this.listeners.add(listener);
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public WorkerPoolOrchestrator build() {
            if (config == null) {
                throw new IllegalStateException("Configuration is required");
            }
            if (provisioner == null) {
                throw new IllegalStateException("WorkerProvisioner is required");
            }
            if (clock == null) {
                throw new IllegalStateException("Clock is required");
            }
            return new WorkerPoolOrchestrator(this);
        }
    }
}
