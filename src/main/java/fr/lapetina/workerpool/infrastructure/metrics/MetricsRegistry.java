package fr.lapetina.workerpool.infrastructure.metrics;

import fr.lapetina.workerpool.domain.model.ErrorType;
import fr.lapetina.workerpool.pool.PoolManager;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.IntSupplier;

/**
 * Centralized metrics registry using Micrometer.
 *
 * Provides:
 * - Pool gauges (size, busy, healthy, waiting callers, queue depth)
 * - Job outcome counters by error type
 * - Execution latency timer
 * - JVM and system metrics
 * - Prometheus exposition
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    private final PrometheusMeterRegistry registry;
    private final String prefix;

    private final ConcurrentHashMap<String, Counter> outcomeCounters = new ConcurrentHashMap<>();
    private final Timer executionTimer;
    private final Counter retryCounter;
    private final Counter rejectedCounter;

    public MetricsRegistry(String prefix, boolean jvmMetrics) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        if (jvmMetrics) {
            new JvmMemoryMetrics().bindTo(registry);
            new JvmGcMetrics().bindTo(registry);
            new JvmThreadMetrics().bindTo(registry);
            new ProcessorMetrics().bindTo(registry);
        }

        this.executionTimer = Timer.builder(prefix + "_job_execution")
                .description("Worker execution latency of successful jobs")
                .publishPercentiles(0.5, 0.9, 0.95, 0.99)
                .register(registry);
        this.retryCounter = Counter.builder(prefix + "_job_retries_total")
                .description("Job attempts rescheduled after a retryable failure")
                .register(registry);
        this.rejectedCounter = Counter.builder(prefix + "_job_rejected_total")
                .description("Submissions refused before enqueue")
                .register(registry);

        log.info("MetricsRegistry initialized: prefix={}, jvmMetrics={}", prefix, jvmMetrics);
    }

    public MetricsRegistry() {
        this("worker_pool", true);
    }

    /**
     * Registers gauges that read the pool on every scrape.
     */
    public void bindPool(PoolManager pool, IntSupplier queueDepth) {
        Gauge.builder(prefix + "_instances", pool, PoolManager::size)
                .description("Number of worker instances")
                .register(registry);
        Gauge.builder(prefix + "_instances_busy", pool,
                        p -> p.instances().stream().filter(i -> i.isBusy()).count())
                .description("Number of busy worker instances")
                .register(registry);
        Gauge.builder(prefix + "_instances_healthy", pool,
                        p -> p.instances().stream().filter(i -> i.isHealthy()).count())
                .description("Number of healthy worker instances")
                .register(registry);
        Gauge.builder(prefix + "_acquire_waiters", pool, PoolManager::waitingCount)
                .description("Callers parked waiting for an instance")
                .register(registry);
        Gauge.builder(prefix + "_queue_depth", queueDepth, IntSupplier::getAsInt)
                .description("Jobs waiting for a processing slot")
                .register(registry);
        FunctionCounter.builder(prefix + "_instances_recycled_total", pool, PoolManager::getRecycledCount)
                .description("Worker instances recycled")
                .register(registry);
    }

    /**
     * Counts a terminal job outcome. {@code errorType} is null for successes.
     */
    public void recordOutcome(ErrorType errorType) {
        String outcome = errorType == null ? "success" : "failure";
        String type = errorType == null ? "none" : errorType.name();
        outcomeCounters.computeIfAbsent(outcome + ":" + type, k ->
                Counter.builder(prefix + "_jobs_total")
                        .description("Jobs that reached a terminal state")
                        .tag("outcome", outcome)
                        .tag("type", type)
                        .register(registry)
        ).increment();
    }

    public void recordExecution(Duration latency) {
        executionTimer.record(latency);
    }

    public void incrementRetry() {
        retryCounter.increment();
    }

    public void incrementRejected() {
        rejectedCounter.increment();
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    /**
     * Returns the underlying Micrometer registry.
     */
    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        registry.close();
    }
}
