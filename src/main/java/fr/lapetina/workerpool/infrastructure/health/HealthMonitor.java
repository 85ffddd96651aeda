package fr.lapetina.workerpool.infrastructure.health;

import fr.lapetina.workerpool.domain.event.EventPublisher;
import fr.lapetina.workerpool.domain.event.PoolEvent;
import fr.lapetina.workerpool.domain.event.PoolEventType;
import fr.lapetina.workerpool.domain.model.PoolStats;
import fr.lapetina.workerpool.domain.model.WorkerInstance;
import fr.lapetina.workerpool.infrastructure.metrics.StatsAggregator;
import fr.lapetina.workerpool.pool.PoolManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Background health monitor for worker instances.
 *
 * Runs on a fixed delay, independent of traffic. Each pass recycles stale idle
 * instances, probes the remaining idle ones and recycles those that fail, then
 * tops the pool back up to its minimum and publishes a stats snapshot.
 * Probe failures never reach callers.
 */
public final class HealthMonitor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HealthMonitor.class);

    private final PoolManager pool;
    private final StatsAggregator stats;
    private final EventPublisher events;
    private final Clock clock;
    private final Duration checkInterval;
    private final Duration probeTimeout;
    private final ScheduledExecutorService scheduler;
    private final ExecutorService probeExecutor;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public HealthMonitor(PoolManager pool, StatsAggregator stats, EventPublisher events, Clock clock) {
        this.pool = pool;
        this.stats = stats;
        this.events = events;
        this.clock = clock;
        this.checkInterval = pool.getConfig().getHealthCheckInterval();
        this.probeTimeout = pool.getConfig().getProbeTimeout();
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "health-monitor");
            t.setDaemon(true);
            return t;
        });
        AtomicInteger probeThreads = new AtomicInteger(0);
        this.probeExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "health-probe-" + probeThreads.getAndIncrement());
            t.setDaemon(true);
            return t;
        });
    }

    public HealthMonitor(PoolManager pool, StatsAggregator stats, EventPublisher events) {
        this(pool, stats, events, Clock.systemUTC());
    }

    /**
     * Starts the periodic checks. The first pass runs one interval after start.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            scheduler.scheduleWithFixedDelay(
                    this::runScheduledPass,
                    checkInterval.toMillis(),
                    checkInterval.toMillis(),
                    TimeUnit.MILLISECONDS
            );
            log.info("Health monitor started with interval: {}", checkInterval);
        }
    }

    private void runScheduledPass() {
        if (!running.get()) {
            return;
        }
        try {
            checkAll();
        } catch (RuntimeException e) {
            // An escaping exception would cancel the schedule
            log.error("Health check pass failed", e);
        }
    }

    /**
     * Runs one full pass over the pool and returns the snapshot it published.
     */
    public PoolStats checkAll() {
        var instances = pool.instances();
        log.debug("Starting health check cycle: instanceCount={}", instances.size());

        int recycled = 0;
        for (WorkerInstance instance : instances) {
            if (pool.isShuttingDown()) {
                break;
            }
            if (instance.isBusy()) {
                continue;
            }
            if (pool.recycleIfStale(instance.getId())) {
                recycled++;
                continue;
            }
            if (!probe(instance) && pool.handleProbeFailure(instance.getId())) {
                recycled++;
            }
        }

        int created = pool.isShuttingDown() ? 0 : pool.ensureMinimum();
        PoolStats snapshot = stats.snapshot();
        log.info("Health check completed: poolSize={}, healthy={}, busy={}, recycled={}, created={}",
                snapshot.poolSize(), snapshot.healthyCount(), snapshot.busyCount(), recycled, created);
        events.publish(PoolEvent.withStats(PoolEventType.HEALTH_CHECK_COMPLETED, snapshot));
        return snapshot;
    }

    /**
     * Probes every instance once, before the pool takes traffic. An instance failing
     * its warm-up is marked UNHEALTHY and recycled, then the pool is topped back up.
     *
     * @return number of instances that failed warm-up
     */
    public int warmUp() {
        var instances = pool.instances();
        int failed = 0;
        for (WorkerInstance instance : instances) {
            if (pool.isShuttingDown()) {
                break;
            }
            if (!probe(instance)) {
                failed++;
                pool.handleProbeFailure(instance.getId());
            }
        }
        if (!pool.isShuttingDown()) {
            pool.ensureMinimum();
        }
        if (failed > 0) {
            log.warn("Warm-up completed with failures: instances={}, failed={}, poolSize={}",
                    instances.size(), failed, pool.size());
        } else {
            log.info("Warm-up completed: instances={}", instances.size());
        }
        return failed;
    }

    /**
     * Probes one instance within the probe timeout.
     *
     * @return true if the probe succeeded
     */
    boolean probe(WorkerInstance instance) {
        Future<?> call;
        try {
            call = probeExecutor.submit(() -> {
                instance.getCapability().probe();
                return null;
            });
        } catch (RejectedExecutionException e) {
            log.debug("Probe skipped, monitor closed: instanceId={}", instance.getId());
            return true;
        }

        try {
            call.get(probeTimeout.toMillis(), TimeUnit.MILLISECONDS);
            instance.recordHealthCheck(clock.instant());
            log.debug("Probe passed: instanceId={}", instance.getId());
            return true;
        } catch (TimeoutException e) {
            call.cancel(true);
            log.warn("Probe timed out: instanceId={}, timeoutMs={}", instance.getId(), probeTimeout.toMillis());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Probe failed: instanceId={}, error={}", instance.getId(), cause.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            call.cancel(true);
            log.debug("Probe interrupted: instanceId={}", instance.getId());
            return true;
        }
        return false;
    }

    public boolean isRunning() {
        return running.get();
    }

    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
            log.info("Health monitor stopped");
        } else {
            scheduler.shutdownNow();
        }
        probeExecutor.shutdownNow();
    }
}
