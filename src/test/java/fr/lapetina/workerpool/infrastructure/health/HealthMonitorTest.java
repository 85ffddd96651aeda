package fr.lapetina.workerpool.infrastructure.health;

import fr.lapetina.workerpool.domain.event.EventPublisher;
import fr.lapetina.workerpool.domain.event.PoolEvent;
import fr.lapetina.workerpool.domain.event.PoolEventType;
import fr.lapetina.workerpool.domain.model.PoolStats;
import fr.lapetina.workerpool.domain.model.WorkerInstance;
import fr.lapetina.workerpool.infrastructure.metrics.JobCounters;
import fr.lapetina.workerpool.infrastructure.metrics.StatsAggregator;
import fr.lapetina.workerpool.pool.PoolConfig;
import fr.lapetina.workerpool.pool.PoolManager;
import fr.lapetina.workerpool.support.MutableClock;
import fr.lapetina.workerpool.support.StubProvisioner;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static fr.lapetina.workerpool.support.Conditions.awaitTrue;
import static org.assertj.core.api.Assertions.assertThat;

class HealthMonitorTest {

    private StubProvisioner provisioner;
    private MutableClock clock;
    private EventPublisher events;
    private List<PoolEvent> received;
    private PoolManager pool;
    private HealthMonitor monitor;

    @BeforeEach
    void setUp() {
        provisioner = new StubProvisioner();
        clock = new MutableClock(Instant.parse("2026-01-01T10:00:00Z"));
        events = new EventPublisher();
        received = new CopyOnWriteArrayList<>();
        events.addListener(received::add);

        PoolConfig config = PoolConfig.builder()
                .minInstances(2)
                .maxInstances(3)
                .staleTimeout(Duration.ofMinutes(1))
                .healthCheckInterval(Duration.ofMillis(100))
                .probeTimeout(Duration.ofMillis(500))
                .build();
        pool = new PoolManager(config, provisioner, PoolManager.FIRST_ELIGIBLE, events, clock);
        pool.initialize();
        monitor = new HealthMonitor(pool, new StatsAggregator(pool, new JobCounters()), events, clock);
    }

    @AfterEach
    void tearDown() {
        monitor.close();
        pool.shutdown();
    }

    @Test
    @DisplayName("should recycle an idle instance failing its probe and restore the minimum")
    void shouldRecycleOnProbeFailure() {
        String failing = pool.instances().get(0).getId();
        provisioner.get(failing).setProbeFails(true);

        PoolStats stats = monitor.checkAll();

        assertThat(pool.getInstance(failing)).isEmpty();
        assertThat(provisioner.get(failing).isDisposed()).isTrue();
        assertThat(stats.poolSize()).isEqualTo(2);
        assertThat(stats.healthyCount()).isEqualTo(2);
        assertThat(stats.recycledCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("should replace instances failing warm-up before traffic")
    void shouldReplaceInstancesFailingWarmUp() {
        String failing = pool.instances().get(0).getId();
        String passing = pool.instances().get(1).getId();
        provisioner.get(failing).setProbeFails(true);
        clock.advance(Duration.ofSeconds(30));

        int failed = monitor.warmUp();

        assertThat(failed).isEqualTo(1);
        assertThat(pool.getInstance(failing)).isEmpty();
        assertThat(provisioner.get(failing).isDisposed()).isTrue();
        assertThat(pool.size()).isEqualTo(2);
        assertThat(pool.getInstance(passing)).map(WorkerInstance::getLastHealthCheck)
                .contains(Instant.parse("2026-01-01T10:00:30Z"));
        assertThat(received).extracting(PoolEvent::type).doesNotContain(PoolEventType.HEALTH_CHECK_COMPLETED);
    }

    @Test
    @DisplayName("should leave busy instances alone")
    void shouldSkipBusyInstances() {
        WorkerInstance busy = pool.acquire(Duration.ofSeconds(1));
        provisioner.get(busy.getId()).setProbeFails(true);

        monitor.checkAll();

        assertThat(pool.getInstance(busy.getId())).isPresent();
        assertThat(busy.isHealthy()).isTrue();
        assertThat(pool.getRecycledCount()).isZero();
    }

    @Test
    @DisplayName("should recycle stale idle instances and replace them")
    void shouldRecycleStaleInstances() {
        List<String> original = pool.instances().stream().map(WorkerInstance::getId).toList();
        clock.advance(Duration.ofMinutes(2));

        PoolStats stats = monitor.checkAll();

        assertThat(stats.poolSize()).isEqualTo(2);
        assertThat(stats.recycledCount()).isEqualTo(2);
        assertThat(pool.instances()).extracting(WorkerInstance::getId).doesNotContainAnyElementsOf(original);
    }

    @Test
    @DisplayName("should replenish a pool below its minimum")
    void shouldReplenishBelowMinimum() {
        provisioner.failNext(1);
        pool.recycle(pool.instances().get(0).getId());
        assertThat(pool.size()).isEqualTo(1);

        PoolStats stats = monitor.checkAll();

        assertThat(stats.poolSize()).isEqualTo(2);
    }

    @Test
    @DisplayName("should publish a snapshot after every pass")
    void shouldPublishSnapshot() {
        monitor.checkAll();

        assertThat(received).filteredOn(e -> e.type() == PoolEventType.HEALTH_CHECK_COMPLETED)
                .singleElement()
                .satisfies(event -> assertThat(event.stats().poolSize()).isEqualTo(2));
    }

    @Test
    @DisplayName("should run on its own schedule until closed")
    void shouldRunPeriodically() {
        monitor.start();

        awaitTrue(() -> received.stream().filter(e -> e.type() == PoolEventType.HEALTH_CHECK_COMPLETED).count() >= 2,
                Duration.ofSeconds(5), "two health passes");
        monitor.close();

        assertThat(monitor.isRunning()).isFalse();
    }
}
