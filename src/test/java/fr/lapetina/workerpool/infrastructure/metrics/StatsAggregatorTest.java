package fr.lapetina.workerpool.infrastructure.metrics;

import fr.lapetina.workerpool.domain.model.InstanceSnapshot;
import fr.lapetina.workerpool.domain.model.PoolStats;
import fr.lapetina.workerpool.domain.model.WorkerInstance;
import fr.lapetina.workerpool.pool.PoolConfig;
import fr.lapetina.workerpool.pool.PoolManager;
import fr.lapetina.workerpool.support.StubProvisioner;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class StatsAggregatorTest {

    private PoolManager pool;
    private JobCounters counters;
    private StatsAggregator aggregator;

    @BeforeEach
    void setUp() {
        pool = new PoolManager(PoolConfig.builder().minInstances(2).maxInstances(4).build(), new StubProvisioner());
        counters = new JobCounters();
        aggregator = new StatsAggregator(pool, counters, () -> 7);
    }

    @AfterEach
    void tearDown() {
        pool.shutdown();
    }

    @Test
    @DisplayName("should report zero utilization for an empty pool")
    void shouldHandleEmptyPool() {
        PoolStats stats = aggregator.snapshot();

        assertThat(stats.poolSize()).isZero();
        assertThat(stats.utilization()).isZero();
        assertThat(stats.instances()).isEmpty();
    }

    @Test
    @DisplayName("should derive utilization from busy instances")
    void shouldComputeUtilization() {
        pool.initialize();
        pool.acquire(Duration.ofSeconds(1));

        PoolStats stats = aggregator.snapshot();

        assertThat(stats.poolSize()).isEqualTo(2);
        assertThat(stats.busyCount()).isEqualTo(1);
        assertThat(stats.healthyCount()).isEqualTo(2);
        assertThat(stats.utilization()).isEqualTo(0.5);
        assertThat(stats.minInstances()).isEqualTo(2);
        assertThat(stats.maxInstances()).isEqualTo(4);
        assertThat(stats.queueDepth()).isEqualTo(7);
        assertThat(stats.instances()).extracting(InstanceSnapshot::busy).containsExactlyInAnyOrder(true, false);
    }

    @Test
    @DisplayName("should expose job counters and the running latency mean")
    void shouldExposeCounters() {
        counters.recordSubmitted();
        counters.recordSubmitted();
        counters.recordSubmitted();
        counters.recordSuccess(100);
        counters.recordSuccess(300);
        counters.recordFailure();
        counters.recordRejected();
        counters.recordRetry();

        PoolStats stats = aggregator.snapshot();

        assertThat(stats.totalRequests()).isEqualTo(3);
        assertThat(stats.successCount()).isEqualTo(2);
        assertThat(stats.failureCount()).isEqualTo(1);
        assertThat(stats.rejectedCount()).isEqualTo(1);
        assertThat(stats.retryCount()).isEqualTo(1);
        assertThat(stats.averageLatency()).isCloseTo(200.0, within(0.001));
    }

    @Test
    @DisplayName("should count recycled instances")
    void shouldCountRecycled() {
        pool.initialize();
        WorkerInstance instance = pool.instances().get(0);

        pool.recycle(instance.getId());

        assertThat(aggregator.snapshot().recycledCount()).isEqualTo(1);
    }
}
