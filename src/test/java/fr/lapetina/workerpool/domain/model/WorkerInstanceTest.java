package fr.lapetina.workerpool.domain.model;

import fr.lapetina.workerpool.support.StubProvisioner;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WorkerInstanceTest {

    private static final Instant T0 = Instant.parse("2026-01-01T10:00:00Z");

    private WorkerInstance instance;

    @BeforeEach
    void setUp() {
        instance = WorkerInstance.builder()
                .id("worker-1")
                .capability(new StubProvisioner().provision("worker-1"))
                .weight(2)
                .createdAt(T0)
                .build();
    }

    @Test
    @DisplayName("should create idle healthy instance with builder")
    void shouldCreateInstanceWithBuilder() {
        assertThat(instance.getId()).isEqualTo("worker-1");
        assertThat(instance.getWeight()).isEqualTo(2);
        assertThat(instance.getCreatedAt()).isEqualTo(T0);
        assertThat(instance.getLastUsedAt()).isEqualTo(T0);
        assertThat(instance.isBusy()).isFalse();
        assertThat(instance.getHealth()).isEqualTo(InstanceHealth.HEALTHY);
        assertThat(instance.isEligible()).isTrue();
        assertThat(instance.getMessageCount()).isZero();
    }

    @Test
    @DisplayName("should reject a weight below one")
    void shouldRejectInvalidWeight() {
        assertThatThrownBy(() -> WorkerInstance.builder()
                .id("worker-2")
                .capability(new StubProvisioner().provision("worker-2"))
                .weight(0)
                .build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("should refuse a second holder")
    void shouldRefuseSecondHolder() {
        instance.markAcquired(T0.plusSeconds(1));

        assertThat(instance.isBusy()).isTrue();
        assertThat(instance.isEligible()).isFalse();
        assertThat(instance.getCurrentLoad()).isEqualTo(1);
        assertThatThrownBy(() -> instance.markAcquired(T0.plusSeconds(2)))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("should count a message on release")
    void shouldCountMessageOnRelease() {
        instance.markAcquired(T0.plusSeconds(1));
        instance.markReleased(T0.plusSeconds(5));

        assertThat(instance.isBusy()).isFalse();
        assertThat(instance.getCurrentLoad()).isZero();
        assertThat(instance.getMessageCount()).isEqualTo(1);
        assertThat(instance.getLastUsedAt()).isEqualTo(T0.plusSeconds(5));
    }

    @Test
    @DisplayName("should not count a message when returned unused")
    void shouldNotCountMessageWhenReturned() {
        instance.markAcquired(T0.plusSeconds(1));
        instance.markReturned();

        assertThat(instance.isBusy()).isFalse();
        assertThat(instance.getMessageCount()).isZero();
    }

    @Test
    @DisplayName("should be due for recycle past message budget, age or health")
    void shouldDetectRecycleConditions() {
        Duration maxAge = Duration.ofHours(1);
        assertThat(instance.shouldRecycle(2, maxAge, T0.plusSeconds(10))).isFalse();

        for (int i = 0; i < 3; i++) {
            instance.markAcquired(T0);
            instance.markReleased(T0);
        }
        assertThat(instance.shouldRecycle(2, maxAge, T0.plusSeconds(10))).isTrue();
        assertThat(instance.shouldRecycle(3, maxAge, T0.plusSeconds(10))).isFalse();

        assertThat(instance.shouldRecycle(3, maxAge, T0.plus(maxAge).plusSeconds(1))).isTrue();

        instance.setHealth(InstanceHealth.UNHEALTHY, T0.plusSeconds(5));
        assertThat(instance.shouldRecycle(3, maxAge, T0.plusSeconds(10))).isTrue();
        assertThat(instance.isEligible()).isFalse();
    }

    @Test
    @DisplayName("should stamp the health check time it is given")
    void shouldStampHealthCheckTime() {
        assertThat(instance.getLastHealthCheck()).isEqualTo(T0);

        instance.setHealth(InstanceHealth.UNHEALTHY, T0.plusSeconds(42));

        assertThat(instance.getLastHealthCheck()).isEqualTo(T0.plusSeconds(42));
        assertThat(InstanceSnapshot.of(instance).lastHealthCheck()).isEqualTo(T0.plusSeconds(42));
    }

    @Test
    @DisplayName("should be stale only when idle past the timeout")
    void shouldDetectStaleness() {
        Duration staleTimeout = Duration.ofMinutes(10);
        assertThat(instance.isStale(staleTimeout, T0.plus(Duration.ofMinutes(5)))).isFalse();
        assertThat(instance.isStale(staleTimeout, T0.plus(Duration.ofMinutes(11)))).isTrue();

        instance.markAcquired(T0);
        assertThat(instance.isStale(staleTimeout, T0.plus(Duration.ofMinutes(11)))).isFalse();
    }

    @Test
    @DisplayName("should keep a running mean of response times and reset failures on success")
    void shouldTrackAverageResponseTime() {
        instance.recordFailure();
        instance.recordFailure();
        assertThat(instance.getConsecutiveFailures()).isEqualTo(2);

        instance.recordSuccess(100);
        instance.recordSuccess(200);
        instance.recordSuccess(300);

        assertThat(instance.getAverageResponseTime()).isEqualTo(200.0);
        assertThat(instance.getConsecutiveFailures()).isZero();
    }

    @Test
    @DisplayName("should let exactly one of many concurrent callers acquire")
    void shouldAllowSingleHolderUnderContention() throws Exception {
        int threads = 16;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger winners = new AtomicInteger();
        AtomicInteger losers = new AtomicInteger();

        for (int i = 0; i < threads; i++) {
            executor.submit(() -> {
                try {
                    start.await();
                    instance.markAcquired(Instant.now());
                    winners.incrementAndGet();
                } catch (IllegalStateException e) {
                    losers.incrementAndGet();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
        }
        start.countDown();
        executor.shutdown();
        assertThat(executor.awaitTermination(5, TimeUnit.SECONDS)).isTrue();

        assertThat(winners.get()).isEqualTo(1);
        assertThat(losers.get()).isEqualTo(threads - 1);
        assertThat(instance.getCurrentLoad()).isEqualTo(1);
    }
}
