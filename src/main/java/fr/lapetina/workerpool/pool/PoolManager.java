package fr.lapetina.workerpool.pool;

import fr.lapetina.workerpool.domain.event.EventPublisher;
import fr.lapetina.workerpool.domain.event.PoolEvent;
import fr.lapetina.workerpool.domain.event.PoolEventType;
import fr.lapetina.workerpool.domain.exception.CapacityException;
import fr.lapetina.workerpool.domain.exception.NoInstanceAvailableException;
import fr.lapetina.workerpool.domain.exception.NotFoundException;
import fr.lapetina.workerpool.domain.exception.ProvisioningException;
import fr.lapetina.workerpool.domain.exception.ShuttingDownException;
import fr.lapetina.workerpool.domain.exception.WorkerPoolException;
import fr.lapetina.workerpool.domain.model.ErrorType;
import fr.lapetina.workerpool.domain.model.InstanceHealth;
import fr.lapetina.workerpool.domain.model.WorkerInstance;
import fr.lapetina.workerpool.domain.strategy.InstanceSelector;
import fr.lapetina.workerpool.spi.WorkerCapability;
import fr.lapetina.workerpool.spi.WorkerProvisioner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Sole owner of the worker instance set.
 *
 * One lock guards the instances, the FIFO waiter queue and the selection, so an
 * instance can never be handed to two holders. Provisioning, disposal and event
 * delivery always happen outside the lock.
 */
public final class PoolManager {

    private static final Logger log = LoggerFactory.getLogger(PoolManager.class);

    /** Picks the first eligible candidate. */
    public static final InstanceSelector FIRST_ELIGIBLE =
            candidates -> candidates.stream().filter(WorkerInstance::isEligible).findFirst();

    private final PoolConfig config;
    private final WorkerProvisioner provisioner;
    private final InstanceSelector defaultSelector;
    private final EventPublisher events;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, WorkerInstance> instances = new LinkedHashMap<>();
    private final Deque<Waiter> waiters = new ArrayDeque<>();
    private int reserved;
    private boolean shuttingDown;

    private final AtomicLong idSequence = new AtomicLong(0);
    private final AtomicLong recycledCount = new AtomicLong(0);

    public PoolManager(
            PoolConfig config,
            WorkerProvisioner provisioner,
            InstanceSelector defaultSelector,
            EventPublisher events,
            Clock clock
    ) {
        this.config = Objects.requireNonNull(config, "Pool config is required");
        this.provisioner = Objects.requireNonNull(provisioner, "Provisioner is required");
        this.defaultSelector = Objects.requireNonNull(defaultSelector, "Selector is required");
        this.events = Objects.requireNonNull(events, "Event publisher is required");
        this.clock = Objects.requireNonNull(clock, "Clock is required");
    }

    public PoolManager(PoolConfig config, WorkerProvisioner provisioner, InstanceSelector defaultSelector,
                       EventPublisher events) {
        this(config, provisioner, defaultSelector, events, Clock.systemUTC());
    }

    public PoolManager(PoolConfig config, WorkerProvisioner provisioner) {
        this(config, provisioner, FIRST_ELIGIBLE, new EventPublisher());
    }

    /**
     * Creates {@code minInstances} instances. Failed slots are logged and skipped.
     *
     * @return number of instances created
     */
    public int initialize() {
        int created = 0;
        for (int i = 0; i < config.getMinInstances(); i++) {
            try {
                createInstance();
                created++;
            } catch (WorkerPoolException e) {
                log.warn("Initial instance creation failed: slot={}, errorType={}, error={}",
                        i + 1, e.getErrorType(), e.getMessage());
            }
        }
        if (created < config.getMinInstances()) {
            log.warn("Pool initialized below minimum: created={}, minInstances={}, shortfall={}",
                    created, config.getMinInstances(), config.getMinInstances() - created);
        } else {
            log.info("Pool initialized: instances={}, config={}", created, config);
        }
        return created;
    }

    /**
     * Provisions a new instance and offers it to the longest waiting caller.
     *
     * @throws CapacityException     if the pool, counting creations in progress, is full
     * @throws ProvisioningException if the provisioner fails
     */
    public WorkerInstance createInstance() {
        reserveSlot();
        return provision(false);
    }

    /**
     * Acquires an instance with the default selector.
     */
    public WorkerInstance acquire(Duration timeout) {
        return acquire(timeout, defaultSelector);
    }

    /**
     * Acquires an idle, healthy instance and marks it busy.
     *
     * <p>Selection runs under the pool lock. If nothing is eligible, a new instance is
     * created for this caller when the pool is below its maximum; otherwise the caller
     * parks in FIFO order until an instance frees up or the timeout elapses.
     *
     * @throws NoInstanceAvailableException if the timeout elapses first
     * @throws ShuttingDownException        if the pool is shutting down
     */
    public WorkerInstance acquire(Duration timeout, InstanceSelector selector) {
        Objects.requireNonNull(timeout, "Timeout is required");
        InstanceSelector effective = selector != null ? selector : defaultSelector;
        long deadlineNanos = System.nanoTime() + timeout.toNanos();

        Waiter waiter = null;
        WorkerInstance chosen = null;
        boolean create = false;
        boolean starved = false;
        List<WorkerInstance> due = new ArrayList<>();
        lock.lock();
        try {
            if (shuttingDown) {
                throw new ShuttingDownException("Pool is shutting down");
            }
            if (waiters.isEmpty()) {
                chosen = selectLocked(effective, due);
            }
            if (chosen != null) {
                chosen.markAcquired(clock.instant());
            } else if (waiters.isEmpty() && instances.size() + reserved < config.getMaxInstances()) {
                reserved++;
                create = true;
            } else {
                waiter = new Waiter(effective);
                waiters.addLast(waiter);
                starved = instances.size() + reserved < config.getMaxInstances();
                log.debug("No instance available, caller parked: waiting={}", waiters.size());
            }
        } finally {
            lock.unlock();
        }

        recycleAll(due);
        if (chosen != null) {
            log.debug("Instance acquired: instanceId={}", chosen.getId());
            return chosen;
        }
        if (create) {
            return provision(true);
        }
        if (starved) {
            ensureMinimum();
        }
        return await(waiter, deadlineNanos, timeout);
    }

    private WorkerInstance await(Waiter waiter, long deadlineNanos, Duration timeout) {
        try {
            long remaining = deadlineNanos - System.nanoTime();
            return waiter.future.get(Math.max(0, remaining), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            WorkerInstance served = abandon(waiter);
            if (served != null) {
                return served;
            }
            log.debug("Acquire timed out: timeoutMs={}", timeout.toMillis());
            throw new NoInstanceAvailableException(timeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            WorkerInstance served = abandon(waiter);
            if (served != null) {
                returnUnused(served);
            }
            throw new WorkerPoolException(ErrorType.INTERNAL_ERROR, "Interrupted while waiting for an instance", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof WorkerPoolException poolError) {
                throw poolError;
            }
            throw new WorkerPoolException(ErrorType.INTERNAL_ERROR, "Acquire failed", e.getCause());
        }
    }

    /**
     * Removes a waiter that gave up. Returns the instance if it was served in the meantime.
     */
    private WorkerInstance abandon(Waiter waiter) {
        lock.lock();
        try {
            if (waiters.remove(waiter)) {
                return null;
            }
        } finally {
            lock.unlock();
        }
        // Served or failed concurrently: the future is already completed
        try {
            return waiter.future.getNow(null);
        } catch (RuntimeException e) {
            return null;
        }
    }

    /**
     * Returns a finished instance to the pool.
     *
     * <p>Counts the job, then recycles the instance if it exceeded its message budget,
     * its maximum age or lost its health; otherwise hands it to the oldest waiter.
     * Unknown ids are ignored: the instance may have been force-recycled.
     */
    public void release(String instanceId) {
        WorkerInstance toRecycle = null;
        lock.lock();
        try {
            WorkerInstance instance = instances.get(instanceId);
            if (instance == null) {
                log.warn("Release of unknown instance ignored: instanceId={}", instanceId);
                return;
            }
            Instant now = clock.instant();
            instance.markReleased(now);
            if (instance.shouldRecycle(config.getMaxMessagesPerInstance(), config.getMaxInstanceAge(), now)) {
                toRecycle = instance;
            } else {
                serveWaitersLocked();
            }
        } finally {
            lock.unlock();
        }
        if (toRecycle != null) {
            log.info("Instance due for recycle on release: instanceId={}, messages={}, health={}",
                    toRecycle.getId(), toRecycle.getMessageCount(), toRecycle.getHealth());
            recycleInternal(toRecycle);
        }
    }

    /**
     * Hands back an instance that was acquired but never used.
     */
    private void returnUnused(WorkerInstance instance) {
        lock.lock();
        try {
            if (instances.get(instance.getId()) == instance) {
                instance.markReturned();
                serveWaitersLocked();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes and disposes an instance, busy or not.
     *
     * @throws NotFoundException if no instance has this id
     */
    public void recycle(String instanceId) {
        WorkerInstance instance;
        lock.lock();
        try {
            instance = instances.get(instanceId);
        } finally {
            lock.unlock();
        }
        if (instance == null) {
            throw new NotFoundException("Instance", instanceId);
        }
        recycleInternal(instance);
    }

    /**
     * Marks an instance unhealthy; an idle one is recycled at once, a busy one on release.
     *
     * @return false if the id is unknown
     */
    public boolean markUnhealthy(String instanceId) {
        WorkerInstance idle = null;
        lock.lock();
        try {
            WorkerInstance instance = instances.get(instanceId);
            if (instance == null) {
                return false;
            }
            instance.setHealth(InstanceHealth.UNHEALTHY, clock.instant());
            if (!instance.isBusy()) {
                idle = instance;
            }
        } finally {
            lock.unlock();
        }
        if (idle != null) {
            recycleInternal(idle);
        }
        return true;
    }

    /**
     * Counts a failed execution. Reaching the failure threshold marks the instance
     * UNHEALTHY so that the following release recycles it.
     */
    public void recordExecutionFailure(String instanceId) {
        lock.lock();
        try {
            WorkerInstance instance = instances.get(instanceId);
            if (instance == null) {
                return;
            }
            int failures = instance.recordFailure();
            if (failures >= config.getFailureThreshold() && instance.isHealthy()) {
                instance.setHealth(InstanceHealth.UNHEALTHY, clock.instant());
                log.warn("Instance marked unhealthy: instanceId={}, consecutiveFailures={}",
                        instanceId, failures);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Recycles the instance if it is idle and unused for longer than the stale timeout.
     *
     * @return true if the instance was recycled
     */
    public boolean recycleIfStale(String instanceId) {
        WorkerInstance stale = null;
        lock.lock();
        try {
            WorkerInstance instance = instances.get(instanceId);
            if (instance != null && instance.isStale(config.getStaleTimeout(), clock.instant())) {
                stale = instance;
            }
        } finally {
            lock.unlock();
        }
        if (stale == null) {
            return false;
        }
        log.info("Recycling stale instance: instanceId={}, lastUsedAt={}", instanceId, stale.getLastUsedAt());
        return recycleInternal(stale);
    }

    /**
     * Marks the instance UNHEALTHY after a failed probe and recycles it if still idle.
     *
     * @return true if the instance was recycled
     */
    public boolean handleProbeFailure(String instanceId) {
        WorkerInstance idle = null;
        lock.lock();
        try {
            WorkerInstance instance = instances.get(instanceId);
            if (instance == null) {
                return false;
            }
            instance.setHealth(InstanceHealth.UNHEALTHY, clock.instant());
            if (!instance.isBusy()) {
                idle = instance;
            }
        } finally {
            lock.unlock();
        }
        return idle != null && recycleInternal(idle);
    }

    /**
     * Creates instances until the pool is back to {@code minInstances}, or while callers
     * are parked and the pool is below {@code maxInstances}.
     *
     * @return number of instances created
     */
    public int ensureMinimum() {
        int created = 0;
        while (true) {
            lock.lock();
            try {
                if (shuttingDown) {
                    return created;
                }
                int size = instances.size() + reserved;
                boolean belowMin = size < config.getMinInstances();
                boolean waitersStarved = !waiters.isEmpty() && size < config.getMaxInstances();
                if (!belowMin && !waitersStarved) {
                    return created;
                }
                reserved++;
            } finally {
                lock.unlock();
            }
            try {
                provision(false);
                created++;
            } catch (WorkerPoolException e) {
                log.warn("Replenishment failed: errorType={}, error={}", e.getErrorType(), e.getMessage());
                return created;
            }
        }
    }

    /**
     * Rejects further creation, fails every parked caller and recycles every instance,
     * busy ones included.
     */
    public void shutdown() {
        List<Waiter> parked;
        List<WorkerInstance> all;
        lock.lock();
        try {
            if (shuttingDown) {
                return;
            }
            shuttingDown = true;
            parked = new ArrayList<>(waiters);
            waiters.clear();
            all = new ArrayList<>(instances.values());
        } finally {
            lock.unlock();
        }
        log.info("Pool shutting down: instances={}, waiters={}", all.size(), parked.size());
        for (Waiter waiter : parked) {
            waiter.future.completeExceptionally(new ShuttingDownException("Pool is shutting down"));
        }
        for (WorkerInstance instance : all) {
            recycleInternal(instance);
        }
        events.publish(PoolEvent.instance(PoolEventType.POOL_SHUTDOWN, null, size()));
        log.info("Pool shut down: recycled={}", recycledCount.get());
    }

    /**
     * Snapshot of the current instances, in creation order.
     */
    public List<WorkerInstance> instances() {
        lock.lock();
        try {
            return new ArrayList<>(instances.values());
        } finally {
            lock.unlock();
        }
    }

    public Optional<WorkerInstance> getInstance(String instanceId) {
        lock.lock();
        try {
            return Optional.ofNullable(instances.get(instanceId));
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return instances.size();
        } finally {
            lock.unlock();
        }
    }

    public int waitingCount() {
        lock.lock();
        try {
            return waiters.size();
        } finally {
            lock.unlock();
        }
    }

    public boolean isShuttingDown() {
        lock.lock();
        try {
            return shuttingDown;
        } finally {
            lock.unlock();
        }
    }

    public long getRecycledCount() {
        return recycledCount.get();
    }

    public PoolConfig getConfig() {
        return config;
    }

    // ---- internals ----

    private void reserveSlot() {
        lock.lock();
        try {
            if (shuttingDown) {
                throw new ShuttingDownException("Pool is shutting down");
            }
            if (instances.size() + reserved >= config.getMaxInstances()) {
                throw new CapacityException(instances.size() + reserved, config.getMaxInstances());
            }
            reserved++;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Provisions into a slot already reserved by the caller.
     *
     * @param claim true to hand the new instance to the caller already marked busy,
     *              false to offer it to parked callers
     */
    private WorkerInstance provision(boolean claim) {
        String id = config.getInstanceIdPrefix() + "-" + idSequence.incrementAndGet();
        WorkerCapability capability;
        try {
            capability = provisioner.provision(id);
            if (capability == null) {
                throw new IllegalStateException("Provisioner returned no capability");
            }
        } catch (Exception e) {
            lock.lock();
            try {
                reserved--;
            } finally {
                lock.unlock();
            }
            log.error("Instance provisioning failed: instanceId={}, error={}", id, e.getMessage());
            throw new ProvisioningException(id, e);
        }

        WorkerInstance instance;
        try {
            instance = WorkerInstance.builder()
                    .id(id)
                    .capability(capability)
                    .weight(capability.weight())
                    .createdAt(clock.instant())
                    .build();
        } catch (IllegalArgumentException e) {
            lock.lock();
            try {
                reserved--;
            } finally {
                lock.unlock();
            }
            dispose(capability, id);
            log.error("Instance rejected: instanceId={}, error={}", id, e.getMessage());
            throw new ProvisioningException(id, e);
        }

        boolean rejected;
        int poolSize;
        lock.lock();
        try {
            reserved--;
            rejected = shuttingDown;
            if (!rejected) {
                instances.put(id, instance);
                if (claim) {
                    instance.markAcquired(clock.instant());
                } else {
                    serveWaitersLocked();
                }
            }
            poolSize = instances.size();
        } finally {
            lock.unlock();
        }

        if (rejected) {
            dispose(instance);
            throw new ShuttingDownException("Pool is shutting down");
        }
        log.info("Instance created: instanceId={}, poolSize={}", id, poolSize);
        events.publish(PoolEvent.instance(PoolEventType.INSTANCE_CREATED, id, poolSize));
        return instance;
    }

    /**
     * Runs the selector over instances that are not due for recycle.
     * Idle instances found due are collected for recycling after the lock is released.
     */
    private WorkerInstance selectLocked(InstanceSelector selector, List<WorkerInstance> due) {
        Instant now = clock.instant();
        List<WorkerInstance> candidates = new ArrayList<>(instances.size());
        for (WorkerInstance instance : instances.values()) {
            if (instance.shouldRecycle(config.getMaxMessagesPerInstance(), config.getMaxInstanceAge(), now)) {
                if (!instance.isBusy() && due != null) {
                    due.add(instance);
                }
            } else {
                candidates.add(instance);
            }
        }
        if (candidates.isEmpty()) {
            return null;
        }
        Optional<WorkerInstance> picked = selector.select(candidates);
        if (picked.isPresent() && picked.get().isEligible() && candidates.contains(picked.get())) {
            return picked.get();
        }
        return null;
    }

    private void serveWaitersLocked() {
        while (!waiters.isEmpty()) {
            Waiter head = waiters.peekFirst();
            WorkerInstance chosen = selectLocked(head.selector, null);
            if (chosen == null) {
                return;
            }
            waiters.pollFirst();
            chosen.markAcquired(clock.instant());
            head.future.complete(chosen);
            log.debug("Waiter served: instanceId={}, stillWaiting={}", chosen.getId(), waiters.size());
        }
    }

    private void recycleAll(List<WorkerInstance> due) {
        for (WorkerInstance instance : due) {
            log.info("Recycling instance over budget: instanceId={}, messages={}, createdAt={}",
                    instance.getId(), instance.getMessageCount(), instance.getCreatedAt());
            recycleInternal(instance);
        }
    }

    private boolean recycleInternal(WorkerInstance instance) {
        int poolSize;
        boolean replenish;
        lock.lock();
        try {
            if (!instances.remove(instance.getId(), instance)) {
                return false;
            }
            recycledCount.incrementAndGet();
            poolSize = instances.size();
            int size = poolSize + reserved;
            replenish = !shuttingDown && (size < config.getMinInstances()
                    || (!waiters.isEmpty() && size < config.getMaxInstances()));
        } finally {
            lock.unlock();
        }

        dispose(instance);
        log.info("Instance recycled: instanceId={}, messages={}, poolSize={}",
                instance.getId(), instance.getMessageCount(), poolSize);
        events.publish(PoolEvent.instance(PoolEventType.INSTANCE_RECYCLED, instance.getId(), poolSize));

        if (replenish) {
            ensureMinimum();
        }
        return true;
    }

    private void dispose(WorkerInstance instance) {
        dispose(instance.getCapability(), instance.getId());
    }

    private void dispose(WorkerCapability capability, String instanceId) {
        try {
            capability.dispose();
        } catch (Exception e) {
            log.warn("Instance dispose failed: instanceId={}, error={}", instanceId, e.getMessage());
        }
    }

    private static final class Waiter {
        private final CompletableFuture<WorkerInstance> future = new CompletableFuture<>();
        private final InstanceSelector selector;

        private Waiter(InstanceSelector selector) {
            this.selector = selector;
        }
    }
}
