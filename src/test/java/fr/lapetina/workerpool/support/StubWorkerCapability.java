package fr.lapetina.workerpool.support;

import fr.lapetina.workerpool.spi.ExecutionRequest;
import fr.lapetina.workerpool.spi.WorkerCapability;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory worker used instead of a real downstream process.
 * Behavior is read from the owning provisioner on every call, so tests can change it mid-run.
 */
public final class StubWorkerCapability implements WorkerCapability {

    private final String instanceId;
    private final StubProvisioner owner;
    private final AtomicInteger executions = new AtomicInteger();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicBoolean concurrentUse = new AtomicBoolean(false);
    private final AtomicBoolean disposed = new AtomicBoolean(false);
    private final int weight;
    private volatile boolean probeFails;

    StubWorkerCapability(String instanceId, StubProvisioner owner, int weight) {
        this.instanceId = instanceId;
        this.owner = owner;
        this.weight = weight;
    }

    @Override
    public String execute(ExecutionRequest request) throws Exception {
        if (inFlight.incrementAndGet() > 1) {
            concurrentUse.set(true);
        }
        try {
            executions.incrementAndGet();
            return owner.behavior().apply(request);
        } finally {
            inFlight.decrementAndGet();
        }
    }

    @Override
    public void probe() throws Exception {
        if (probeFails) {
            throw new IllegalStateException("Worker " + instanceId + " is not responding");
        }
    }

    @Override
    public void dispose() {
        disposed.set(true);
    }

    @Override
    public int weight() {
        return weight;
    }

    public String getInstanceId() {
        return instanceId;
    }

    public int getExecutions() {
        return executions.get();
    }

    public boolean wasUsedConcurrently() {
        return concurrentUse.get();
    }

    public boolean isDisposed() {
        return disposed.get();
    }

    public void setProbeFails(boolean probeFails) {
        this.probeFails = probeFails;
    }
}
