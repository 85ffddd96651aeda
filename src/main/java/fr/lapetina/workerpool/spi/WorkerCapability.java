package fr.lapetina.workerpool.spi;

/**
 * The only view the orchestrator has of a downstream worker (CLI process, SDK client,
 * browser session...).
 *
 * One capability backs exactly one worker instance. The pool guarantees that
 * {@link #execute} is never called concurrently on the same capability, but
 * {@link #probe} may run while an execution is in flight.
 */
public interface WorkerCapability {

    /**
     * Runs one job on the worker.
     *
     * <p>The call is interrupted when the request deadline elapses; implementations
     * should stop promptly on interrupt. Throw
     * {@link fr.lapetina.workerpool.domain.exception.WorkerExecutionException#terminal}
     * to signal that the job must not be retried.
     *
     * @return the worker output
     * @throws Exception on downstream failure
     */
    String execute(ExecutionRequest request) throws Exception;

    /**
     * Cheap liveness check used by the health monitor.
     *
     * @throws Exception if the worker is not alive
     */
    void probe() throws Exception;

    /**
     * Releases the underlying worker. Called once when the instance is recycled.
     */
    void dispose() throws Exception;

    /**
     * Relative capacity of this worker for the weighted-random strategy. Read once
     * when the instance joins the pool.
     *
     * @return a weight of at least 1
     */
    default int weight() {
        return 1;
    }
}
