/**
 * Worker Pool Orchestrator - a pool of stateful workers behind a single logical service.
 *
 * <p>Jobs are queued on an LMAX Disruptor ring buffer, dispatched with bounded
 * concurrency to the instance picked by a load balancing strategy, retried with
 * exponential backoff, and completed through a per-job {@code CompletableFuture}.
 * A health monitor recycles dead and stale workers and keeps the pool at its minimum.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.workerpool.WorkerPoolOrchestrator} - Entry point wiring every component
 *       from YAML configuration</li>
 *   <li>{@link fr.lapetina.workerpool.spi.WorkerProvisioner} and
 *       {@link fr.lapetina.workerpool.spi.WorkerCapability} - What the host application supplies</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (WorkerPoolOrchestrator orchestrator = WorkerPoolOrchestrator.fromConfig("worker-pool.yaml", provisioner)) {
 *     orchestrator.initialize();
 *
 *     SubmitReceipt receipt = orchestrator.submit("Hello!", "caller-1");
 *     JobResult result = orchestrator.awaitResult(receipt.jobId()).get();
 *     System.out.println(result.output());
 * }
 * }</pre>
 *
 * <h2>Features</h2>
 * <ul>
 *   <li>Min/max bounded pool with recycling on message count, age, health and idleness</li>
 *   <li>Load balancing strategies (round-robin, least-connections, weighted-random, response-time)</li>
 *   <li>Per-caller sliding window rate limiting</li>
 *   <li>Micrometer metrics with Prometheus export</li>
 *   <li>Backpressure handling via ring buffer</li>
 * </ul>
 *
 * @see fr.lapetina.workerpool.WorkerPoolOrchestrator
 * @see fr.lapetina.workerpool.dispatcher.JobDispatcher
 */
package fr.lapetina.workerpool;
