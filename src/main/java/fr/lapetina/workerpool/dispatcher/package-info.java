/**
 * Job queue and processing loop built on the LMAX Disruptor.
 *
 * <h2>Pipeline Stages</h2>
 * <p>Jobs flow through handlers in sequence:
 * <pre>
 * Validation → Dispatch (bounded concurrency) → JobExecutor (acquire, execute, release)
 * </pre>
 *
 * <p>A retryable failure moves the job to {@code RETRY_PENDING}; after the backoff it is
 * published again at the tail of the ring buffer and goes through both stages anew.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.workerpool.dispatcher.JobDispatcher} - Queue owner: submit, cancel, await</li>
 *   <li>{@link fr.lapetina.workerpool.dispatcher.JobExecutor} - One dispatch attempt of a job</li>
 *   <li>{@link fr.lapetina.workerpool.dispatcher.SlidingWindowRateLimiter} - Default per-caller limiter</li>
 *   <li>{@link fr.lapetina.workerpool.dispatcher.ExponentialBackoffPolicy} - Default retry delay</li>
 *   <li>{@link fr.lapetina.workerpool.dispatcher.exception.BackpressureException} - Thrown when the ring buffer is full</li>
 * </ul>
 *
 * @see com.lmax.disruptor.dsl.Disruptor
 */
package fr.lapetina.workerpool.dispatcher;
