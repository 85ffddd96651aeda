/**
 * Domain model of the worker pool.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.workerpool.domain.model.WorkerInstance} - Thread-safe wrapper around one worker capability</li>
 *   <li>{@link fr.lapetina.workerpool.domain.model.Job} - Unit of work and its state machine</li>
 *   <li>{@link fr.lapetina.workerpool.domain.model.JobResult} - Immutable terminal outcome</li>
 *   <li>{@link fr.lapetina.workerpool.domain.model.PoolStats} - Derived pool view</li>
 *   <li>{@link fr.lapetina.workerpool.domain.model.ErrorType} - Error taxonomy with retryability</li>
 * </ul>
 *
 * <h2>Job States</h2>
 * <pre>
 * QUEUED → DISPATCHED → COMPLETED
 *                     → RETRY_PENDING → QUEUED
 *                     → FAILED
 * </pre>
 * <p>A queued or retry-pending job may also move straight to {@code FAILED} on cancel or shutdown.
 */
package fr.lapetina.workerpool.domain.model;
