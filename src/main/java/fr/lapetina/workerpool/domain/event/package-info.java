/**
 * Pool and job notifications.
 *
 * <p>Both the {@code PoolManager} and the {@code JobDispatcher} publish through a shared
 * {@link fr.lapetina.workerpool.domain.event.EventPublisher}. Delivery is synchronous and,
 * for a given job, in emission order: {@code JOB_QUEUED}, {@code JOB_DISPATCHED},
 * then {@code JOB_RETRY_SCHEDULED} / {@code JOB_COMPLETED} / {@code JOB_FAILED}.
 */
package fr.lapetina.workerpool.domain.event;
