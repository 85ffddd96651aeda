package fr.lapetina.workerpool.dispatcher;

import fr.lapetina.workerpool.domain.model.Job;

/**
 * Tail of the job queue, as seen by the retry path.
 */
@FunctionalInterface
interface RetryQueue {

    /**
     * @return false if the queue has no free slot right now
     */
    boolean offer(Job job);
}
