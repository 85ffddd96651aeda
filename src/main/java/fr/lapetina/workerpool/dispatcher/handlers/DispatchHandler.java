package fr.lapetina.workerpool.dispatcher.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.workerpool.dispatcher.JobEvent;
import fr.lapetina.workerpool.dispatcher.JobExecutor;
import fr.lapetina.workerpool.dispatcher.JobOutcomeRecorder;
import fr.lapetina.workerpool.domain.model.ErrorType;
import fr.lapetina.workerpool.domain.model.Job;
import fr.lapetina.workerpool.domain.model.JobState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Second stage handler: hands jobs to the processing pool in queue order.
 *
 * Blocks on a semaphore sized to the concurrency limit, so at most that many jobs
 * run at once and the ring buffer absorbs the rest. Jobs that failed validation or
 * were cancelled while queued are completed or skipped here.
 */
public final class DispatchHandler implements EventHandler<JobEvent> {

    private static final Logger log = LoggerFactory.getLogger(DispatchHandler.class);

    private static final long SLOT_POLL_MS = 100;

    private final JobExecutor executor;
    private final JobOutcomeRecorder outcomes;
    private final ExecutorService processingPool;
    private final Semaphore slots;
    private final AtomicInteger queued;
    private final AtomicBoolean running;

    public DispatchHandler(
            JobExecutor executor,
            JobOutcomeRecorder outcomes,
            ExecutorService processingPool,
            Semaphore slots,
            AtomicInteger queued,
            AtomicBoolean running
    ) {
        this.executor = executor;
        this.outcomes = outcomes;
        this.processingPool = processingPool;
        this.slots = slots;
        this.queued = queued;
        this.running = running;
    }

    @Override
    public void onEvent(JobEvent event, long sequence, boolean endOfBatch) {
        Job job = event.getJob();
        try {
            if (job == null) {
                return;
            }
            if (event.hasError()) {
                queued.decrementAndGet();
                outcomes.failed(job, event.getErrorType(), event.getErrorMessage(), null);
                return;
            }
            if (job.getState() != JobState.QUEUED) {
                queued.decrementAndGet();
                log.debug("Skipping job no longer queued: jobId={}, state={}", job.getId(), job.getState());
                return;
            }

            boolean acquired = acquireSlot();
            queued.decrementAndGet();
            if (!acquired) {
                outcomes.failed(job, ErrorType.SHUTTING_DOWN, "Dispatcher is shutting down", null);
                return;
            }
            if (!job.transition(JobState.QUEUED, JobState.DISPATCHED)) {
                slots.release();
                log.debug("Job cancelled while waiting for a slot: jobId={}", job.getId());
                return;
            }
            dispatch(job, sequence);
        } finally {
            event.clear();
        }
    }

    private void dispatch(Job job, long sequence) {
        log.debug("Dispatching job: jobId={}, sequence={}, freeSlots={}",
                job.getId(), sequence, slots.availablePermits());
        try {
            processingPool.execute(() -> {
                try {
                    executor.execute(job);
                } finally {
                    slots.release();
                }
            });
        } catch (RejectedExecutionException e) {
            slots.release();
            outcomes.failed(job, ErrorType.SHUTTING_DOWN, "Processing pool is shut down", null);
        }
    }

    private boolean acquireSlot() {
        try {
            while (running.get()) {
                if (slots.tryAcquire(SLOT_POLL_MS, TimeUnit.MILLISECONDS)) {
                    return true;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return false;
    }
}
