package fr.lapetina.workerpool.dispatcher;

import com.lmax.disruptor.EventFactory;

/**
 * Pre-allocates the ring buffer slots.
 */
public final class JobEventFactory implements EventFactory<JobEvent> {

    @Override
    public JobEvent newInstance() {
        return new JobEvent();
    }
}
