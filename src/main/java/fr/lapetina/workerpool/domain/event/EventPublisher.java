package fr.lapetina.workerpool.domain.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Fan-out of events to registered listeners, shared by the pool and the dispatcher.
 */
public final class EventPublisher {

    private static final Logger log = LoggerFactory.getLogger(EventPublisher.class);

    private final List<PoolEventListener> listeners = new CopyOnWriteArrayList<>();

    public void addListener(PoolEventListener listener) {
        listeners.add(listener);
    }

    public void removeListener(PoolEventListener listener) {
        listeners.remove(listener);
    }

    public void publish(PoolEvent event) {
        for (PoolEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (Exception e) {
                log.error("Error notifying listener: eventType={}", event.type(), e);
            }
        }
    }
}
