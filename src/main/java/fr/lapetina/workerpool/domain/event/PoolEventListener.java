package fr.lapetina.workerpool.domain.event;

/**
 * Observer for pool and job events.
 *
 * Called synchronously on the emitting thread, never while the pool lock is held.
 * Exceptions thrown by a listener are logged and do not reach the emitter.
 */
@FunctionalInterface
public interface PoolEventListener {

    void onEvent(PoolEvent event);
}
