package io.relaywatch.queue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Synchronous fan-out of {@link JobEvent}s. Listeners run on the emitting thread
 * and must not block; a failing listener is logged and does not affect the others.
 */
public final class JobEvents {
    private static final Logger log = LoggerFactory.getLogger(JobEvents.class);

    @FunctionalInterface
    public interface Listener {
        void onEvent(JobEvent event);
    }

    private final List<Listener> listeners = new CopyOnWriteArrayList<>();

    /**
     * @return a handle that removes the listener
     */
    public Runnable subscribe(Listener listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    public void emit(JobEvent event) {
        for (Listener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                log.warn("Job event listener failed on {} {}", event.type(), event.jobId(), e);
            }
        }
    }
}
