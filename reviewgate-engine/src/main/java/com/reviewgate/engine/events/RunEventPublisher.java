package com.reviewgate.engine.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Fans run events out to registered listeners. A failing listener is logged
 * and skipped; it never affects the run.
 */
public class RunEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(RunEventPublisher.class);

    private final List<RunEventListener> listeners = new CopyOnWriteArrayList<>();

    public RunEventPublisher() {
    }

    public RunEventPublisher(List<? extends RunEventListener> listeners) {
        this.listeners.addAll(listeners);
    }

    public void register(RunEventListener listener) {
        listeners.add(listener);
    }

    public void publish(RunEvent event) {
        for (RunEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                log.warn("Event listener {} failed on {} for run {}",
                    listener.getClass().getSimpleName(), event.type(), event.runId(), e);
            }
        }
    }
}
