package com.reviewgate.engine.events;

/**
 * Receives run events. Implementations must not block for long; they run on
 * the engine thread that produced the event.
 */
@FunctionalInterface
public interface RunEventListener {

    void onEvent(RunEvent event);
}
