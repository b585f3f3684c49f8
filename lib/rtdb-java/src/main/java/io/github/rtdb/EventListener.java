package io.github.rtdb;

/**
 * Receives change events from a streaming session.
 * Each registration is called from its own delivery thread, one event at a time.
 */
@FunctionalInterface
public interface EventListener {

    /**
     * Called for every matching event, in the order the server sent them.
     *
     * @param event the event
     */
    void onEvent(ChangeEvent event);
}
