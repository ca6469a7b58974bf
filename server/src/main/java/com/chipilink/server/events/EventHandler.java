package com.chipilink.server.events;

/**
 * Callback invoked by the {@link EventBus} for every matching event.
 * Runs on a bus dispatch thread, so blocking work is allowed within the handler timeout.
 */
@FunctionalInterface
public interface EventHandler {

    void handle(Event event) throws Exception;

    /** Name used in dispatch logs. */
    default String name() {
        return getClass().getSimpleName();
    }
}
