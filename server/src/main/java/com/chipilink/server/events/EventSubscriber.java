package com.chipilink.server.events;

/**
 * A consumer that knows its own pattern. Spring beans implementing this are
 * subscribed to the bus when the application starts.
 */
public interface EventSubscriber extends EventHandler {

    /** Exact event type, {@code "prefix.*"} or {@code "*"}. */
    String pattern();

    default HandlerSeverity severity() {
        return HandlerSeverity.BEST_EFFORT;
    }
}
