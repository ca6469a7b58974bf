package com.chipilink.server.events;

/**
 * How loudly a handler failure is reported. Neither level blocks the bus.
 */
public enum HandlerSeverity {
    /** Failure is logged at WARN and counted. */
    BEST_EFFORT,
    /** Failure is logged at ERROR and named in the {@link DispatchReport}. */
    CRITICAL
}
