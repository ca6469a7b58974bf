package com.chipilink.server.events;

/**
 * Informational priority carried by an {@link Event}. Never affects dispatch order.
 */
public enum EventPriority {
    LOW,
    NORMAL,
    HIGH,
    CRITICAL
}
