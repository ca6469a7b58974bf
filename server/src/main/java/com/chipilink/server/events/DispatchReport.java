package com.chipilink.server.events;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Outcome of one {@link EventBus#publish(Event)} call.
 *
 * @param eventId                 id of the published event
 * @param accepted                false when the bus was not running and the event was dropped
 * @param matched                 number of subscriptions the event matched
 * @param succeeded               handlers that returned normally
 * @param failed                  handlers that threw, or could not be scheduled
 * @param timedOut                handlers cancelled after the handler timeout
 * @param criticalFailures        names of {@link HandlerSeverity#CRITICAL} handlers that failed or timed out
 */
public record DispatchReport(
        @JsonProperty("event_id") String eventId,
        @JsonProperty("accepted") boolean accepted,
        @JsonProperty("matched") int matched,
        @JsonProperty("succeeded") int succeeded,
        @JsonProperty("failed") int failed,
        @JsonProperty("timed_out") int timedOut,
        @JsonProperty("critical_failures") List<String> criticalFailures) {

    public DispatchReport {
        criticalFailures = criticalFailures == null ? List.of() : List.copyOf(criticalFailures);
    }

    public static DispatchReport dropped(String eventId) {
        return new DispatchReport(eventId, false, 0, 0, 0, 0, List.of());
    }

    public boolean hasCriticalFailures() {
        return !criticalFailures.isEmpty();
    }
}
