package com.chipilink.server.events;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable record of a domain occurrence published through the {@link EventBus}.
 * Payload and metadata are copied on construction and cannot be changed afterwards.
 */
public record Event(
        @JsonProperty("event_type") String eventType,
        @JsonProperty("payload") Map<String, Object> payload,
        @JsonProperty("source_module") String sourceModule,
        @JsonProperty("event_id") String eventId,
        @JsonProperty("timestamp") Instant timestamp,
        @JsonProperty("priority") EventPriority priority,
        @JsonProperty("metadata") Map<String, Object> metadata) {

    public Event {
        Objects.requireNonNull(eventType, "eventType");
        if (eventType.isBlank()) {
            throw new IllegalArgumentException("eventType must not be blank");
        }
        payload = freeze(payload);
        metadata = freeze(metadata);
        sourceModule = sourceModule == null ? "unknown" : sourceModule;
        eventId = eventId == null ? UUID.randomUUID().toString() : eventId;
        timestamp = timestamp == null ? Instant.now() : timestamp;
        priority = priority == null ? EventPriority.NORMAL : priority;
    }

    public static Event of(String eventType, Map<String, ?> payload, String sourceModule) {
        return of(eventType, payload, sourceModule, EventPriority.NORMAL);
    }

    public static Event of(String eventType, Map<String, ?> payload, String sourceModule, EventPriority priority) {
        return new Event(eventType, copy(payload), sourceModule, null, null, priority, null);
    }

    /** Same event with extra metadata entries merged in. */
    public Event withMetadata(Map<String, ?> extra) {
        Map<String, Object> merged = new LinkedHashMap<>(metadata);
        if (extra != null) {
            merged.putAll(extra);
        }
        return new Event(eventType, payload, sourceModule, eventId, timestamp, priority, merged);
    }

    private static Map<String, Object> copy(Map<String, ?> source) {
        return source == null ? null : new LinkedHashMap<>(source);
    }

    private static Map<String, Object> freeze(Map<String, Object> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
