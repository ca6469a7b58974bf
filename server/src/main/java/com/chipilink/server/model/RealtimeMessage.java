package com.chipilink.server.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Message pushed to browser clients: {@code {type, payload, message?}}.
 * The registry adds {@code timestamp} and the per-connection {@code text} when it renders the frame.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RealtimeMessage(String type, Map<String, Object> payload, LocalizedText message) {

    public RealtimeMessage {
        Objects.requireNonNull(type, "type");
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    public static RealtimeMessage of(String type, Map<String, ?> payload) {
        return of(type, payload, null);
    }

    public static RealtimeMessage of(String type, Map<String, ?> payload, LocalizedText message) {
        return new RealtimeMessage(type, payload == null ? null : new LinkedHashMap<>(payload), message);
    }
}
