package com.chipilink.server.push;

import com.chipilink.server.model.LocalizedText;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Device push addressed to one user.
 */
public record PushNotification(
        @JsonProperty("user_id") String userId,
        @JsonProperty("category") String category,
        @JsonProperty("title") LocalizedText title,
        @JsonProperty("body") LocalizedText body,
        @JsonProperty("data") Map<String, Object> data) {

    public PushNotification {
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }
}
