package com.chipilink.server.emit;

import com.chipilink.server.events.Event;
import com.chipilink.server.events.EventPatterns;
import com.chipilink.server.events.EventSubscriber;
import com.chipilink.server.model.RealtimeMessage;
import com.chipilink.server.ws.ConnectionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mirrors selected bus events into the {@code admin} room as an activity feed.
 * Which events are relayed is configured with {@code realtime.activity-relay.event-types}
 * (comma separated, same pattern syntax as subscriptions; empty disables the relay).
 */
@Component
public class AdminActivityRelay implements EventSubscriber {
    private static final Logger log = LoggerFactory.getLogger(AdminActivityRelay.class);

    private final ConnectionRegistry registry;
    private final List<String> relayed;

    public AdminActivityRelay(ConnectionRegistry registry,
                              @Value("${realtime.activity-relay.event-types:}") String relayed) {
        this.registry = registry;
        this.relayed = Arrays.stream(relayed.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
        log.info("[RELAY] admin activity relay patterns={}", this.relayed);
    }

    @Override
    public String pattern() {
        return EventPatterns.ANY;
    }

    @Override
    public void handle(Event event) {
        if (relayed.stream().noneMatch(p -> EventPatterns.matches(event.eventType(), p))) {
            return;
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("event_type", event.eventType());
        payload.put("event_id", event.eventId());
        payload.put("source_module", event.sourceModule());
        payload.put("priority", event.priority().name());
        payload.put("timestamp", event.timestamp().toString());
        payload.put("data", event.payload());
        registry.broadcastToRoom(RealtimeEmitter.ADMIN, RealtimeMessage.of("activity", payload));
    }
}
