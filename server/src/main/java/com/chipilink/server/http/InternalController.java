package com.chipilink.server.http;

import com.chipilink.server.model.LocalizedText;
import com.chipilink.server.model.RealtimeMessage;
import com.chipilink.server.ws.ConnectionRegistry;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Internal endpoints for trusted back-office callers, protected by a shared bearer token.
 * - POST /internal/broadcast: push a message to a room or a user
 * - POST|DELETE /internal/connections/{id}/rooms/{room}: server-side membership (e.g. granting {@code admin})
 */
@RestController
@RequestMapping("/internal")
public class InternalController {
    private static final Logger log = LoggerFactory.getLogger(InternalController.class);

    private final ConnectionRegistry registry;
    private final String token;

    public InternalController(ConnectionRegistry registry, @Value("${internal.token}") String token) {
        this.registry = registry;
        this.token = token;
    }

    @PostMapping("/broadcast")
    public ResponseEntity<Map<String, Integer>> broadcast(
            @RequestHeader(value = "Authorization", required = false) String auth,
            @Valid @RequestBody BroadcastRequest req) {

        if (!authorized(auth)) {
            return ResponseEntity.status(401).build();
        }

        RealtimeMessage msg = RealtimeMessage.of(req.type, req.payload, req.message);
        int delivered = req.room != null
                ? registry.broadcastToRoom(req.room, msg, req.excludeUserIds == null ? List.of() : req.excludeUserIds)
                : registry.sendToUser(req.userId, msg);
        log.info("[INTERNAL] type={} room={} user={} delivered={}", req.type, req.room, req.userId, delivered);
        return ResponseEntity.ok(Map.of("delivered", delivered));
    }

    @PostMapping("/connections/{connectionId}/rooms/{room}")
    public ResponseEntity<Map<String, Object>> join(
            @RequestHeader(value = "Authorization", required = false) String auth,
            @PathVariable String connectionId, @PathVariable String room) {
        if (!authorized(auth)) {
            return ResponseEntity.status(401).build();
        }
        if (!registry.isRegistered(connectionId)) {
            return ResponseEntity.notFound().build();
        }
        boolean changed = registry.joinRoom(connectionId, room);
        return ResponseEntity.ok(Map.of("changed", changed, "rooms", registry.roomsOf(connectionId)));
    }

    @DeleteMapping("/connections/{connectionId}/rooms/{room}")
    public ResponseEntity<Map<String, Object>> leave(
            @RequestHeader(value = "Authorization", required = false) String auth,
            @PathVariable String connectionId, @PathVariable String room) {
        if (!authorized(auth)) {
            return ResponseEntity.status(401).build();
        }
        if (!registry.isRegistered(connectionId)) {
            return ResponseEntity.notFound().build();
        }
        boolean changed = registry.leaveRoom(connectionId, room);
        return ResponseEntity.ok(Map.of("changed", changed, "rooms", registry.roomsOf(connectionId)));
    }

    private boolean authorized(String auth) {
        return auth != null && auth.equals("Bearer " + token);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class BroadcastRequest {
        @NotBlank @Size(max = 64)
        public String type;

        @Size(max = 40)
        public String room;

        @JsonProperty("user_id")
        @Size(max = 128)
        public String userId;

        @JsonProperty("exclude_user_ids")
        public List<String> excludeUserIds;

        public Map<String, Object> payload;

        public LocalizedText message;

        @AssertTrue(message = "exactly one of room or user_id is required")
        public boolean isSingleTarget() {
            return (room == null) != (userId == null);
        }
    }
}
