package com.chipilink.server.ws;

import com.chipilink.server.model.ClientCommand;
import com.chipilink.server.model.LocalizedText;
import com.chipilink.server.model.RealtimeMessage;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.MultiValueMap;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * WebSocket endpoint at {@code /realtime/ws?user_id=&lang=&rooms=a,b}.
 * - connection established: register in the {@link ConnectionRegistry}, join the requested
 *   client-joinable rooms, send a {@code connected} frame
 * - text frame: parse and validate a {@link ClientCommand} (join / leave / ping)
 * - close or transport error: unregister
 * <p>
 * {@code user_id} is taken from the query string as given and is not verified here. The
 * endpoint must sit behind an auth layer (gateway or handshake interceptor) that checks the
 * caller owns that id; otherwise a client can subscribe to another user's personal frames.
 */
@Component
public class RealtimeWebSocketHandler extends TextWebSocketHandler {
    private static final Logger log = LoggerFactory.getLogger(RealtimeWebSocketHandler.class);

    private final ObjectMapper mapper = new ObjectMapper();
    private final Validator validator = Validation.buildDefaultValidatorFactory().getValidator();

    private final ConnectionRegistry registry;
    private final int sendTimeLimitMs;
    private final int bufferSizeLimit;

    public RealtimeWebSocketHandler(ConnectionRegistry registry,
                                    @Value("${realtime.send-timeout-ms:5000}") int sendTimeLimitMs,
                                    @Value("${realtime.send-buffer-bytes:524288}") int bufferSizeLimit) {
        this.registry = registry;
        this.sendTimeLimitMs = sendTimeLimitMs;
        this.bufferSizeLimit = bufferSizeLimit;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        MultiValueMap<String, String> params = queryParams(session.getUri());
        String userId = params.getFirst("user_id");
        String lang = params.getFirst("lang");

        ClientConnection connection = new WebSocketClientConnection(session, sendTimeLimitMs, bufferSizeLimit);
        if (!registry.register(connection, userId, lang)) {
            connection.close();
            return;
        }

        String requested = params.getFirst("rooms");
        if (requested != null) {
            Arrays.stream(requested.split(","))
                    .map(String::trim)
                    .filter(r -> !r.isEmpty())
                    .forEach(room -> joinFromClient(session.getId(), room));
        }

        registry.sendToConnection(session.getId(), RealtimeMessage.of("connected",
                membership(session.getId(), "connection_id", session.getId()),
                LocalizedText.of("Conectado al canal de notificaciones",
                        "Connected to notification channel",
                        "已连接到通知频道")));
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        // 1) JSON -> ClientCommand
        ClientCommand cmd;
        try {
            cmd = mapper.readValue(message.getPayload(), ClientCommand.class);
        } catch (Exception e) {
            log.warn("[WARN] invalid json connection={}: {}", session.getId(), e.getMessage());
            replyError(session.getId(), "invalid_json");
            return;
        }

        // 2) bean validation
        Set<ConstraintViolation<ClientCommand>> violations = validator.validate(cmd);
        if (!violations.isEmpty()) {
            log.warn("[WARN] validation failed connection={}: {}", session.getId(), violations);
            replyError(session.getId(), "invalid_command");
            return;
        }

        // 3) dispatch
        switch (cmd.action) {
            case "join" -> {
                if (cmd.room == null) {
                    replyError(session.getId(), "room_required");
                } else if (joinFromClient(session.getId(), cmd.room)) {
                    registry.sendToConnection(session.getId(),
                            RealtimeMessage.of("joined", membership(session.getId(), "room", cmd.room)));
                } else {
                    replyError(session.getId(), "room_not_joinable");
                }
            }
            case "leave" -> {
                if (cmd.room == null) {
                    replyError(session.getId(), "room_required");
                    return;
                }
                registry.leaveRoom(session.getId(), cmd.room);
                registry.sendToConnection(session.getId(),
                        RealtimeMessage.of("left", membership(session.getId(), "room", cmd.room)));
            }
            case "ping" -> {
                Map<String, Object> payload = new LinkedHashMap<>();
                payload.put("nonce", cmd.nonce == null ? "" : cmd.nonce);
                registry.sendToConnection(session.getId(), RealtimeMessage.of("pong", payload));
            }
            default -> replyError(session.getId(), "unknown_action");
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("[WARN] transport error connection={}: {}", session.getId(), exception.toString());
        registry.unregister(session.getId());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        registry.unregister(session.getId());
    }

    /** Clients may only enter catalog rooms flagged client-joinable. Re-joining counts as success. */
    private boolean joinFromClient(String connectionId, String room) {
        if (!RoomCatalog.isClientJoinable(room)) {
            log.warn("[WARN] connection={} asked for non-joinable room={}", connectionId, room);
            return false;
        }
        registry.joinRoom(connectionId, room);
        return true;
    }

    private Map<String, Object> membership(String connectionId, String key, String value) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(key, value);
        payload.put("rooms", new TreeSet<>(registry.roomsOf(connectionId)));
        return payload;
    }

    private void replyError(String connectionId, String code) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("error", code);
        registry.sendToConnection(connectionId, RealtimeMessage.of("error", payload));
    }

    private static MultiValueMap<String, String> queryParams(URI uri) {
        if (uri == null) {
            return UriComponentsBuilder.newInstance().build().getQueryParams();
        }
        return UriComponentsBuilder.fromUri(uri).build().getQueryParams();
    }
}
