package com.chipilink.server.ws;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;

/**
 * {@link ClientConnection} over a Spring {@link WebSocketSession}.
 * The session is wrapped in a {@link ConcurrentWebSocketSessionDecorator} so concurrent
 * senders are serialized and a stalled client is cut off once its send time or buffer
 * limit is exceeded.
 */
public class WebSocketClientConnection implements ClientConnection {
    private static final Logger log = LoggerFactory.getLogger(WebSocketClientConnection.class);

    private final WebSocketSession session;

    public WebSocketClientConnection(WebSocketSession session, int sendTimeLimitMs, int bufferSizeLimit) {
        this.session = new ConcurrentWebSocketSessionDecorator(session, sendTimeLimitMs, bufferSizeLimit);
    }

    @Override
    public String id() {
        return session.getId();
    }

    @Override
    public void send(String text) throws IOException {
        if (!session.isOpen()) {
            throw new IOException("session " + session.getId() + " is closed");
        }
        session.sendMessage(new TextMessage(text));
    }

    @Override
    public void close() {
        if (!session.isOpen()) {
            return;
        }
        try {
            session.close(CloseStatus.SESSION_NOT_RELIABLE);
        } catch (IOException e) {
            log.debug("[CLOSE] session={} close failed: {}", session.getId(), e.toString());
        }
    }
}
