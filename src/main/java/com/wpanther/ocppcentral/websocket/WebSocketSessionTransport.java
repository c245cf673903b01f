package com.wpanther.ocppcentral.websocket;

import com.wpanther.ocppcentral.ocpp.OcppTransport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;

/**
 * {@link OcppTransport} over a Spring WebSocket session. Sends are serialized by
 * the decorator so inbound replies and outbound calls may interleave.
 */
@Slf4j
public class WebSocketSessionTransport implements OcppTransport {

    private static final int SEND_TIME_LIMIT_MS = 10_000;
    private static final int BUFFER_SIZE_LIMIT = 512 * 1024;

    private final WebSocketSession session;

    public WebSocketSessionTransport(WebSocketSession session) {
        this.session = new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT);
    }

    @Override
    public String getId() {
        return session.getId();
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public void send(String text) throws IOException {
        log.debug("-> {}: {}", session.getId(), text);
        session.sendMessage(new TextMessage(text));
    }

    @Override
    public void close(int code, String reason) {
        if (!session.isOpen()) {
            return;
        }
        try {
            session.close(new CloseStatus(code, reason));
        } catch (IOException e) {
            log.warn("Failed to close WebSocket session {} with code {}", session.getId(), code, e);
        }
    }
}
