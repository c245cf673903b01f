package com.wpanther.ocppcentral.websocket;

import com.wpanther.ocppcentral.ocpp.ChargePointSession;
import com.wpanther.ocppcentral.ocpp.ChargePointSessionFactory;
import com.wpanther.ocppcentral.ocpp.ConnectionRegistry;
import com.wpanther.ocppcentral.ocpp.HandshakeResult;
import com.wpanther.ocppcentral.service.ChargePointService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.SubProtocolCapable;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.List;

/**
 * Accept path for charger connections. Verifies the charger, then hands every
 * text frame to the connection's {@link ChargePointSession}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OcppWebSocketHandler extends TextWebSocketHandler implements SubProtocolCapable {

    static final String SESSION_ATTRIBUTE = "ocppSession";

    private final ChargePointService chargePointService;
    private final ChargePointSessionFactory sessionFactory;
    private final ConnectionRegistry connectionRegistry;

    @Override
    public List<String> getSubProtocols() {
        return List.of(OcppHandshakeInterceptor.OCPP_SUBPROTOCOL);
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession webSocketSession) {
        String identity = (String) webSocketSession.getAttributes().get(OcppHandshakeInterceptor.IDENTITY_ATTRIBUTE);
        log.info("WebSocket connection from {} ({})", identity, webSocketSession.getRemoteAddress());

        ChargePointSession session = sessionFactory.create(identity, new WebSocketSessionTransport(webSocketSession));
        HandshakeResult result = chargePointService.verify(identity);
        if (!session.completeHandshake(result)) {
            return;
        }

        webSocketSession.getAttributes().put(SESSION_ATTRIBUTE, session);
        connectionRegistry.register(session.getIdentity(), session);
    }

    @Override
    protected void handleTextMessage(WebSocketSession webSocketSession, TextMessage message) {
        ChargePointSession session = ocppSession(webSocketSession);
        if (session == null) {
            log.warn("Frame on unverified connection {} dropped", webSocketSession.getId());
            return;
        }
        log.debug("<- {}: {}", session.getIdentity(), message.getPayload());
        session.handleText(message.getPayload());
    }

    @Override
    public void handleTransportError(WebSocketSession webSocketSession, Throwable exception) {
        ChargePointSession session = ocppSession(webSocketSession);
        log.warn("Transport error on {}: {}", session != null ? session.getIdentity() : webSocketSession.getId(),
                exception.getMessage());
        if (session != null) {
            session.close(ChargePointSession.CLOSE_SERVER_ERROR, "Transport error");
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession webSocketSession, CloseStatus status) {
        ChargePointSession session = ocppSession(webSocketSession);
        if (session != null) {
            log.info("Charge point {} disconnected: {}", session.getIdentity(), status);
            session.transportClosed();
        }
    }

    private ChargePointSession ocppSession(WebSocketSession webSocketSession) {
        return (ChargePointSession) webSocketSession.getAttributes().get(SESSION_ATTRIBUTE);
    }
}
