package com.wpanther.ocppcentral.websocket;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.server.HandshakeInterceptor;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * Rejects upgrade requests that do not offer the {@code ocpp1.6} subprotocol and
 * captures the charger identity from the last path segment.
 */
@Component
@Slf4j
public class OcppHandshakeInterceptor implements HandshakeInterceptor {

    public static final String OCPP_SUBPROTOCOL = "ocpp1.6";
    public static final String IDENTITY_ATTRIBUTE = "chargePointIdentity";

    @Override
    public boolean beforeHandshake(ServerHttpRequest request, ServerHttpResponse response,
                                   WebSocketHandler wsHandler, Map<String, Object> attributes) {
        String identity = extractIdentity(request.getURI().getRawPath());
        if (identity == null || identity.isBlank()) {
            log.warn("Rejecting OCPP handshake without charger identity: {}", request.getURI());
            response.setStatusCode(HttpStatus.NOT_FOUND);
            return false;
        }

        List<String> protocols = new WebSocketHttpHeaders(request.getHeaders()).getSecWebSocketProtocol();
        if (protocols.stream().noneMatch(OCPP_SUBPROTOCOL::equalsIgnoreCase)) {
            log.warn("Rejecting handshake from {}: subprotocol {} not offered ({})", identity, OCPP_SUBPROTOCOL, protocols);
            response.setStatusCode(HttpStatus.BAD_REQUEST);
            return false;
        }

        attributes.put(IDENTITY_ATTRIBUTE, identity);
        return true;
    }

    @Override
    public void afterHandshake(ServerHttpRequest request, ServerHttpResponse response,
                               WebSocketHandler wsHandler, Exception exception) {
        if (exception != null) {
            log.warn("OCPP handshake failed for {}", request.getURI(), exception);
        }
    }

    static String extractIdentity(String rawPath) {
        if (rawPath == null) {
            return null;
        }
        String path = rawPath.endsWith("/") ? rawPath.substring(0, rawPath.length() - 1) : rawPath;
        int slash = path.lastIndexOf('/');
        String segment = slash >= 0 ? path.substring(slash + 1) : path;
        return URLDecoder.decode(segment, StandardCharsets.UTF_8);
    }
}
