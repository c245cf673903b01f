package com.wpanther.ocppcentral.config;

import com.wpanther.ocppcentral.websocket.OcppHandshakeInterceptor;
import com.wpanther.ocppcentral.websocket.OcppWebSocketHandler;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

/**
 * Exposes the OCPP endpoint at {@code <path>/{chargePointIdentity}}
 */
@Configuration
@EnableWebSocket
@RequiredArgsConstructor
public class WebSocketConfig implements WebSocketConfigurer {

    private final OcppWebSocketHandler ocppWebSocketHandler;
    private final OcppHandshakeInterceptor ocppHandshakeInterceptor;

    @Value("${ocpp.websocket.path:/api/v1/cs}")
    private String websocketPath;

    @Value("${ocpp.websocket.allowed-origins:*}")
    private String allowedOrigins;

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(ocppWebSocketHandler, websocketPath + "/*")
                .addInterceptors(ocppHandshakeInterceptor)
                .setAllowedOrigins(allowedOrigins.split(","));
    }
}
