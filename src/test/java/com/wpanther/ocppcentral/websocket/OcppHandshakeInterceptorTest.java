package com.wpanther.ocppcentral.websocket;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.ServletServerHttpRequest;
import org.springframework.http.server.ServletServerHttpResponse;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.web.socket.WebSocketHandler;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

/**
 * Unit tests for OcppHandshakeInterceptor
 */
class OcppHandshakeInterceptorTest {

    private final OcppHandshakeInterceptor interceptor = new OcppHandshakeInterceptor();

    private MockHttpServletRequest upgradeRequest(String uri, String protocols) {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", uri);
        if (protocols != null) {
            request.addHeader("Sec-WebSocket-Protocol", protocols);
        }
        return request;
    }

    @Test
    void testBeforeHandshake_StoresDecodedIdentity() {
        // Arrange
        MockHttpServletResponse servletResponse = new MockHttpServletResponse();
        Map<String, Object> attributes = new HashMap<>();

        // Act
        boolean accepted = interceptor.beforeHandshake(
                new ServletServerHttpRequest(upgradeRequest("/api/v1/cs/CP%201", "ocpp1.5, ocpp1.6")),
                new ServletServerHttpResponse(servletResponse), mock(WebSocketHandler.class), attributes);

        // Assert
        assertThat(accepted).isTrue();
        assertThat(attributes).containsEntry(OcppHandshakeInterceptor.IDENTITY_ATTRIBUTE, "CP 1");
    }

    @Test
    void testBeforeHandshake_MissingSubprotocolRejected() throws Exception {
        // Arrange
        MockHttpServletResponse servletResponse = new MockHttpServletResponse();
        ServletServerHttpResponse response = new ServletServerHttpResponse(servletResponse);
        Map<String, Object> attributes = new HashMap<>();

        // Act
        boolean accepted = interceptor.beforeHandshake(
                new ServletServerHttpRequest(upgradeRequest("/api/v1/cs/CP-1", "ocpp2.0.1")),
                response, mock(WebSocketHandler.class), attributes);
        response.flush();

        // Assert
        assertThat(accepted).isFalse();
        assertThat(servletResponse.getStatus()).isEqualTo(HttpStatus.BAD_REQUEST.value());
        assertThat(attributes).isEmpty();
    }

    @Test
    void testBeforeHandshake_NoProtocolHeaderRejected() throws Exception {
        MockHttpServletResponse servletResponse = new MockHttpServletResponse();
        ServletServerHttpResponse response = new ServletServerHttpResponse(servletResponse);

        boolean accepted = interceptor.beforeHandshake(
                new ServletServerHttpRequest(upgradeRequest("/api/v1/cs/CP-1", null)),
                response, mock(WebSocketHandler.class), new HashMap<>());
        response.flush();

        assertThat(accepted).isFalse();
        assertThat(servletResponse.getStatus()).isEqualTo(HttpStatus.BAD_REQUEST.value());
    }

    @Test
    void testExtractIdentity() {
        assertThat(OcppHandshakeInterceptor.extractIdentity("/api/v1/cs/CP-1")).isEqualTo("CP-1");
        assertThat(OcppHandshakeInterceptor.extractIdentity("/api/v1/cs/CP-1/")).isEqualTo("CP-1");
        assertThat(OcppHandshakeInterceptor.extractIdentity("/api/v1/cs/Caf%C3%A9")).isEqualTo("Café");
        assertThat(OcppHandshakeInterceptor.extractIdentity(null)).isNull();
    }
}
