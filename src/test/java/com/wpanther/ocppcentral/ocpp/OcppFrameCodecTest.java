package com.wpanther.ocppcentral.ocpp;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wpanther.ocppcentral.exception.OcppProtocolException;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for OcppFrameCodec
 */
class OcppFrameCodecTest {

    private final ObjectMapper objectMapper = OcppTestSupport.objectMapper();
    private final OcppFrameCodec codec = new OcppFrameCodec(objectMapper);

    @Test
    void testDecodeCall() {
        OcppFrame frame = codec.decode("[2,\"19223201\",\"BootNotification\",{\"chargePointVendor\":\"VendorX\"}]");

        assertThat(frame).isInstanceOf(OcppCall.class);
        OcppCall call = (OcppCall) frame;
        assertThat(call.getUniqueId()).isEqualTo("19223201");
        assertThat(call.getAction()).isEqualTo("BootNotification");
        assertThat(call.getPayload().get("chargePointVendor").asText()).isEqualTo("VendorX");
    }

    @Test
    void testDecodeCallResultAndCallError() {
        OcppFrame result = codec.decode("[3,\"abc\",{\"status\":\"Accepted\"}]");
        OcppFrame error = codec.decode("[4,\"def\",\"NotSupported\",\"Reset not supported\",{}]");

        assertThat(result).isInstanceOf(OcppCallResult.class);
        assertThat(((OcppCallResult) result).getPayload().get("status").asText()).isEqualTo("Accepted");

        assertThat(error).isInstanceOf(OcppCallError.class);
        OcppCallError callError = (OcppCallError) error;
        assertThat(callError.getUniqueId()).isEqualTo("def");
        assertThat(callError.getErrorCode()).isEqualTo("NotSupported");
        assertThat(callError.getErrorDescription()).isEqualTo("Reset not supported");
    }

    @Test
    void testDecodeInvalidJson_UsesUnknownUniqueId() {
        assertThatThrownBy(() -> codec.decode("[2,\"abc\",\"Heartbeat\""))
                .isInstanceOf(OcppProtocolException.class)
                .satisfies(e -> {
                    OcppProtocolException ex = (OcppProtocolException) e;
                    assertThat(ex.getErrorCode()).isEqualTo(OcppErrorCode.FORMATION_VIOLATION);
                    assertThat(ex.getUniqueId()).isEqualTo(OcppProtocolException.UNKNOWN_UNIQUE_ID);
                });
    }

    @Test
    void testDecodeNotAnArray() {
        assertThatThrownBy(() -> codec.decode("{\"action\":\"Heartbeat\"}"))
                .isInstanceOf(OcppProtocolException.class)
                .extracting("errorCode")
                .isEqualTo(OcppErrorCode.PROTOCOL_ERROR);
    }

    @Test
    void testDecodeUnknownMessageType_KeepsUniqueId() {
        assertThatThrownBy(() -> codec.decode("[7,\"abc\",\"Heartbeat\",{}]"))
                .isInstanceOf(OcppProtocolException.class)
                .satisfies(e -> {
                    OcppProtocolException ex = (OcppProtocolException) e;
                    assertThat(ex.getErrorCode()).isEqualTo(OcppErrorCode.PROTOCOL_ERROR);
                    assertThat(ex.getUniqueId()).isEqualTo("abc");
                });
    }

    @Test
    void testDecodeCallWithNonObjectPayload() {
        assertThatThrownBy(() -> codec.decode("[2,\"abc\",\"Heartbeat\",[]]"))
                .isInstanceOf(OcppProtocolException.class)
                .extracting("errorCode")
                .isEqualTo(OcppErrorCode.FORMATION_VIOLATION);
    }

    @Test
    void testEncodeFrames() throws Exception {
        JsonNode payload = codec.toPayload(Map.of("type", "Soft"));

        JsonNode call = objectMapper.readTree(codec.encode(new OcppCall("id-1", "Reset", payload)));
        JsonNode result = objectMapper.readTree(codec.encode(new OcppCallResult("id-2", null)));
        JsonNode error = objectMapper.readTree(codec.encode(
                new OcppCallError("id-3", OcppErrorCode.NOT_IMPLEMENTED, "Unknown action: Foo")));

        assertThat(call.toString()).isEqualTo("[2,\"id-1\",\"Reset\",{\"type\":\"Soft\"}]");
        assertThat(result.toString()).isEqualTo("[3,\"id-2\",{}]");
        assertThat(error.toString()).isEqualTo("[4,\"id-3\",\"NotImplemented\",\"Unknown action: Foo\",{}]");
    }
}
