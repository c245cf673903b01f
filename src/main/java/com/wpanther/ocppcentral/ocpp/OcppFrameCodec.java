package com.wpanther.ocppcentral.ocpp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.wpanther.ocppcentral.exception.OcppProtocolException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Converts between OCPP-J text frames and {@link OcppFrame}s.
 */
@Component
@RequiredArgsConstructor
public class OcppFrameCodec {

    private final ObjectMapper objectMapper;

    /**
     * Decode one text frame.
     *
     * @throws OcppProtocolException when the frame is not valid OCPP-J; the exception
     *         carries the frame's unique id when it could be read
     */
    public OcppFrame decode(String text) {
        JsonNode root;
        try {
            root = objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new OcppProtocolException(OcppErrorCode.FORMATION_VIOLATION, null,
                    "Frame is not valid JSON", e);
        }

        if (root == null || !root.isArray() || root.size() < 3) {
            throw new OcppProtocolException(OcppErrorCode.PROTOCOL_ERROR, readUniqueId(root),
                    "Frame must be a JSON array of at least 3 elements");
        }

        String uniqueId = readUniqueId(root);
        if (uniqueId == null) {
            throw new OcppProtocolException(OcppErrorCode.PROTOCOL_ERROR, null, "Frame has no unique id");
        }

        JsonNode typeNode = root.get(0);
        if (!typeNode.isInt()) {
            throw new OcppProtocolException(OcppErrorCode.PROTOCOL_ERROR, uniqueId, "Message type id must be an integer");
        }

        switch (typeNode.intValue()) {
            case OcppFrame.CALL:
                return decodeCall(root, uniqueId);
            case OcppFrame.CALL_RESULT:
                return new OcppCallResult(uniqueId, objectOrEmpty(root.get(2)));
            case OcppFrame.CALL_ERROR:
                return decodeCallError(root, uniqueId);
            default:
                throw new OcppProtocolException(OcppErrorCode.PROTOCOL_ERROR, uniqueId,
                        "Unknown message type id: " + typeNode.intValue());
        }
    }

    public String encode(OcppFrame frame) {
        ArrayNode array = objectMapper.createArrayNode();
        array.add(frame.getMessageTypeId());
        array.add(frame.getUniqueId());

        if (frame instanceof OcppCall) {
            OcppCall call = (OcppCall) frame;
            array.add(call.getAction());
            array.add(objectOrEmpty(call.getPayload()));
        } else if (frame instanceof OcppCallResult) {
            array.add(objectOrEmpty(((OcppCallResult) frame).getPayload()));
        } else {
            OcppCallError error = (OcppCallError) frame;
            array.add(error.getErrorCode());
            array.add(error.getErrorDescription() != null ? error.getErrorDescription() : "");
            array.add(objectOrEmpty(error.getErrorDetails()));
        }

        try {
            return objectMapper.writeValueAsString(array);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode OCPP frame " + frame.getUniqueId(), e);
        }
    }

    /**
     * Serialize a payload object (DTO or map) into a JSON object node
     */
    public JsonNode toPayload(Object payload) {
        if (payload == null) {
            return objectMapper.createObjectNode();
        }
        return objectMapper.valueToTree(payload);
    }

    private OcppCall decodeCall(JsonNode root, String uniqueId) {
        if (root.size() != 4) {
            throw new OcppProtocolException(OcppErrorCode.PROTOCOL_ERROR, uniqueId,
                    "Call frame must have 4 elements");
        }
        JsonNode action = root.get(2);
        if (!action.isTextual()) {
            throw new OcppProtocolException(OcppErrorCode.PROTOCOL_ERROR, uniqueId, "Action must be a string");
        }
        JsonNode payload = root.get(3);
        if (!payload.isObject()) {
            throw new OcppProtocolException(OcppErrorCode.FORMATION_VIOLATION, uniqueId,
                    "Payload of " + action.textValue() + " must be a JSON object");
        }
        return new OcppCall(uniqueId, action.textValue(), payload);
    }

    private OcppCallError decodeCallError(JsonNode root, String uniqueId) {
        if (root.size() < 4) {
            throw new OcppProtocolException(OcppErrorCode.PROTOCOL_ERROR, uniqueId,
                    "CallError frame must have an error code and description");
        }
        String description = root.get(3).asText("");
        JsonNode details = root.size() > 4 ? root.get(4) : null;
        return new OcppCallError(uniqueId, root.get(2).asText(), description, details);
    }

    private String readUniqueId(JsonNode root) {
        if (root != null && root.isArray() && root.size() > 1 && root.get(1).isTextual()) {
            return root.get(1).textValue();
        }
        return null;
    }

    private JsonNode objectOrEmpty(JsonNode node) {
        return node != null && !node.isNull() ? node : objectMapper.createObjectNode();
    }
}
