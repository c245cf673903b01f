package com.wpanther.ocppcentral.ocpp;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * {@code [3, uniqueId, payload]}
 */
public class OcppCallResult extends OcppFrame {

    private final JsonNode payload;

    public OcppCallResult(String uniqueId, JsonNode payload) {
        super(uniqueId);
        this.payload = payload;
    }

    @Override
    public int getMessageTypeId() {
        return CALL_RESULT;
    }

    public JsonNode getPayload() {
        return payload;
    }
}
