package com.wpanther.ocppcentral.ocpp;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * {@code [2, uniqueId, action, payload]}
 */
public class OcppCall extends OcppFrame {

    private final String action;
    private final JsonNode payload;

    public OcppCall(String uniqueId, String action, JsonNode payload) {
        super(uniqueId);
        this.action = action;
        this.payload = payload;
    }

    @Override
    public int getMessageTypeId() {
        return CALL;
    }

    public String getAction() {
        return action;
    }

    public JsonNode getPayload() {
        return payload;
    }
}
