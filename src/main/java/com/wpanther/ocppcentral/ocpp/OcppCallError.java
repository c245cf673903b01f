package com.wpanther.ocppcentral.ocpp;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * {@code [4, uniqueId, errorCode, errorDescription, errorDetails]}. The error code
 * is kept as a string so codes outside {@link OcppErrorCode} sent by chargers survive.
 */
public class OcppCallError extends OcppFrame {

    private final String errorCode;
    private final String errorDescription;
    private final JsonNode errorDetails;

    public OcppCallError(String uniqueId, String errorCode, String errorDescription, JsonNode errorDetails) {
        super(uniqueId);
        this.errorCode = errorCode;
        this.errorDescription = errorDescription;
        this.errorDetails = errorDetails;
    }

    public OcppCallError(String uniqueId, OcppErrorCode errorCode, String errorDescription) {
        this(uniqueId, errorCode.getWireName(), errorDescription, null);
    }

    @Override
    public int getMessageTypeId() {
        return CALL_ERROR;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public String getErrorDescription() {
        return errorDescription;
    }

    public JsonNode getErrorDetails() {
        return errorDetails;
    }
}
