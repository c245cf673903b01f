package com.wpanther.ocppcentral.exception;

import com.wpanther.ocppcentral.ocpp.OcppErrorCode;

/**
 * Inbound frame that cannot be processed. Answered with a CallError;
 * the connection stays open.
 */
public class OcppProtocolException extends RuntimeException {

    /** Unique id used when the offending frame had none that could be read. */
    public static final String UNKNOWN_UNIQUE_ID = "-1";

    private final OcppErrorCode errorCode;
    private final String uniqueId;

    public OcppProtocolException(OcppErrorCode errorCode, String uniqueId, String message) {
        super(message);
        this.errorCode = errorCode;
        this.uniqueId = uniqueId != null ? uniqueId : UNKNOWN_UNIQUE_ID;
    }

    public OcppProtocolException(OcppErrorCode errorCode, String uniqueId, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.uniqueId = uniqueId != null ? uniqueId : UNKNOWN_UNIQUE_ID;
    }

    public OcppErrorCode getErrorCode() {
        return errorCode;
    }

    public String getUniqueId() {
        return uniqueId;
    }
}
