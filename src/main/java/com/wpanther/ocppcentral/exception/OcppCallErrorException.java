package com.wpanther.ocppcentral.exception;

/**
 * The charger answered an outbound call with a CallError frame.
 */
public class OcppCallErrorException extends OcppCommandException {

    private final String action;
    private final String errorCode;
    private final String errorDescription;

    public OcppCallErrorException(String identity, String action, String errorCode, String errorDescription) {
        super(identity, String.format("%s rejected by %s: %s %s", action, identity, errorCode, errorDescription));
        this.action = action;
        this.errorCode = errorCode;
        this.errorDescription = errorDescription;
    }

    public String getAction() {
        return action;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public String getErrorDescription() {
        return errorDescription;
    }
}
