package com.wpanther.ocppcentral.exception;

/**
 * Failure of an outbound command sent to a charger.
 */
public class OcppCommandException extends RuntimeException {

    private final String identity;

    public OcppCommandException(String identity, String message) {
        super(message);
        this.identity = identity;
    }

    public OcppCommandException(String identity, String message, Throwable cause) {
        super(message, cause);
        this.identity = identity;
    }

    public String getIdentity() {
        return identity;
    }
}
