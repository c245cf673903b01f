package com.wpanther.ocppcentral.exception;

import java.time.Duration;

public class OcppCallTimeoutException extends OcppCommandException {

    private final String action;

    public OcppCallTimeoutException(String identity, String action, Duration timeout) {
        super(identity, String.format("%s to %s timed out after %d seconds", action, identity, timeout.toSeconds()));
        this.action = action;
    }

    public String getAction() {
        return action;
    }
}
