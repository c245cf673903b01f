package com.wpanther.ocppcentral.dto.ocpp;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * idTagInfo.status values of OCPP 1.6
 */
public enum AuthorizationStatus {
    ACCEPTED("Accepted"),
    BLOCKED("Blocked"),
    EXPIRED("Expired"),
    INVALID("Invalid"),
    CONCURRENT_TX("ConcurrentTx");

    private final String value;

    AuthorizationStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
