package com.wpanther.ocppcentral.dto.ocpp;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RegistrationStatus {
    ACCEPTED("Accepted"),
    PENDING("Pending"),
    REJECTED("Rejected");

    private final String value;

    RegistrationStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
