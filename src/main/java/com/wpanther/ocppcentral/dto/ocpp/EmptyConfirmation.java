package com.wpanther.ocppcentral.dto.ocpp;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Serialized as {@code {}}. Used for StatusNotification.conf and MeterValues.conf.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class EmptyConfirmation {

    public static final EmptyConfirmation INSTANCE = new EmptyConfirmation();

    private EmptyConfirmation() {
    }
}
