package com.wpanther.ocppcentral.dto;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Fields written when a session is closed. {@code cost} is left untouched when null.
 */
@Value
@Builder
public class SessionStopUpdate {

    Instant endedAt;
    Long durationSeconds;
    Double energyKwh;
    String stopReason;
    BigDecimal cost;
}
