package com.wpanther.ocppcentral.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionCloseResult {

    private Long sessionId;
    private Integer connectorId;
    private long durationSeconds;
    private double energyKwh;
    private BigDecimal cost;

    // True when the session had been closed before and stored values were returned
    private boolean alreadyClosed;
}
