package com.wpanther.ocppcentral.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionTelemetryResponse {

    private Long sessionId;
    private double energyKwh;
    private double maxPowerKw;
    private double averagePowerKw;
    private List<TimelinePoint> timeline;
}
