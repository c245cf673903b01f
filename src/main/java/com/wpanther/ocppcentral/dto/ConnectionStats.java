package com.wpanther.ocppcentral.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConnectionStats {

    private String identity;
    private String state;
    private Instant connectedSince;
    private Instant lastHeartbeat;
    private Instant lastActivity;
    private int pendingCallCount;
}
