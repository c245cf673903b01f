package com.wpanther.ocppcentral.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Connection view of a charger: the live registry and the stored record side by side
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChargePointStatusResponse {

    private String identity;
    private boolean connectedToServer;
    private boolean onlineInDatabase;
    private Instant lastConnectAt;
    private Instant lastDisconnectAt;
    private Instant lastHeartbeatAt;
    private ConnectionStats connectionStats;
    private List<ConnectorStatus> connectors;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ConnectorStatus {
        private Integer connectorId;
        private String status;
        private boolean enabled;
        private Instant updatedAt;
    }
}
