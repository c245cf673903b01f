package com.wpanther.ocppcentral.controller;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.wpanther.ocppcentral.dto.ChargePointStatusResponse;
import com.wpanther.ocppcentral.dto.ConnectionStats;
import com.wpanther.ocppcentral.entity.ChargePoint;
import com.wpanther.ocppcentral.ocpp.ConnectionRegistry;
import com.wpanther.ocppcentral.service.ChargePointService;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Connection status of chargers for the administrative surface
 */
@RestController
@RequestMapping("/api/v1/charge-points")
@RequiredArgsConstructor
@Slf4j
public class ChargePointController {

    private final ConnectionRegistry connectionRegistry;
    private final ChargePointService chargePointService;

    /**
     * Identities of all connected chargers
     */
    @GetMapping
    public ResponseEntity<Set<String>> listConnected() {
        return ResponseEntity.ok(connectionRegistry.listIdentities());
    }

    /**
     * Live connection stats of a charger
     */
    @GetMapping("/{identity}/connection")
    public ResponseEntity<ConnectionStats> getConnection(@PathVariable String identity) {
        return connectionRegistry.stats(identity)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    /**
     * Registry state, stored liveness and connectors of a charger
     */
    @GetMapping("/{identity}/status")
    public ResponseEntity<ChargePointStatusResponse> getStatus(@PathVariable String identity) {
        return chargePointService.findByIdentity(identity)
                .map(cp -> ResponseEntity.ok(toStatus(cp)))
                .orElse(ResponseEntity.notFound().build());
    }

    /**
     * Force-close the connection of a charger
     */
    @DeleteMapping("/{identity}/connection")
    public ResponseEntity<Void> forceClose(@PathVariable String identity) {
        log.info("Force-closing connection of {}", identity);
        return connectionRegistry.forceClose(identity, "Closed by operator")
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }

    private ChargePointStatusResponse toStatus(ChargePoint chargePoint) {
        List<ChargePointStatusResponse.ConnectorStatus> connectors = chargePointService
                .findConnectors(chargePoint.getId()).stream()
                .map(c -> new ChargePointStatusResponse.ConnectorStatus(
                        c.getConnectorId(), c.getStatus(), c.isEnabled(), c.getUpdatedAt()))
                .collect(Collectors.toList());

        return ChargePointStatusResponse.builder()
                .identity(chargePoint.getName())
                .connectedToServer(connectionRegistry.isConnected(chargePoint.getName()))
                .onlineInDatabase(chargePoint.isOnline())
                .lastConnectAt(chargePoint.getLastConnectAt())
                .lastDisconnectAt(chargePoint.getLastDisconnectAt())
                .lastHeartbeatAt(chargePoint.getLastHeartbeatAt())
                .connectionStats(connectionRegistry.stats(chargePoint.getName()).orElse(null))
                .connectors(connectors)
                .build();
    }
}
