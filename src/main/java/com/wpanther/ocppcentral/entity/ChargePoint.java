package com.wpanther.ocppcentral.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A physical charger. The name is the OCPP identity used in the
 * WebSocket URL; ids are assigned by the administrative surface.
 */
@Entity
@Table(name = "charge_points")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChargePoint {

    @Id
    private Long id;

    @Column(name = "company_id", nullable = false)
    private Long companyId;

    @Column(name = "site_id", nullable = false)
    private Long siteId;

    @Column(name = "name", nullable = false, unique = true)
    private String name;

    @Column(name = "brand")
    private String brand;

    @Column(name = "model")
    private String model;

    @Column(name = "serial_number")
    private String serialNumber;

    @Column(name = "firmware_version")
    private String firmwareVersion;

    @Column(name = "meter_type")
    private String meterType;

    @Column(name = "meter_serial_number")
    private String meterSerialNumber;

    @Column(name = "enabled", nullable = false)
    private boolean enabled;

    @Column(name = "is_online", nullable = false)
    private boolean online;

    @Column(name = "last_connect_at")
    private Instant lastConnectAt;

    @Column(name = "last_disconnect_at")
    private Instant lastDisconnectAt;

    @Column(name = "last_heartbeat_at")
    private Instant lastHeartbeatAt;

    @Column(name = "created_at")
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;
}
