package com.wpanther.ocppcentral.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Charging outlet of a charger, created on the first StatusNotification
 * that mentions it. Connector id 0 (the charger itself) is never stored.
 */
@Entity
@Table(name = "connectors",
        uniqueConstraints = @UniqueConstraint(columnNames = {"charger_id", "connector_id"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Connector {

    public static final String STATUS_AVAILABLE = "Available";
    public static final String STATUS_CHARGING = "Charging";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "charger_id", nullable = false)
    private Long chargerId;

    @Column(name = "connector_id", nullable = false)
    private Integer connectorId;

    @Column(name = "company_id", nullable = false)
    private Long companyId;

    @Column(name = "site_id", nullable = false)
    private Long siteId;

    @Column(name = "status", nullable = false)
    private String status;

    @Column(name = "error_code")
    private String errorCode;

    @Column(name = "enabled", nullable = false)
    private boolean enabled;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;
}
