package com.wpanther.ocppcentral.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Append-only record of charger activity. Meter samples are rows of type
 * {@code MeterValues}; StartTransaction and StopTransaction rows carry the
 * meter register at the start and end of a session.
 */
@Entity
@Table(name = "charge_point_events", indexes = {
        @Index(name = "idx_events_session", columnList = "session_id, sampled_at"),
        @Index(name = "idx_events_charger", columnList = "charger_id, sampled_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChargePointEvent {

    public static final String TYPE_AUTHORIZE = "Authorize";
    public static final String TYPE_STATUS_NOTIFICATION = "StatusNotification";
    public static final String TYPE_START_TRANSACTION = "StartTransaction";
    public static final String TYPE_METER_VALUES = "MeterValues";
    public static final String TYPE_STOP_TRANSACTION = "StopTransaction";

    public static final String ORIGIN_CHARGE_POINT = "ChargePoint";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "company_id", nullable = false)
    private Long companyId;

    @Column(name = "site_id", nullable = false)
    private Long siteId;

    @Column(name = "charger_id", nullable = false)
    private Long chargerId;

    @Column(name = "connector_id")
    private Integer connectorId;

    @Column(name = "session_id")
    private Long sessionId;

    @Column(name = "sampled_at", nullable = false)
    private Instant sampledAt;

    @Column(name = "event_type", nullable = false)
    private String eventType;

    @Column(name = "origin", nullable = false)
    private String origin;

    // Raw JSON as received
    @Lob
    @Column(name = "payload")
    private String payload;

    // Energy register in Wh
    @Column(name = "meter_value")
    private Double meterValue;

    @Column(name = "current_amps")
    private Double currentAmps;

    @Column(name = "voltage")
    private Double voltage;

    @Column(name = "temperature")
    private Double temperature;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;
}
