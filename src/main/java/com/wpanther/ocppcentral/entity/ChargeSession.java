package com.wpanther.ocppcentral.entity;

import com.wpanther.ocppcentral.dto.PaymentProjection;
import com.wpanther.ocppcentral.dto.SessionStopUpdate;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One charging transaction. The id doubles as the OCPP transactionId.
 * A session is open while {@code endedAt} is null.
 */
@Entity
@Table(name = "charge_sessions")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChargeSession {

    public static final String STATUS_STARTED = "Started";
    public static final String STATUS_COMPLETED = "Completed";

    @Id
    private Long id;

    @Column(name = "company_id", nullable = false)
    private Long companyId;

    @Column(name = "site_id", nullable = false)
    private Long siteId;

    @Column(name = "charger_id", nullable = false)
    private Long chargerId;

    @Column(name = "connector_id", nullable = false)
    private Integer connectorId;

    @Column(name = "id_tag")
    private String idTag;

    @Column(name = "driver_id")
    private Long driverId;

    @Column(name = "tariff_id")
    private Long tariffId;

    @Column(name = "started_at", nullable = false)
    private Instant startedAt;

    @Column(name = "ended_at")
    private Instant endedAt;

    @Column(name = "duration_seconds")
    private Long durationSeconds;

    @Column(name = "stop_reason")
    private String stopReason;

    @Column(name = "status", nullable = false)
    private String status;

    @Column(name = "energy_kwh")
    private Double energyKwh;

    @Column(name = "cost", precision = 12, scale = 2)
    private BigDecimal cost;

    @Column(name = "payment_transaction_id")
    private Long paymentTransactionId;

    @Column(name = "payment_status")
    private String paymentStatus;

    @Column(name = "payment_amount", precision = 12, scale = 2)
    private BigDecimal paymentAmount;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    public boolean isOpen() {
        return endedAt == null;
    }

    public void applyStop(SessionStopUpdate update) {
        this.endedAt = update.getEndedAt();
        this.durationSeconds = update.getDurationSeconds();
        this.energyKwh = update.getEnergyKwh();
        this.stopReason = update.getStopReason();
        this.status = STATUS_COMPLETED;
        if (update.getCost() != null) {
            this.cost = update.getCost();
        }
    }

    public void applyPaymentProjection(PaymentProjection projection) {
        this.paymentTransactionId = projection.getPaymentTransactionId();
        this.paymentStatus = projection.getPaymentStatus();
        this.paymentAmount = projection.getPaymentAmount();
    }
}
