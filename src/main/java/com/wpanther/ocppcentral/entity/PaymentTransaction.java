package com.wpanther.ocppcentral.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Payment linked to a session and, once the gateway is involved,
 * to an external payment intent.
 */
@Entity
@Table(name = "payment_transactions")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentTransaction {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "session_id")
    private Long sessionId;

    @Column(name = "driver_id")
    private Long driverId;

    @Column(name = "company_id")
    private Long companyId;

    @Column(name = "site_id")
    private Long siteId;

    @Column(name = "charger_id")
    private Long chargerId;

    @Column(name = "amount", nullable = false, precision = 12, scale = 2)
    private BigDecimal amount;

    @Column(name = "status", nullable = false)
    private String status;  // pending, completed, failed

    @Column(name = "payment_status", nullable = false)
    private String paymentStatus;  // pending, succeeded, failed, canceled, refunded

    @Column(name = "payment_method")
    private String paymentMethod;

    @Column(name = "external_intent_id", unique = true)
    private String externalIntentId;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;
}
