package com.wpanther.ocppcentral.controller;

import java.util.List;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.wpanther.ocppcentral.dto.PaymentStatusUpdateRequest;
import com.wpanther.ocppcentral.dto.SessionPaymentStatus;
import com.wpanther.ocppcentral.dto.SessionTelemetryResponse;
import com.wpanther.ocppcentral.entity.ChargeSession;
import com.wpanther.ocppcentral.entity.PaymentTransaction;
import com.wpanther.ocppcentral.service.ChargeSessionService;
import com.wpanther.ocppcentral.service.PaymentSyncService;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Session telemetry, billing status and payment gateway callbacks
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
@Slf4j
public class SessionPaymentController {

    private final ChargeSessionService chargeSessionService;
    private final PaymentSyncService paymentSyncService;

    @GetMapping("/sessions/{sessionId}/payment-status")
    public ResponseEntity<SessionPaymentStatus> getPaymentStatus(@PathVariable Long sessionId) {
        return paymentSyncService.statusFor(sessionId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    /**
     * Energy, peak and average power, and the meter timeline of a session
     */
    @GetMapping("/sessions/{sessionId}/telemetry")
    public ResponseEntity<SessionTelemetryResponse> getTelemetry(@PathVariable Long sessionId) {
        return chargeSessionService.findSession(sessionId)
                .map(session -> ResponseEntity.ok(toTelemetry(session)))
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/sessions/unpaid")
    public ResponseEntity<List<ChargeSession>> getUnpaidSessions(
            @RequestParam(required = false) Long companyId,
            @RequestParam(required = false) Long siteId,
            @RequestParam(required = false) Long chargerId,
            @RequestParam(defaultValue = "100") int limit) {
        return ResponseEntity.ok(paymentSyncService.findUnpaidSessions(companyId, siteId, chargerId, limit));
    }

    @PutMapping("/payment-transactions/{transactionId}/status")
    public ResponseEntity<PaymentTransaction> updateTransactionStatus(
            @PathVariable Long transactionId,
            @Valid @RequestBody PaymentStatusUpdateRequest request) {
        log.info("Payment status update for transaction {}: {}", transactionId, request.getPaymentStatus());
        return paymentSyncService.onTransactionStatusChanged(transactionId, request.getPaymentStatus())
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @PutMapping("/payment-transactions/intent/{intentId}/status")
    public ResponseEntity<PaymentTransaction> updateIntentStatus(
            @PathVariable String intentId,
            @Valid @RequestBody PaymentStatusUpdateRequest request) {
        log.info("Payment status update for intent {}: {}", intentId, request.getPaymentStatus());
        return paymentSyncService.onIntentStatusChanged(intentId, request.getPaymentStatus())
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    private SessionTelemetryResponse toTelemetry(ChargeSession session) {
        double energyKwh = chargeSessionService.energyFor(session.getId());
        Long duration = session.getDurationSeconds();
        double averagePowerKw = duration != null && duration > 0 ? energyKwh * 3600.0 / duration : 0.0;
        return SessionTelemetryResponse.builder()
                .sessionId(session.getId())
                .energyKwh(energyKwh)
                .maxPowerKw(chargeSessionService.maxPower(session.getId()))
                .averagePowerKw(averagePowerKw)
                .timeline(chargeSessionService.timeline(session.getId()))
                .build();
    }
}
