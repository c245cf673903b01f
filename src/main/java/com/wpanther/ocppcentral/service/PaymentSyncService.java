package com.wpanther.ocppcentral.service;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.wpanther.ocppcentral.dto.PaymentProjection;
import com.wpanther.ocppcentral.dto.SessionPaymentStatus;
import com.wpanther.ocppcentral.entity.ChargeSession;
import com.wpanther.ocppcentral.entity.PaymentTransaction;
import com.wpanther.ocppcentral.repository.ChargeSessionRepository;
import com.wpanther.ocppcentral.repository.PaymentTransactionRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Keeps the payment fields of a session equal to its latest payment transaction.
 * All writes are idempotent so callers may retry freely.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentSyncService {

    // Gateway-side payment statuses
    public static final String PAYMENT_PENDING = "pending";
    public static final String PAYMENT_SUCCEEDED = "succeeded";
    public static final String PAYMENT_FAILED = "failed";
    public static final String PAYMENT_CANCELED = "canceled";
    public static final String PAYMENT_REFUNDED = "refunded";

    // Session-facing statuses
    public static final String SESSION_PENDING = "pending";
    public static final String SESSION_PAID = "paid";
    public static final String SESSION_FAILED = "failed";
    public static final String SESSION_CANCELED = "canceled";
    public static final String SESSION_REFUNDED = "refunded";
    public static final String SESSION_UNKNOWN = "unknown";
    public static final String SESSION_NOT_REQUIRED = "not_required";

    // Internal transaction statuses
    public static final String TRANSACTION_PENDING = "pending";
    public static final String TRANSACTION_COMPLETED = "completed";
    public static final String TRANSACTION_FAILED = "failed";

    private static final List<String> UNPAID_STATUSES =
            List.of(SESSION_PENDING, SESSION_FAILED, SESSION_NOT_REQUIRED);

    private final PaymentTransactionRepository transactionRepository;
    private final ChargeSessionRepository sessionRepository;

    /**
     * Map a gateway payment status to the status shown on the session
     */
    public static String toSessionStatus(String paymentStatus) {
        if (paymentStatus == null) {
            return SESSION_UNKNOWN;
        }
        switch (paymentStatus) {
            case PAYMENT_PENDING:
                return SESSION_PENDING;
            case PAYMENT_SUCCEEDED:
                return SESSION_PAID;
            case PAYMENT_FAILED:
                return SESSION_FAILED;
            case PAYMENT_CANCELED:
                return SESSION_CANCELED;
            case PAYMENT_REFUNDED:
                return SESSION_REFUNDED;
            default:
                return SESSION_UNKNOWN;
        }
    }

    /**
     * Apply a payment status change to a transaction and project it onto its session
     *
     * @return the updated transaction, empty when the id is unknown
     */
    @Transactional
    public Optional<PaymentTransaction> onTransactionStatusChanged(Long transactionId, String paymentStatus) {
        Optional<PaymentTransaction> transaction = transactionRepository.findById(transactionId);
        if (transaction.isEmpty()) {
            log.warn("Payment status {} for unknown transaction {}", paymentStatus, transactionId);
            return Optional.empty();
        }
        return Optional.of(applyStatus(transaction.get(), paymentStatus));
    }

    /**
     * Same as {@link #onTransactionStatusChanged(Long, String)} keyed by the gateway's intent id
     */
    @Transactional
    public Optional<PaymentTransaction> onIntentStatusChanged(String externalIntentId, String paymentStatus) {
        Optional<PaymentTransaction> transaction = transactionRepository.findByExternalIntentId(externalIntentId);
        if (transaction.isEmpty()) {
            log.warn("Payment status {} for unknown intent {}", paymentStatus, externalIntentId);
            return Optional.empty();
        }
        return Optional.of(applyStatus(transaction.get(), paymentStatus));
    }

    /**
     * Open the payment for a completed session. A session with a cost gets one pending
     * transaction; calling again reuses it. A free session is marked not_required.
     */
    @Transactional
    public void onSessionCompleted(Long sessionId) {
        ChargeSession session = sessionRepository.findById(sessionId).orElse(null);
        if (session == null || session.isOpen()) {
            log.warn("Session {} is not a completed session, no payment opened", sessionId);
            return;
        }

        Optional<PaymentTransaction> existing = transactionRepository.findFirstBySessionIdOrderByCreatedAtDescIdDesc(sessionId);
        if (existing.isPresent()) {
            refreshProjection(session);
            return;
        }

        BigDecimal cost = session.getCost();
        if (cost == null || cost.signum() <= 0) {
            if (!SESSION_NOT_REQUIRED.equals(session.getPaymentStatus())) {
                session.setPaymentStatus(SESSION_NOT_REQUIRED);
                sessionRepository.save(session);
                log.info("Session {} is free, payment not required", sessionId);
            }
            return;
        }

        Instant now = Instant.now();
        PaymentTransaction transaction = transactionRepository.save(PaymentTransaction.builder()
                .sessionId(sessionId)
                .driverId(session.getDriverId())
                .companyId(session.getCompanyId())
                .siteId(session.getSiteId())
                .chargerId(session.getChargerId())
                .amount(cost)
                .status(TRANSACTION_PENDING)
                .paymentStatus(PAYMENT_PENDING)
                .createdAt(now)
                .updatedAt(now)
                .build());
        log.info("Opened payment transaction {} for session {}: amount={}", transaction.getId(), sessionId, cost);
        refreshProjection(session);
    }

    /**
     * Billing status of a session combined with its latest transaction
     */
    @Transactional(readOnly = true)
    public Optional<SessionPaymentStatus> statusFor(Long sessionId) {
        return sessionRepository.findById(sessionId).map(session -> {
            BigDecimal cost = session.getCost() != null ? session.getCost() : BigDecimal.ZERO;
            SessionPaymentStatus.SessionPaymentStatusBuilder status = SessionPaymentStatus.builder()
                    .sessionId(session.getId())
                    .sessionStatus(session.getStatus())
                    .paymentStatus(session.getPaymentStatus())
                    .cost(cost)
                    .paymentRequired(cost.signum() > 0)
                    .paymentTransactionId(session.getPaymentTransactionId());

            transactionRepository.findFirstBySessionIdOrderByCreatedAtDescIdDesc(sessionId)
                    .ifPresent(tx -> status.transaction(SessionPaymentStatus.TransactionDetails.builder()
                            .id(tx.getId())
                            .amount(tx.getAmount())
                            .status(tx.getStatus())
                            .paymentStatus(tx.getPaymentStatus())
                            .externalIntentId(tx.getExternalIntentId())
                            .paymentMethod(tx.getPaymentMethod())
                            .createdAt(tx.getCreatedAt())
                            .updatedAt(tx.getUpdatedAt())
                            .build()));
            return status.build();
        });
    }

    /**
     * Closed sessions with a cost whose payment is missing, pending, failed or not required
     */
    @Transactional(readOnly = true)
    public List<ChargeSession> findUnpaidSessions(Long companyId, Long siteId, Long chargerId, int limit) {
        return sessionRepository.findUnpaid(UNPAID_STATUSES, companyId, siteId, chargerId,
                PageRequest.of(0, Math.max(1, limit)));
    }

    private PaymentTransaction applyStatus(PaymentTransaction transaction, String paymentStatus) {
        if (!paymentStatus.equals(transaction.getPaymentStatus())) {
            transaction.setPaymentStatus(paymentStatus);
            transaction.setStatus(toTransactionStatus(paymentStatus, transaction.getStatus()));
            transaction.setUpdatedAt(Instant.now());
            transactionRepository.save(transaction);
            log.info("Payment transaction {} is now {}", transaction.getId(), paymentStatus);
        } else {
            log.debug("Payment transaction {} already {}", transaction.getId(), paymentStatus);
        }

        if (transaction.getSessionId() == null) {
            log.debug("Payment transaction {} is not linked to a session", transaction.getId());
            return transaction;
        }
        sessionRepository.findById(transaction.getSessionId())
                .ifPresentOrElse(this::refreshProjection,
                        () -> log.warn("Payment transaction {} links to missing session", transaction.getId()));
        return transaction;
    }

    private void refreshProjection(ChargeSession session) {
        PaymentProjection projection = transactionRepository
                .findFirstBySessionIdOrderByCreatedAtDescIdDesc(session.getId())
                .map(tx -> PaymentProjection.builder()
                        .paymentTransactionId(tx.getId())
                        .paymentStatus(toSessionStatus(tx.getPaymentStatus()))
                        .paymentAmount(tx.getAmount())
                        .build())
                .orElse(PaymentProjection.builder().build());

        if (Objects.equals(session.getPaymentTransactionId(), projection.getPaymentTransactionId())
                && Objects.equals(session.getPaymentStatus(), projection.getPaymentStatus())
                && Objects.equals(session.getPaymentAmount(), projection.getPaymentAmount())) {
            return;
        }
        session.applyPaymentProjection(projection);
        sessionRepository.save(session);
        log.info("Session {} payment is now {} (transaction {})",
                session.getId(), projection.getPaymentStatus(), projection.getPaymentTransactionId());
    }

    private String toTransactionStatus(String paymentStatus, String current) {
        switch (paymentStatus) {
            case PAYMENT_SUCCEEDED:
                return TRANSACTION_COMPLETED;
            case PAYMENT_FAILED:
            case PAYMENT_CANCELED:
                return TRANSACTION_FAILED;
            case PAYMENT_PENDING:
                return TRANSACTION_PENDING;
            default:
                return current;
        }
    }
}
