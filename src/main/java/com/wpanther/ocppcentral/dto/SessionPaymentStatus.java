package com.wpanther.ocppcentral.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SessionPaymentStatus {

    private Long sessionId;
    private String sessionStatus;
    private String paymentStatus;
    private BigDecimal cost;
    private boolean paymentRequired;
    private Long paymentTransactionId;
    private TransactionDetails transaction;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TransactionDetails {
        private Long id;
        private BigDecimal amount;
        private String status;
        private String paymentStatus;
        private String externalIntentId;
        private String paymentMethod;
        private Instant createdAt;
        private Instant updatedAt;
    }
}
