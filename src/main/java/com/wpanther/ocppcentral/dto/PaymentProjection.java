package com.wpanther.ocppcentral.dto;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Payment fields mirrored onto a session from its latest payment transaction.
 */
@Value
@Builder
public class PaymentProjection {

    Long paymentTransactionId;
    String paymentStatus;
    BigDecimal paymentAmount;
}
