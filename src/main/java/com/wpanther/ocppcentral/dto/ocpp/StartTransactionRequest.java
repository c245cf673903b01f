package com.wpanther.ocppcentral.dto.ocpp;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StartTransactionRequest {

    @NotNull
    @Positive
    private Integer connectorId;

    @NotBlank
    private String idTag;

    // Wh
    @NotNull
    private Integer meterStart;

    private Integer reservationId;

    @NotNull
    private Instant timestamp;
}
