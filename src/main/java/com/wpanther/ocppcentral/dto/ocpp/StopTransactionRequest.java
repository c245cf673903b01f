package com.wpanther.ocppcentral.dto.ocpp;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StopTransactionRequest {

    private String idTag;

    // Wh
    @NotNull
    private Integer meterStop;

    @NotNull
    private Instant timestamp;

    @NotNull
    private Integer transactionId;

    private String reason;

    @Valid
    private List<MeterValue> transactionData;
}
