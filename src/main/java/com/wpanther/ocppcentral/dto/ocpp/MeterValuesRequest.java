package com.wpanther.ocppcentral.dto.ocpp;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MeterValuesRequest {

    @NotNull
    @PositiveOrZero
    private Integer connectorId;

    private Integer transactionId;

    @NotEmpty
    @Valid
    private List<MeterValue> meterValue;
}
