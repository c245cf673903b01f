package com.wpanther.ocppcentral.dto.ocpp;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
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
public class MeterValue {

    @NotNull
    private Instant timestamp;

    @NotEmpty
    @Valid
    private List<SampledValue> sampledValue;
}
