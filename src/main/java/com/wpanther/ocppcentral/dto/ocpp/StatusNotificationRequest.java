package com.wpanther.ocppcentral.dto.ocpp;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StatusNotificationRequest {

    @NotNull
    @PositiveOrZero
    private Integer connectorId;

    @NotBlank
    private String errorCode;

    @NotBlank
    private String status;

    private String info;
    private Instant timestamp;
    private String vendorId;
    private String vendorErrorCode;
}
