package com.wpanther.ocppcentral.dto.ocpp;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BootNotificationResponse {

    private Instant currentTime;
    private Integer interval;
    private RegistrationStatus status;
}
