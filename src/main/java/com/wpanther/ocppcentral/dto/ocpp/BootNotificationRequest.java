package com.wpanther.ocppcentral.dto.ocpp;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BootNotificationRequest {

    @NotBlank
    @Size(max = 20)
    private String chargePointVendor;

    @NotBlank
    @Size(max = 20)
    private String chargePointModel;

    private String chargePointSerialNumber;
    private String chargeBoxSerialNumber;
    private String firmwareVersion;
    private String iccid;
    private String imsi;
    private String meterType;
    private String meterSerialNumber;
}
