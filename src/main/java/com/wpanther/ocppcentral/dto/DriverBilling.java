package com.wpanther.ocppcentral.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Driver and tariff resolved from an idTag. Both may be null.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DriverBilling {

    public static final DriverBilling NONE = new DriverBilling(null, null);

    private Long driverId;
    private Long tariffId;
}
