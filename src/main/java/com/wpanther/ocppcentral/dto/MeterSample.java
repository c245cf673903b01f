package com.wpanther.ocppcentral.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One classified sampled value. Exactly one of the numeric fields is set
 * for recognised measurands; non-numeric readings carry only the raw data.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MeterSample {

    private Instant timestamp;
    private String measurand;

    // Energy register in Wh
    private Double energyWh;
    private Double currentAmps;
    private Double voltage;
    private Double temperature;

    // Raw sampled value as received
    private Object rawData;

    public boolean hasEnergy() {
        return energyWh != null;
    }
}
