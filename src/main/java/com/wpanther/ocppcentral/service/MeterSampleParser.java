package com.wpanther.ocppcentral.service;

import java.time.Instant;

import com.wpanther.ocppcentral.dto.MeterSample;
import com.wpanther.ocppcentral.dto.ocpp.SampledValue;

/**
 * Classifies an OCPP sampled value by measurand. Energy readings are normalized to Wh.
 */
public final class MeterSampleParser {

    public static final String ENERGY_ACTIVE_IMPORT_PREFIX = "Energy.Active.Import";
    public static final String CURRENT_IMPORT = "Current.Import";
    public static final String VOLTAGE = "Voltage";
    public static final String TEMPERATURE = "Temperature";

    private MeterSampleParser() {
    }

    public static MeterSample parse(Instant timestamp, SampledValue sampledValue) {
        String measurand = sampledValue.getMeasurand() != null
                ? sampledValue.getMeasurand()
                : SampledValue.DEFAULT_MEASURAND;

        MeterSample.MeterSampleBuilder sample = MeterSample.builder()
                .timestamp(timestamp)
                .measurand(measurand)
                .rawData(sampledValue);

        Double value = parseNumber(sampledValue.getValue());
        if (value == null) {
            return sample.build();
        }

        if (measurand.startsWith(ENERGY_ACTIVE_IMPORT_PREFIX)) {
            sample.energyWh("kWh".equals(sampledValue.getUnit()) ? value * 1000.0 : value);
        } else if (CURRENT_IMPORT.equals(measurand)) {
            sample.currentAmps(value);
        } else if (VOLTAGE.equals(measurand)) {
            sample.voltage(value);
        } else if (TEMPERATURE.equals(measurand)) {
            sample.temperature(value);
        }
        return sample.build();
    }

    private static Double parseNumber(String value) {
        if (value == null) {
            return null;
        }
        try {
            double parsed = Double.parseDouble(value.trim());
            return Double.isFinite(parsed) ? parsed : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
