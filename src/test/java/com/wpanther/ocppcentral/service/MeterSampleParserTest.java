package com.wpanther.ocppcentral.service;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;

import org.junit.jupiter.api.Test;

import com.wpanther.ocppcentral.dto.MeterSample;
import com.wpanther.ocppcentral.dto.ocpp.SampledValue;

/**
 * Unit tests for MeterSampleParser
 */
class MeterSampleParserTest {

    private static final Instant TS = Instant.parse("2024-03-01T10:05:00Z");

    private SampledValue value(String value, String measurand, String unit) {
        return SampledValue.builder().value(value).measurand(measurand).unit(unit).build();
    }

    @Test
    void testParse_MissingMeasurandIsEnergyRegister() {
        MeterSample sample = MeterSampleParser.parse(TS, value("1500", null, null));

        assertThat(sample.getMeasurand()).isEqualTo(SampledValue.DEFAULT_MEASURAND);
        assertThat(sample.getEnergyWh()).isEqualTo(1500.0);
        assertThat(sample.hasEnergy()).isTrue();
        assertThat(sample.getTimestamp()).isEqualTo(TS);
    }

    @Test
    void testParse_KilowattHoursConvertedToWattHours() {
        MeterSample sample = MeterSampleParser.parse(TS,
                value("12.5", "Energy.Active.Import.Register", "kWh"));

        assertThat(sample.getEnergyWh()).isEqualTo(12500.0);
    }

    @Test
    void testParse_OtherEnergyImportMeasurand() {
        MeterSample sample = MeterSampleParser.parse(TS, value("300", "Energy.Active.Import.Interval", "Wh"));

        assertThat(sample.getEnergyWh()).isEqualTo(300.0);
    }

    @Test
    void testParse_CurrentVoltageTemperature() {
        MeterSample current = MeterSampleParser.parse(TS, value("16.0", "Current.Import", "A"));
        MeterSample voltage = MeterSampleParser.parse(TS, value("230", "Voltage", "V"));
        MeterSample temperature = MeterSampleParser.parse(TS, value("41.5", "Temperature", "Celsius"));

        assertThat(current.getCurrentAmps()).isEqualTo(16.0);
        assertThat(current.hasEnergy()).isFalse();
        assertThat(voltage.getVoltage()).isEqualTo(230.0);
        assertThat(temperature.getTemperature()).isEqualTo(41.5);
    }

    @Test
    void testParse_NonNumericValueKeepsOnlyRawData() {
        SampledValue raw = value("n/a", "Energy.Active.Import.Register", "Wh");

        MeterSample sample = MeterSampleParser.parse(TS, raw);

        assertThat(sample.getEnergyWh()).isNull();
        assertThat(sample.getCurrentAmps()).isNull();
        assertThat(sample.getRawData()).isSameAs(raw);
    }

    @Test
    void testParse_UnrecognisedMeasurandKeepsOnlyRawData() {
        MeterSample sample = MeterSampleParser.parse(TS, value("11000", "Power.Active.Import", "W"));

        assertThat(sample.getMeasurand()).isEqualTo("Power.Active.Import");
        assertThat(sample.getEnergyWh()).isNull();
        assertThat(sample.getRawData()).isNotNull();
    }
}
