package com.wpanther.ocppcentral.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalTime;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import com.wpanther.ocppcentral.dto.TariffQuote;
import com.wpanther.ocppcentral.entity.Tariff;
import com.wpanther.ocppcentral.repository.TariffRepository;

/**
 * Unit tests for TariffService
 */
@ExtendWith(MockitoExtension.class)
class TariffServiceTest {

    @Mock
    private TariffRepository tariffRepository;

    @InjectMocks
    private TariffService tariffService;

    private static final Instant START_DAY = Instant.parse("2024-03-01T10:00:00Z");
    private static final Instant START_NIGHT = Instant.parse("2024-03-01T23:30:00Z");
    private static final Instant END = Instant.parse("2024-03-02T01:00:00Z");

    @BeforeEach
    void setUp() {
        ReflectionTestUtils.setField(tariffService, "billingTimeZone", "UTC");
    }

    private Tariff flatTariff() {
        return Tariff.builder()
                .id(7L)
                .name("Standard")
                .enabled(true)
                .type("energy")
                .per("kWh")
                .rateDaytime(new BigDecimal("0.30"))
                .fixedStartFee(new BigDecimal("1.00"))
                .build();
    }

    private Tariff dayNightTariff() {
        return Tariff.builder()
                .id(8L)
                .name("Day/Night")
                .enabled(true)
                .rateDaytime(new BigDecimal("0.40"))
                .rateNighttime(new BigDecimal("0.20"))
                .daytimeFrom(LocalTime.of(7, 0))
                .daytimeTo(LocalTime.of(22, 0))
                .build();
    }

    @Test
    void testCalculate_FlatRateWithFixedFee() {
        // Act
        TariffQuote quote = tariffService.calculate(flatTariff(), 10.0, START_DAY, END);

        // Assert
        assertThat(quote.getAmount()).isEqualByComparingTo("4.00");
        assertThat(quote.getBreakdown())
                .containsEntry("rateType", TariffService.RATE_FLAT)
                .containsEntry("tariffId", 7L)
                .containsEntry("tariffName", "Standard")
                .containsKeys("energyCost", "fixedStartFee", "sessionStart", "sessionEnd", "totalCost");
    }

    @Test
    void testCalculate_RoundsHalfUp() {
        Tariff tariff = flatTariff();
        tariff.setFixedStartFee(null);
        tariff.setRateDaytime(new BigDecimal("0.25"));

        TariffQuote quote = tariffService.calculate(tariff, 0.1, START_DAY, END);

        // 0.025 rounds to 0.03
        assertThat(quote.getAmount()).isEqualByComparingTo("0.03");
    }

    @Test
    void testCalculate_DaytimeStartUsesDaytimeRate() {
        TariffQuote quote = tariffService.calculate(dayNightTariff(), 10.0, START_DAY, END);

        assertThat(quote.getAmount()).isEqualByComparingTo("4.00");
        assertThat(quote.getBreakdown()).containsEntry("rateType", TariffService.RATE_DAYTIME);
    }

    @Test
    void testCalculate_NighttimeStartPricesWholeSessionAtNightRate() {
        TariffQuote quote = tariffService.calculate(dayNightTariff(), 10.0, START_NIGHT, END);

        assertThat(quote.getAmount()).isEqualByComparingTo("2.00");
        assertThat(quote.getBreakdown()).containsEntry("rateType", TariffService.RATE_NIGHTTIME);
    }

    @Test
    void testCalculate_UsesBillingTimeZone() {
        // 10:00 UTC is 19:00 in Tokyo, still daytime; 14:00 UTC is 23:00 in Tokyo
        ReflectionTestUtils.setField(tariffService, "billingTimeZone", "Asia/Tokyo");

        TariffQuote quote = tariffService.calculate(dayNightTariff(), 1.0,
                Instant.parse("2024-03-01T14:00:00Z"), END);

        assertThat(quote.getBreakdown()).containsEntry("rateType", TariffService.RATE_NIGHTTIME);
    }

    @Test
    void testCalculate_DisabledTariffIsFree() {
        Tariff tariff = flatTariff();
        tariff.setEnabled(false);

        TariffQuote quote = tariffService.calculate(tariff, 10.0, START_DAY, END);

        assertThat(quote.getAmount()).isEqualByComparingTo(BigDecimal.ZERO);
        assertThat(quote.getBreakdown()).containsEntry("reason", "Tariff disabled");
    }

    @Test
    void testCalculate_NoEnergyIsFreeEvenWithFixedFee() {
        TariffQuote quote = tariffService.calculate(flatTariff(), 0.0, START_DAY, END);

        assertThat(quote.getAmount()).isEqualByComparingTo(BigDecimal.ZERO);
        assertThat(quote.getBreakdown()).containsEntry("reason", "No energy consumed");
    }

    @Test
    void testQuote_NoTariffAssigned() {
        TariffQuote quote = tariffService.quote(null, 5.0, START_DAY, END);

        assertThat(quote.getAmount()).isEqualByComparingTo(BigDecimal.ZERO);
        assertThat(quote.getBreakdown()).containsEntry("reason", "No tariff assigned");
    }

    @Test
    void testQuote_TariffNotFound() {
        // Arrange
        when(tariffRepository.findById(99L)).thenReturn(Optional.empty());

        // Act
        TariffQuote quote = tariffService.quote(99L, 5.0, START_DAY, END);

        // Assert
        assertThat(quote.getAmount()).isEqualByComparingTo(BigDecimal.ZERO);
        assertThat(quote.getBreakdown()).containsEntry("reason", "Tariff not found");
    }

    @Test
    void testQuote_LoadsTariff() {
        when(tariffRepository.findById(7L)).thenReturn(Optional.of(flatTariff()));

        TariffQuote quote = tariffService.quote(7L, 2.0, START_DAY, END);

        assertThat(quote.getAmount()).isEqualByComparingTo("1.60");
    }

    @Test
    void testIsDaytime_InclusiveBounds() {
        LocalTime from = LocalTime.of(7, 0);
        LocalTime to = LocalTime.of(22, 0);

        assertThat(TariffService.isDaytime(LocalTime.of(7, 0), from, to)).isTrue();
        assertThat(TariffService.isDaytime(LocalTime.of(22, 0), from, to)).isTrue();
        assertThat(TariffService.isDaytime(LocalTime.of(6, 59), from, to)).isFalse();
        assertThat(TariffService.isDaytime(LocalTime.of(22, 1), from, to)).isFalse();
    }

    @Test
    void testIsDaytime_WindowWrappingMidnight() {
        LocalTime from = LocalTime.of(20, 0);
        LocalTime to = LocalTime.of(6, 0);

        assertThat(TariffService.isDaytime(LocalTime.of(23, 0), from, to)).isTrue();
        assertThat(TariffService.isDaytime(LocalTime.of(3, 0), from, to)).isTrue();
        assertThat(TariffService.isDaytime(LocalTime.of(12, 0), from, to)).isFalse();
    }
}
