package com.wpanther.ocppcentral.service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.wpanther.ocppcentral.dto.TariffQuote;
import com.wpanther.ocppcentral.entity.Tariff;
import com.wpanther.ocppcentral.repository.TariffRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Prices a session from its tariff, energy and start time.
 *
 * <p>With day and night rates and a daytime window configured, the session's
 * start time alone selects the rate for all of its energy. Otherwise the
 * daytime rate is applied as a flat rate. A fixed start fee is always added.
 * Results are rounded half-up to two decimals.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TariffService {

    public static final String RATE_DAYTIME = "daytime";
    public static final String RATE_NIGHTTIME = "nighttime";
    public static final String RATE_FLAT = "flat_rate";

    private final TariffRepository tariffRepository;

    @Value("${ocpp.billing.time-zone:UTC}")
    private String billingTimeZone;

    @Transactional(readOnly = true)
    public TariffQuote quote(Long tariffId, double energyKwh, Instant startTime, Instant endTime) {
        if (tariffId == null) {
            return zero("No tariff assigned", energyKwh);
        }
        return tariffRepository.findById(tariffId)
                .map(tariff -> calculate(tariff, energyKwh, startTime, endTime))
                .orElseGet(() -> {
                    log.warn("Tariff {} not found, session is free", tariffId);
                    return zero("Tariff not found", energyKwh);
                });
    }

    /**
     * Pure price calculation for a loaded tariff
     */
    public TariffQuote calculate(Tariff tariff, double energyKwh, Instant startTime, Instant endTime) {
        if (!tariff.isEnabled()) {
            return zero("Tariff disabled", energyKwh);
        }
        if (energyKwh <= 0) {
            return zero("No energy consumed", energyKwh);
        }

        BigDecimal energy = BigDecimal.valueOf(energyKwh);
        BigDecimal fixedFee = tariff.getFixedStartFee() != null ? tariff.getFixedStartFee() : BigDecimal.ZERO;

        BigDecimal rate;
        String rateType;
        if (hasDayNightRates(tariff)) {
            LocalTime startOfDay = startTime.atZone(ZoneId.of(billingTimeZone)).toLocalTime();
            if (isDaytime(startOfDay, tariff.getDaytimeFrom(), tariff.getDaytimeTo())) {
                rate = tariff.getRateDaytime();
                rateType = RATE_DAYTIME;
            } else {
                rate = tariff.getRateNighttime();
                rateType = RATE_NIGHTTIME;
            }
        } else {
            rate = tariff.getRateDaytime() != null ? tariff.getRateDaytime() : BigDecimal.ZERO;
            rateType = RATE_FLAT;
        }

        BigDecimal energyCost = energy.multiply(rate);
        BigDecimal total = fixedFee.add(energyCost).setScale(2, RoundingMode.HALF_UP);

        Map<String, Object> breakdown = new LinkedHashMap<>();
        breakdown.put("tariffId", tariff.getId());
        breakdown.put("tariffName", tariff.getName());
        breakdown.put("tariffType", tariff.getType());
        breakdown.put("pricingPer", tariff.getPer());
        breakdown.put("energyKwh", energyKwh);
        breakdown.put("fixedStartFee", fixedFee.setScale(2, RoundingMode.HALF_UP));
        breakdown.put("rateUsed", rate);
        breakdown.put("rateType", rateType);
        breakdown.put("energyCost", energyCost.setScale(2, RoundingMode.HALF_UP));
        breakdown.put("sessionStart", startTime);
        breakdown.put("sessionEnd", endTime);
        breakdown.put("totalCost", total);

        log.debug("Priced {} kWh with tariff {} at {} ({}): {}", energyKwh, tariff.getId(), rate, rateType, total);
        return new TariffQuote(total, breakdown);
    }

    /**
     * Whether {@code time} falls in the daytime window. Windows with {@code from}
     * after {@code to} wrap past midnight. Both ends are inclusive.
     */
    public static boolean isDaytime(LocalTime time, LocalTime from, LocalTime to) {
        if (!from.isAfter(to)) {
            return !time.isBefore(from) && !time.isAfter(to);
        }
        return !time.isBefore(from) || !time.isAfter(to);
    }

    private boolean hasDayNightRates(Tariff tariff) {
        return tariff.getRateDaytime() != null && tariff.getRateNighttime() != null
                && tariff.getDaytimeFrom() != null && tariff.getDaytimeTo() != null;
    }

    private TariffQuote zero(String reason, double energyKwh) {
        Map<String, Object> breakdown = new LinkedHashMap<>();
        breakdown.put("reason", reason);
        breakdown.put("energyKwh", energyKwh);
        breakdown.put("totalCost", BigDecimal.ZERO.setScale(2));
        return new TariffQuote(BigDecimal.ZERO.setScale(2), breakdown);
    }
}
