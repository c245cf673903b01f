package com.wpanther.ocppcentral.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalTime;

/**
 * Billing rule. Read-only for the protocol engine.
 */
@Entity
@Table(name = "tariffs")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Tariff {

    @Id
    private Long id;

    @Column(name = "company_id", nullable = false)
    private Long companyId;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "enabled", nullable = false)
    private boolean enabled;

    @Column(name = "tariff_type")
    private String type;

    @Column(name = "pricing_per")
    private String per;

    @Column(name = "rate_daytime", precision = 10, scale = 4)
    private BigDecimal rateDaytime;

    @Column(name = "rate_nighttime", precision = 10, scale = 4)
    private BigDecimal rateNighttime;

    @Column(name = "daytime_from")
    private LocalTime daytimeFrom;

    @Column(name = "daytime_to")
    private LocalTime daytimeTo;

    @Column(name = "nighttime_from")
    private LocalTime nighttimeFrom;

    @Column(name = "nighttime_to")
    private LocalTime nighttimeTo;

    @Column(name = "fixed_start_fee", precision = 10, scale = 2)
    private BigDecimal fixedStartFee;

    @Column(name = "idle_fee", precision = 10, scale = 2)
    private BigDecimal idleFee;

    @Column(name = "idle_grace_minutes")
    private Integer idleGraceMinutes;
}
