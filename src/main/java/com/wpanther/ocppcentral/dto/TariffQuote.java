package com.wpanther.ocppcentral.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TariffQuote {

    private BigDecimal amount;
    private Map<String, Object> breakdown;
}
