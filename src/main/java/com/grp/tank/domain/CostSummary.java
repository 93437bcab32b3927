package com.grp.tank.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;

@Value
@Builder
public class CostSummary {
    Map<String, BigDecimal> byCategory; // category label -> USD subtotal, every category present
    BigDecimal totalUsd;
    BigDecimal exchangeRate;
    String localCurrency;
    BigDecimal totalLocal;
}
