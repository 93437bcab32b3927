package com.grp.tank.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;

@Value
@Builder
public class WeightSummary {
    Map<String, BigDecimal> byCategory;
    BigDecimal panelsKg;
    BigDecimal steelKg;       // skid, fasteners, reinforcing and tie rods
    BigDecimal accessoriesKg; // ETC and fittings
    BigDecimal totalKg;
}
