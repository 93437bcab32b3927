package com.grp.tank.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class BomLineItem {
    String partNo;
    String partName;
    int quantity;
    BigDecimal unitPriceUsd;
    BigDecimal totalPriceUsd;
    BigDecimal weightKg;      // per unit
    BigDecimal totalWeightKg;
    PartCategory category;
}
