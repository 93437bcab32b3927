package com.grp.tank.catalog;

import lombok.Value;

import java.math.BigDecimal;

@Value
public class CatalogEntry {
    String partNo;
    String name;
    BigDecimal unitPriceUsd;
    BigDecimal unitWeightKg;
}
