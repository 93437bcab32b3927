package com.grp.tank.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class CapacitySummary {
    BigDecimal nominalCapacityM3;
    BigDecimal actualCapacityM3; // with the 0.2 m freeboard removed
    BigDecimal surfaceAreaM2;    // shell plus partition walls
    double totalLength;
    int numPartitions;
}
