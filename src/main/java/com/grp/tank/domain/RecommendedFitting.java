package com.grp.tank.domain;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class RecommendedFitting {
    String fittingType; // part number, usable as FittingItem.fittingType
    int size;
    int quantity;
    String description;
}
