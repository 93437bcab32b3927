package com.grp.tank.engine;

import com.grp.tank.domain.PartCategory;
import lombok.Value;

@Value
public class PartQuantity {
    String partNo;
    String description;
    PartCategory category;
    int quantity;
}
