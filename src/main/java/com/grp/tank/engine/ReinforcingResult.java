package com.grp.tank.engine;

import lombok.Value;

import java.util.List;

@Value
public class ReinforcingResult implements SubsystemResult {
    List<PartQuantity> parts;
    int tier;
    int crossPlate4Hole; // internal partition cross plates, read by the bolts calculator
    int crossPlate2Hole;
    int tapeSubtotal;
}
