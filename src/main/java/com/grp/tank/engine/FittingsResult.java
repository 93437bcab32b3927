package com.grp.tank.engine;

import lombok.Value;

import java.util.List;

@Value
public class FittingsResult implements SubsystemResult {
    List<PartQuantity> parts;
}
