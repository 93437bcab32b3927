package com.grp.tank.engine;

import lombok.Value;

import java.util.List;

@Value
public class EtcResult implements SubsystemResult {
    List<PartQuantity> parts;
    int sealingTape50mm;
}
