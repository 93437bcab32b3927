package com.grp.tank.engine;

import lombok.Value;

import java.util.List;

@Value
public class BoltsResult implements SubsystemResult {
    List<PartQuantity> parts;
    BoltMaterialSelection materials;
}
