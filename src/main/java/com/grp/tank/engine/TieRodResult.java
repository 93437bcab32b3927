package com.grp.tank.engine;

import lombok.Value;

import java.util.List;

@Value
public class TieRodResult implements SubsystemResult {
    List<PartQuantity> parts;
    int heightMultiplier;
    int assemblies; // rod assemblies, each taking four nuts and four washers
}
