package com.grp.tank.engine;

import lombok.Value;

import java.util.List;

@Value
public class PanelResult implements SubsystemResult {
    List<PartQuantity> parts;
    int tapeSubtotal; // metres of 50 mm sealing tape for panel joints
}
