package com.grp.tank.engine;

import lombok.Value;

import java.util.List;

@Value
public class SteelSkidResult implements SubsystemResult {
    List<PartQuantity> parts;
    SkidFamily family;
    boolean excepted; // "Except SKB": lines kept, every quantity forced to zero

    @Override
    public boolean retainsZeroLines() {
        return excepted;
    }
}
