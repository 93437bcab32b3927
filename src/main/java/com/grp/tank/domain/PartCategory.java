package com.grp.tank.domain;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * BOM line categories, in the order lines and summaries are reported.
 */
@Getter
@RequiredArgsConstructor
public enum PartCategory {
    PANELS("Panels", WeightGroup.PANELS),
    STEEL_SKID("Steel Skid", WeightGroup.STEEL),
    BOLTS_NUTS("Bolts & Nuts", WeightGroup.STEEL),
    EXTERNAL_REINFORCING("External Reinforcing", WeightGroup.STEEL),
    INTERNAL_REINFORCING("Internal Reinforcing", WeightGroup.STEEL),
    TIE_RODS("Tie Rods", WeightGroup.STEEL),
    ETC("ETC", WeightGroup.ACCESSORIES),
    FITTINGS("Fittings", WeightGroup.ACCESSORIES);

    @JsonValue
    private final String label;
    private final WeightGroup weightGroup;

    public enum WeightGroup {
        PANELS, STEEL, ACCESSORIES
    }
}
