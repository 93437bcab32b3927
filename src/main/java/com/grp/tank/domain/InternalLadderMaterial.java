package com.grp.tank.domain;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum InternalLadderMaterial implements OptionLabel {
    GRP("GRP", "FI"),
    SS304("SS304", "SI"),
    SS316L("SS316L", "SI");

    private final String label;
    private final String partSuffix;

    public static InternalLadderMaterial fromLabel(String label) {
        return OptionLabel.resolve(InternalLadderMaterial.class, "internal_ladder_material", label);
    }
}
