package com.grp.tank.domain;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Material of internal reinforcing. Both grades resolve to the SA4 part family, so the choice is recorded but
 * does not change a part number.
 */
@Getter
@RequiredArgsConstructor
public enum InternalMaterial implements OptionLabel {
    SS316("SS316"),
    SS304("SS304");

    private final String label;

    public static InternalMaterial fromLabel(String label) {
        return OptionLabel.resolve(InternalMaterial.class, "internal_material", label);
    }
}
