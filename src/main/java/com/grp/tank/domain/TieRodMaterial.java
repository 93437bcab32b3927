package com.grp.tank.domain;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Tie rod material. Coated and uncoated grades all resolve to the single SA4 rod family in the price sheet.
 */
@Getter
@RequiredArgsConstructor
public enum TieRodMaterial implements OptionLabel {
    SS316("SS316"),
    SS304("SS304"),
    SS304_PET_COATED("SS304+PET coated"),
    SS316_PE_COATED("SS316+PE Coated");

    private final String label;

    public static TieRodMaterial fromLabel(String label) {
        return OptionLabel.resolve(TieRodMaterial.class, "tie_rod_material", label);
    }
}
