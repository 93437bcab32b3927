package com.grp.tank.domain;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum InsulationType implements OptionLabel {
    NON_INSULATED("Non-Insulated", false),
    INSULATED("Insulated", true),
    INSULATED_ROOF_ONLY("Insulated Roof Only", false),
    INSULATED_ROOF_SIDE("Insulated(Roof,Side)", true),
    NON_INSULATED_ROOF_ONLY("Non-insulated(Roof Only)", false);

    private final String label;
    // true when the side shell itself is insulated, which shifts the reinforcing tiers
    private final boolean insulatedShell;

    public static InsulationType fromLabel(String label) {
        return OptionLabel.resolve(InsulationType.class, "insulation", label);
    }
}
