package com.grp.tank.domain;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Combined fastener material selection. The label itself carries the external, internal and
 * reinforcing grades; see {@code BoltMaterialSelection} for how it is split.
 */
@Getter
@RequiredArgsConstructor
public enum BoltsNutsOption implements OptionLabel {
    EXT_HDG_INT_SS304_RF_HDG("EXT:HDG/INT:SS304+R/F:HDG"),
    EXT_HDG_INT_SS304_RF_SS304("EXT:HDG/INT:SS304+R/F:SS304"),
    EXT_SS304_INT_SS316("EXT:SS304/INT:SS316"),
    EXT_HDG_INT_SS316("EXT:HDG/INT:SS316"),
    EXT_SS304_INT_SS304("EXT:SS304/INT:SS304"),
    EXT_SS316_INT_SS316("EXT:SS316/INT:SS316"),
    EXCEPT_ALL_BOLTS("Except All Bolts"),
    EXCEPT_PANEL_ASSEMBLE_BOLTS("Except Panel Assemble Bolts");

    private final String label;

    public static BoltsNutsOption fromLabel(String label) {
        return OptionLabel.resolve(BoltsNutsOption.class, "bolts_nuts", label);
    }
}
