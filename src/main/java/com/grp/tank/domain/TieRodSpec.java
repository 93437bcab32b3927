package com.grp.tank.domain;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum TieRodSpec implements OptionLabel {
    M12("M12", "12M"),
    M16("M16", "16M"),
    TIE_ROD_3MH_1_1("3mH_Tie_Rod(1+1)", "12M"),
    TIE_ROD_3MH_2_1("3mH_Tie_Rod(2+1)", "12M");

    private final String label;
    private final String partPrefix;

    public static TieRodSpec fromLabel(String label) {
        return OptionLabel.resolve(TieRodSpec.class, "tie_rod_spec", label);
    }
}
