package com.grp.tank.domain;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ReinforcingType implements OptionLabel {
    INTERNAL("Internal"),
    EXTERNAL("External");

    private final String label;

    public static ReinforcingType fromLabel(String label) {
        return OptionLabel.resolve(ReinforcingType.class, "reinforcing_type", label);
    }
}
