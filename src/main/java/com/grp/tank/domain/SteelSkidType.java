package com.grp.tank.domain;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum SteelSkidType implements OptionLabel {
    DEFAULT("Default"),
    ANGLE_75("Angle 75"),
    CHANNEL_125("Channel 125"),
    CHANNEL_150("Channel 150"),
    EXCEPT_SKB("Except SKB");

    private final String label;

    public static SteelSkidType fromLabel(String label) {
        return OptionLabel.resolve(SteelSkidType.class, "steel_skid", label);
    }
}
