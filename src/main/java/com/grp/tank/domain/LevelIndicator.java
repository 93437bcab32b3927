package com.grp.tank.domain;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum LevelIndicator implements OptionLabel {
    GENERAL("General"),
    SENSOR("Sensor"),
    NOT_NEEDED("No needed");

    private final String label;

    public static LevelIndicator fromLabel(String label) {
        return OptionLabel.resolve(LevelIndicator.class, "level_indicator", label);
    }
}
