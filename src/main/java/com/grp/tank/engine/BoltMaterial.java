package com.grp.tank.engine;

import com.grp.tank.error.UnresolvedOptionException;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum BoltMaterial {
    HDG("Z"),
    SS304("SA4"),
    SS316("SA4"); // stocked under the SS304 part numbers

    private final String partSuffix;

    public static BoltMaterial fromGrade(String grade) {
        for (BoltMaterial material : values()) {
            if (material.name().equals(grade.trim())) {
                return material;
            }
        }
        throw new UnresolvedOptionException("bolts_nuts", grade, "unknown bolt material grade");
    }
}
