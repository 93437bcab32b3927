package com.grp.tank.domain;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ExternalLadderMaterial implements OptionLabel {
    HDG("HDG", "ZO"),
    SS304("SS304", "SO"),
    SS316("SS316", "SO");

    private final String label;
    private final String partSuffix;

    public static ExternalLadderMaterial fromLabel(String label) {
        return OptionLabel.resolve(ExternalLadderMaterial.class, "external_ladder_material", label);
    }
}
