package com.grp.tank.domain;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ProductType implements OptionLabel {
    MNT("MNT"),
    NOT_INCLUDED("Not Included"); // panels supplied by others

    private final String label;

    public boolean includesPanels() {
        return this == MNT;
    }

    public static ProductType fromLabel(String label) {
        return OptionLabel.resolve(ProductType.class, "product_type", label);
    }
}
