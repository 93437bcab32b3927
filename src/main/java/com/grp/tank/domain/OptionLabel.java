package com.grp.tank.domain;

import com.fasterxml.jackson.annotation.JsonValue;
import com.grp.tank.error.UnresolvedOptionException;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * An option enumeration whose values are addressed by their display label on the wire.
 */
public interface OptionLabel {

    @JsonValue
    String getLabel();

    static <E extends Enum<E> & OptionLabel> E resolve(Class<E> type, String option, String label) {
        if (label == null) {
            throw new UnresolvedOptionException(option, null);
        }
        for (E value : type.getEnumConstants()) {
            if (value.getLabel().equals(label.trim())) {
                return value;
            }
        }
        throw new UnresolvedOptionException(option, label);
    }

    static <E extends Enum<E> & OptionLabel> List<String> labels(Class<E> type) {
        return Arrays.stream(type.getEnumConstants())
                .map(OptionLabel::getLabel)
                .collect(Collectors.toList());
    }
}
