package com.grp.tank.engine;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Stocked fittings. A fitting part number is the family prefix and the nominal bore, e.g. {@code WFL-100A}.
 */
@Getter
@RequiredArgsConstructor
public enum FittingType {
    SF("WSF", "Slant Flange", List.of(50, 65, 80, 100, 125, 150)),
    FL("WFL", "Flat Flange", List.of(50, 65, 80, 100, 125, 150, 200)),
    SD("WSD", "Suction/Drain", List.of(40, 50, 65, 80, 100, 125, 150)),
    OF("WOF", "Overflow", List.of(50, 65, 80, 100, 125, 150)),
    SB("WSB", "Socket Brass", List.of(20, 25, 40, 50)),
    IN("WIN", "Inlet", List.of(50, 65, 80, 100, 125, 150)),
    OUT("WOT", "Outlet", List.of(50, 65, 80, 100, 125, 150));

    private final String prefix;
    private final String description;
    private final List<Integer> sizes; // nominal bore, mm

    public String partNumber(int size) {
        return String.format("%s-%03dA", prefix, size);
    }

    public String describe(int size) {
        return description + " " + size + "mm";
    }

    public static List<String> allPartNumbers() {
        List<String> partNumbers = new ArrayList<>();
        for (FittingType type : values()) {
            for (int size : type.sizes) {
                partNumbers.add(type.partNumber(size));
            }
        }
        return partNumbers;
    }

    /** Description of a known fitting part number, empty when the part number is not a stocked fitting. */
    public static Optional<String> describe(String partNumber) {
        for (FittingType type : values()) {
            for (int size : type.sizes) {
                if (type.partNumber(size).equals(partNumber)) {
                    return Optional.of(type.describe(size));
                }
            }
        }
        return Optional.empty();
    }
}
