package com.grp.tank.engine.table;

import com.grp.tank.error.InvalidGeometryException;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Height x structural slot to panel code. A slot without a code means the tank has no such panel row.
 */
public class PanelCodeTable {

    private final Map<Integer, Map<PanelSlot, String>> codes;

    PanelCodeTable(Map<Integer, Map<PanelSlot, String>> codes) {
        Map<Integer, Map<PanelSlot, String>> copy = new TreeMap<>();
        codes.forEach((height, row) -> copy.put(height, Collections.unmodifiableMap(new EnumMap<>(row))));
        this.codes = Collections.unmodifiableMap(copy);
    }

    public Optional<String> find(double height, PanelSlot slot) {
        return Optional.ofNullable(row(height).get(slot));
    }

    public String code(double height, PanelSlot slot) {
        return find(height, slot).orElseThrow(() ->
                new IllegalStateException("No panel code for slot " + slot + " at height " + height));
    }

    private Map<PanelSlot, String> row(double height) {
        Map<PanelSlot, String> row = codes.get(HeightKey.of(height));
        if (row == null) {
            throw new InvalidGeometryException("height", height, "no panel codes for this height");
        }
        return row;
    }
}
