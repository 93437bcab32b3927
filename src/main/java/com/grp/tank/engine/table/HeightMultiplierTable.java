package com.grp.tank.engine.table;

import com.grp.tank.error.InvalidGeometryException;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Height to tie-rod tier multiplier. Heights missing from the table are not buildable.
 */
public class HeightMultiplierTable {

    private final Map<Integer, Integer> multipliers;

    HeightMultiplierTable(Map<Integer, Integer> multipliers) {
        this.multipliers = Collections.unmodifiableMap(new TreeMap<>(multipliers));
    }

    public int multiplierFor(double height) {
        Integer multiplier = multipliers.get(HeightKey.of(height));
        if (multiplier == null) {
            throw new InvalidGeometryException("height", height, "not a standard panel height");
        }
        return multiplier;
    }

    public boolean supports(double height) {
        double halfUnits = height * 2;
        return halfUnits == Math.rint(halfUnits) && multipliers.containsKey((int) halfUnits);
    }

    public List<Double> heights() {
        return multipliers.keySet().stream()
                .map(key -> key / 2.0)
                .collect(Collectors.toList());
    }
}
