package com.grp.tank.engine.table;

import com.grp.tank.error.InvalidGeometryException;

/**
 * Tables are keyed by height in half-metre units so lookups never compare doubles.
 */
final class HeightKey {

    private HeightKey() {
    }

    static int of(double height) {
        double halfUnits = height * 2;
        if (halfUnits != Math.rint(halfUnits)) {
            throw new InvalidGeometryException("height", height, "must be a multiple of 0.5");
        }
        return (int) halfUnits;
    }

    static int parse(String height) {
        return of(Double.parseDouble(height));
    }
}
