package com.grp.tank.engine;

import lombok.Value;

/**
 * A dimension split into whole one-metre panel units and an optional half unit.
 * <p>
 * The half unit is held as a flag. Formulas that need it numerically use {@link #fraction()}
 * (0.5 m) or {@link #halfUnitFlag()} (the price sheet's 0/1 encoding of the same fact).
 */
@Value
public class DimensionDecomposition {

    public static final DimensionDecomposition ABSENT = new DimensionDecomposition(0, false);

    int count;
    boolean half;

    public double fraction() {
        return half ? 0.5 : 0.0;
    }

    public int halfUnitFlag() {
        return half ? 1 : 0;
    }

    /** Original value, exact for anything on the 0.5 grid. */
    public double value() {
        return count + fraction();
    }

    public int halfUnits() {
        return count * 2 + halfUnitFlag();
    }

    public boolean isPresent() {
        return count > 0 || half;
    }
}
