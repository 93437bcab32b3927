package com.grp.tank.engine;

/**
 * Reinforcing tier of a tank height. Tier 0 needs no intermediate reinforcing rows; each further tier adds one.
 * Uninsulated shells step up at whole metres (3, 4, 5 m), insulated shells half a metre earlier.
 */
public final class HeightTier {

    private HeightTier() {
    }

    public static int of(double height, boolean insulatedShell) {
        double reference = insulatedShell ? height + 0.5 : height;
        return Math.max(0, (int) Math.floor(reference) - 2);
    }
}
