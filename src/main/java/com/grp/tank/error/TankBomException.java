package com.grp.tank.error;

/**
 * Base type of every failure raised while deriving a bill of materials.
 * Calculations are pure, so none of these are worth retrying with the same input.
 */
public abstract class TankBomException extends RuntimeException {

    protected TankBomException(String message) {
        super(message);
    }
}
