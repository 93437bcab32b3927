package com.grp.tank.error;

import lombok.Getter;

/**
 * An option value outside its closed set, rejected before any calculator runs.
 */
@Getter
public class UnresolvedOptionException extends TankBomException {

    private final String option;
    private final String value;

    public UnresolvedOptionException(String option, String value) {
        super(String.format("Unknown value '%s' for option %s", value, option));
        this.option = option;
        this.value = value;
    }

    public UnresolvedOptionException(String option, String value, String reason) {
        super(String.format("Invalid value '%s' for option %s: %s", value, option, reason));
        this.option = option;
        this.value = value;
    }
}
