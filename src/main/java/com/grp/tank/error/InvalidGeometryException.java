package com.grp.tank.error;

import lombok.Getter;

@Getter
public class InvalidGeometryException extends TankBomException {

    private final String field;
    private final double value;

    public InvalidGeometryException(String field, double value, String reason) {
        super(String.format("Invalid %s %s: %s", field, value, reason));
        this.field = field;
        this.value = value;
    }
}
