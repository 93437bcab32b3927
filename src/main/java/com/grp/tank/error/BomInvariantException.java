package com.grp.tank.error;

import lombok.Getter;

/**
 * A calculator produced a quantity no formula should allow. Always fatal.
 */
@Getter
public class BomInvariantException extends TankBomException {

    private final String partNo;
    private final long quantity;

    public BomInvariantException(String partNo, long quantity) {
        super(String.format("Negative quantity %d derived for part %s", quantity, partNo));
        this.partNo = partNo;
        this.quantity = quantity;
    }
}
