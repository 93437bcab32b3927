package com.grp.tank.error;

import lombok.Getter;

@Getter
public class UnknownCatalogPartException extends TankBomException {

    private final String partNo;

    public UnknownCatalogPartException(String partNo) {
        super("Part not found in catalog: " + partNo);
        this.partNo = partNo;
    }
}
