package com.grp.tank.engine;

import java.util.List;

/**
 * Output of one calculator. Downstream calculators receive the concrete result types they depend on.
 */
public interface SubsystemResult {

    List<PartQuantity> getParts();

    /** Whether zero-quantity lines of this subsystem stay in the BOM. */
    default boolean retainsZeroLines() {
        return false;
    }

    default int quantityOf(String partNo) {
        return getParts().stream()
                .filter(part -> part.getPartNo().equals(partNo))
                .mapToInt(PartQuantity::getQuantity)
                .sum();
    }
}
