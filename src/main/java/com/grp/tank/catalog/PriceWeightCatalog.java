package com.grp.tank.catalog;

import com.grp.tank.error.UnknownCatalogPartException;

import java.util.List;
import java.util.Optional;

/**
 * Read-only unit price and weight per part number.
 */
public interface PriceWeightCatalog {

    Optional<CatalogEntry> find(String partNo);

    /**
     * @throws UnknownCatalogPartException when the part number is not stocked
     */
    default CatalogEntry resolve(String partNo) {
        return find(partNo).orElseThrow(() -> new UnknownCatalogPartException(partNo));
    }

    /** All entries in part-number order. */
    List<CatalogEntry> entries();

    int size();
}
