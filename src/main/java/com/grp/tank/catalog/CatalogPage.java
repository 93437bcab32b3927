package com.grp.tank.catalog;

import lombok.Value;

import java.util.List;

@Value
public class CatalogPage {
    int total;
    List<CatalogEntry> items;
    int skip;
    int limit;

    public static CatalogPage of(PriceWeightCatalog catalog, int skip, int limit) {
        List<CatalogEntry> entries = catalog.entries();
        int from = Math.min(skip, entries.size());
        int to = (int) Math.min((long) from + limit, entries.size());
        return new CatalogPage(entries.size(), List.copyOf(entries.subList(from, to)), skip, limit);
    }
}
