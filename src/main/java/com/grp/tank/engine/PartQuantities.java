package com.grp.tank.engine;

import com.grp.tank.domain.PartCategory;
import com.grp.tank.error.BomInvariantException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-calculation accumulator of derived part quantities, keyed by part number in first-emission order.
 * Repeated emissions of one part number are summed.
 */
public class PartQuantities {

    private final PartCategory category;
    private final Map<String, PartQuantity> parts = new LinkedHashMap<>();

    public PartQuantities(PartCategory category) {
        this.category = category;
    }

    public PartQuantities add(String partNo, String description, int quantity) {
        return add(partNo, description, category, quantity);
    }

    public PartQuantities add(String partNo, String description, PartCategory partCategory, int quantity) {
        if (quantity < 0) {
            throw new BomInvariantException(partNo, quantity);
        }
        parts.merge(partNo, new PartQuantity(partNo, description, partCategory, quantity),
                (existing, added) -> new PartQuantity(partNo, existing.getDescription(), existing.getCategory(),
                        Math.addExact(existing.getQuantity(), added.getQuantity())));
        return this;
    }

    public int quantityOf(String partNo) {
        PartQuantity part = parts.get(partNo);
        return part == null ? 0 : part.getQuantity();
    }

    public List<PartQuantity> toList() {
        return List.copyOf(new ArrayList<>(parts.values()));
    }
}
