package com.grp.tank.engine;

import com.grp.tank.domain.FittingItem;
import com.grp.tank.domain.PartCategory;
import com.grp.tank.error.UnresolvedOptionException;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * User-selected fittings, passed through with duplicates merged.
 */
@Component
public class FittingsResolver {

    public FittingsResult resolve(List<FittingItem> fittings) {
        PartQuantities parts = new PartQuantities(PartCategory.FITTINGS);
        if (fittings == null) {
            return new FittingsResult(parts.toList());
        }
        for (FittingItem item : fittings) {
            String description = FittingType.describe(item.getFittingType())
                    .orElseThrow(() -> new UnresolvedOptionException("fitting_type", item.getFittingType()));
            parts.add(item.getFittingType(), description, item.getQuantity());
        }
        return new FittingsResult(parts.toList());
    }
}
