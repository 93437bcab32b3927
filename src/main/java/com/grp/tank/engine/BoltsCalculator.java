package com.grp.tank.engine;

import com.grp.tank.config.TankBomProperties;
import com.grp.tank.domain.PartCategory;
import com.grp.tank.domain.SteelOptions;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * Panel assembly, skid and partition wall fasteners. Every quantity is scaled by the configured spare
 * factor and rounded up.
 * <p>
 * The partition wall rubber bolts are counted off the internal cross plates, so this runs after reinforcing.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BoltsCalculator {

    static final String CORNER_RUBBER_BOLT = "WBT-14120RD";

    private final TankBomProperties properties;

    public BoltsResult calculate(TankGeometry g, SteelOptions options, SteelSkidResult skid,
                                 ReinforcingResult reinforcing) {
        BoltMaterialSelection materials = BoltMaterialSelection.parse(options.getBoltsNuts());
        log.debug("Bolt materials {}", materials);
        if (materials.isExcluded()) {
            return new BoltsResult(List.of(), materials);
        }

        PartQuantities parts = new PartQuantities(PartCategory.BOLTS_NUTS);
        addExternal(parts, g, materials.getExternal().getPartSuffix(), skid);
        addInternal(parts, g, materials.getInternal().getPartSuffix(), reinforcing);
        return new BoltsResult(parts.toList(), materials);
    }

    private void addExternal(PartQuantities parts, TankGeometry g, String suffix, SteelSkidResult skid) {
        double h = g.heightTotal();
        boolean longTank = g.lengthTotal() > 10;
        int wc = g.widthCount();
        int loc = g.lengthCount();
        int hc = g.heightCount();
        int nPa = g.getPartitions();
        int sides = wc + loc;
        int perimeter = 2 * sides;
        int joints = Math.max(0, wc - 1) + Math.max(0, loc - 1);

        // M14x40: panel joint grid plus corner bolts stepping with height
        int m14 = sides + 2 * joints + (hc >= 4 ? 96 + 10 * (hc - 3) : 32 * hc);
        if (nPa > 0) {
            m14 = m14 * 2 + (h >= 4 && longTank ? (int) (nPa * (g.lengthTotal() - 10) * 12.4) : 0);
        }
        add(parts, "WBT-1440" + suffix, "Bolt & Nut M14x40", m14);

        int m10x35;
        if (nPa > 0) {
            m10x35 = 10 * sides + (longTank ? 14 : 16);
        } else {
            m10x35 = 16 * joints + (hc > 2 ? Math.max(0, 8 * (sides - 2) + 4) * (hc - 2) : 0);
        }
        add(parts, "WBT-1035" + suffix, "Bolt & Nut M10x35", Math.max(0, m10x35));

        int m10x50 = 8 * perimeter + 8 * (perimeter + 2 * joints) * hc;
        if (nPa > 0) {
            m10x50 += 28 * nPa * wc + (h >= 4 ? nPa * wc * 21 * (hc - 2) : 0);
        }
        add(parts, "WBT-1050" + suffix, "Bolt & Nut M10x50", m10x50);

        add(parts, "WBT-1240" + suffix, "Bolt & Nut M12x40 (Skid)", skid.isExcepted() ? 0 : 4 * sides);

        int rubber = 32
                + (hc > 2 ? 8 * sides * (hc - 2) : 0)
                + (hc > 3 ? Math.max(0, 8 * (sides - 2) * (hc - 3)) : 0)
                + (nPa > 0 ? nPa * 8 + (h >= 4 && longTank ? nPa * 2 : 0) : 0);
        add(parts, CORNER_RUBBER_BOLT, "Bolt & Nut M14x120 Rubber", rubber);
    }

    private void addInternal(PartQuantities parts, TankGeometry g, String suffix, ReinforcingResult reinforcing) {
        double h = g.heightTotal();
        boolean longTank = g.lengthTotal() > 10;
        int wc = g.widthCount();
        int loc = g.lengthCount();
        int hc = g.heightCount();
        int nPa = g.getPartitions();
        int sides = wc + loc;

        if (nPa == 0) {
            add(parts, "WBT-1035" + suffix, "Bolt & Nut M10x35 (Internal)", 8 * 2 * sides);
            add(parts, "WBT-1050" + suffix, "Bolt & Nut M10x50 (Internal)", 8 * sides);
            return;
        }
        add(parts, "WBT-1035" + suffix, "Bolt & Nut M10x35 (Internal)",
                8 * 2 * sides + nPa * wc * 10 + (h >= 4 ? (int) (nPa * sides * (hc - 2) * 4.2) : 0));
        add(parts, "WBT-1050" + suffix, "Bolt & Nut M10x50 (Internal)",
                8 * sides + nPa * wc * hc * 16 + nPa * 16
                        + (h >= 4 && longTank ? (int) (nPa * wc * 3.6 * (hc - 2)) : 0));
        add(parts, "WBT-1058R" + suffix, "Bolt & Nut M10x58 Rubber (Partition)",
                (int) (nPa * wc * (h >= 4 ? 14.4 : 12.8)));
        add(parts, "WBT-14120R" + suffix, "Bolt & Nut M14x120 Rubber (Partition)",
                8 * reinforcing.getCrossPlate4Hole() + 4 * reinforcing.getCrossPlate2Hole());
    }

    private void add(PartQuantities parts, String partNo, String description, int quantity) {
        parts.add(partNo, description, withSpares(quantity));
    }

    int withSpares(int quantity) {
        return BigDecimal.valueOf(quantity)
                .multiply(properties.getSpareFactor())
                .setScale(0, RoundingMode.CEILING)
                .intValueExact();
    }
}
