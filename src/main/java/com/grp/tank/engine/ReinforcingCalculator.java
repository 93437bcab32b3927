package com.grp.tank.engine;

import com.grp.tank.domain.PanelOptions;
import com.grp.tank.domain.PartCategory;
import com.grp.tank.domain.SteelOptions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Internal (stainless) and external (HDG) reinforcing members.
 * <p>
 * Most quantities step with the height tier (see {@link HeightTier}); the tiered ones are written as
 * {@link TieredQuantity} tables so each step can be read off on its own. Partitioned tanks add cross plates,
 * angles and plates along every partition wall; the two internal cross-plate counts are exposed on the result
 * because the partition wall bolts are derived from them.
 */
@Slf4j
@Component
public class ReinforcingCalculator {

    static final String CROSS_PLATE_4_HOLE = "WCP-1616";
    static final String CROSS_PLATE_2_HOLE = "WCP-1780";
    static final String STAINLESS_SUFFIX = "SA4"; // SS304 and SS316 share one part family

    public ReinforcingResult calculate(TankGeometry g, PanelOptions panelOptions, SteelOptions steelOptions) {
        int tier = HeightTier.of(g.heightTotal(), panelOptions.getInsulation().isInsulatedShell());
        log.debug("Reinforcing tier {} for height {} ({}, {})", tier, g.heightTotal(), panelOptions.getInsulation(),
                steelOptions.getInternalMaterial());

        PartQuantities parts = new PartQuantities(PartCategory.INTERNAL_REINFORCING);
        int[] crossPlates = addInternal(parts, g, tier, STAINLESS_SUFFIX);
        addExternal(parts, g, tier);

        return new ReinforcingResult(parts.toList(), tier, crossPlates[0], crossPlates[1], reinforcingTape(g, tier));
    }

    /** Returns the 4-hole and 2-hole partition cross-plate counts. */
    private int[] addInternal(PartQuantities parts, TankGeometry g, int tier, String suffix) {
        int[] crossPlates = {0, 0};
        double h = g.heightTotal();
        if (h < 2) {
            return crossPlates;
        }
        int wc = g.widthCount();
        int nPa = g.getPartitions();
        boolean longTank = g.lengthTotal() > 10;
        int positions = Math.max(0, g.lengthCount() - 1);

        int oneTierBase = positions * 4;
        int oneTier = oneTierBase + (nPa > 0 ? (int) (nPa * wc * (longTank ? 1.5 : 2.0)) : 0);
        parts.add("WCP-1760" + suffix, "IN-BRKT (1 tierod)", oneTier);

        if (tier >= 1) {
            int perTier = nPa > 0 ? oneTierBase + (int) (nPa * wc * (longTank ? 1.1 : 1.8)) : oneTier;
            parts.add("WCP-17160" + suffix, "IN-BRKT (2 tierod)", perTier * tier);
            int corners = tier >= 2 ? 4 * (tier + 4) + (nPa > 0 ? nPa * 13 : 0) : 4;
            parts.add("WBR-9090" + suffix, "Corner BRKT", corners);
        }

        if (nPa > 0 && h >= 2.5) {
            int walls = nPa * wc;
            crossPlates[0] = (int) (walls * (tier >= 2 ? 1.8 : 0.9));
            crossPlates[1] = (int) (walls * 0.9);
            parts.add(CROSS_PLATE_4_HOLE + suffix, "Cross Plate(4 Hole) Partition", crossPlates[0]);
            parts.add(CROSS_PLATE_2_HOLE + suffix, "Cross Plate(2 Hole) Partition", crossPlates[1]);
            parts.add("WFB-0880" + suffix, "F/L Reinforcing Angle Partition", (int) (walls * 0.9));
            parts.add("WFB-0880P" + suffix, "F/L Reinforcing Plate Partition", (int) (walls * 1.1));
            parts.add("WFB-0950" + suffix, "F/L Reinforcing Angle Partition", (int) (walls * (tier >= 2 ? 4.9 : 2)));
            if (tier >= 2) {
                parts.add("WFB-0950P" + suffix, "F/L Reinforcing Plate Partition", (int) (walls * 2.1));
            }
            parts.add("WFB-1200" + suffix, "F/L Reinforcing Angle Partition", (int) (walls * 0.9));
        }
        return crossPlates;
    }

    private void addExternal(PartQuantities parts, TankGeometry g, int tier) {
        PartCategory external = PartCategory.EXTERNAL_REINFORCING;
        double h = g.heightTotal();
        int wc = g.widthCount();
        int loc = g.lengthCount();
        int nPa = g.getPartitions();
        boolean longTank = g.lengthTotal() > 10;
        int perimeter = wc + loc;
        int joints = Math.max(0, wc - 1) + Math.max(0, loc - 1);
        int positions = Math.max(0, loc - 1);

        int plates = TieredQuantity.startingAt(2 * perimeter)
                .fromTier(1, t -> (2 * perimeter + 4) * t)
                .fromTier(2, t -> 4 * (t - 1))
                .when(t -> nPa > 0, t -> (int) (nPa * wc * (longTank ? 1.6 : 1.4)))
                .evaluate(tier);
        parts.add("WFB-0950ZP", "F/L Reinforcing plate", external, plates);
        if (nPa > 0 && h >= 2.5) {
            parts.add("WFB-0880ZP", "F/L Reinforcing plate Partition", external, nPa * 2);
        }
        if (tier >= 1) {
            parts.add("WFB-0950Z", "F/L Reinforcing Angle", external, Math.max(0, 4 * (perimeter - 1) * tier));
        }
        if (tier >= 2) {
            parts.add("WFB-0950ZL", "F/L Reinforcing Angle", external, 2 * joints);
        }
        parts.add("WFB-1200Z", "F/L Reinforcing Angle", external, 2 * joints);

        if (h >= 4) {
            parts.add("WCF-2000Z", "Corner Frame 2000mm", external, 4 * (g.heightCount() - 2));
        } else if (h >= 3) {
            parts.add("WCF-1000Z", "Corner Frame 1000mm", external, 4);
            parts.add("WCF-2000Z", "Corner Frame 2000mm", external, 4);
        } else {
            parts.add("WCF-" + g.heightMm() + "Z", "Corner Frame", external, 4);
        }

        if (h >= 2) {
            int crossPlates = TieredQuantity.startingAt(positions * 4 + nPa * 2)
                    .fromTier(1, t -> 8 * t * t)
                    .when(t -> longTank && t >= 2, t -> (int) ((g.lengthTotal() - 10) * 3.2))
                    .evaluate(tier);
            parts.add(CROSS_PLATE_2_HOLE + "Z", "Cross Plate BKT(2 Hole)", external, crossPlates);
        }
        if (tier >= 1) {
            parts.add(CROSS_PLATE_4_HOLE + "Z", "Cross Plate BKT(4 Hole)", external,
                    positions * (longTank ? 3 : 4) * tier);
        }
    }

    static int reinforcingTape(TankGeometry g, int tier) {
        if (g.isPartitioned()) {
            return g.lengthTotal() > 10 && tier >= 2 ? (int) ((g.lengthTotal() - 10) * 5.8) : 0;
        }
        return tier >= 2 ? Math.max(0, (g.widthCount() + g.lengthCount() - 3) * (tier - 1)) : 0;
    }
}
