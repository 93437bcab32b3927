package com.grp.tank.engine;

import com.grp.tank.domain.PartCategory;
import com.grp.tank.domain.SteelOptions;
import com.grp.tank.engine.table.LookupTables;
import com.grp.tank.engine.table.TieRodLengthTable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Internal tie rods, connectors, nuts and washers.
 * <p>
 * Tanks up to 5 m wide take one width-spanning rod per position. Wider tanks are tied with 4000 mm main
 * segments joined by connectors, plus compartment rods along the length.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TieRodCalculator {

    static final int END_FITTING_ALLOWANCE_MM = 120;
    static final double NARROW_WIDTH_LIMIT = 5.0;
    private static final int FITTINGS_PER_ASSEMBLY = 4;

    private final LookupTables tables;

    public TieRodResult calculate(TankGeometry g, SteelOptions options) {
        int m = tables.getHeightMultipliers().multiplierFor(g.heightTotal());
        log.debug("Tie rod height multiplier {} for height {}", m, g.heightTotal());

        String spec = options.getTieRodSpec().getPartPrefix();
        String suffix = ReinforcingCalculator.STAINLESS_SUFFIX; // one rod grade stocked for every material option
        PartQuantities parts = new PartQuantities(PartCategory.TIE_RODS);
        TieRodLengthTable lengths = tables.getTieRodLengths();

        int assemblies;
        if (g.widthTotal() <= NARROW_WIDTH_LIMIT) {
            assemblies = narrowAssemblies(g, m);
            for (int segment : lengths.segmentsFor(rodLengthMm(g.getWidth()))) {
                parts.add(rodPart(spec, segment, suffix), "Tie Rod " + segment + "mm", assemblies);
            }
        } else {
            assemblies = addWideRods(parts, g, m, spec, suffix);
        }

        int fittings = assemblies * FITTINGS_PER_ASSEMBLY;
        parts.add("NUT(" + suffix + ")", "Tie Rod Nut", fittings);
        parts.add("BW(" + suffix + ")", "Tie Rod Washer", fittings);
        return new TieRodResult(parts.toList(), m, assemblies);
    }

    /**
     * Two rods per position and tier: one position between each pair of adjacent panels of every compartment,
     * plus one per partition wall. Partitioned tanks above 2 m get a second row at the partition walls.
     */
    static int narrowAssemblies(TankGeometry g, int m) {
        int positions = g.getPartitions();
        for (DimensionDecomposition length : g.getLengths()) {
            if (length.isPresent() && length.value() > 1) {
                positions += length.getCount() - 1;
            }
        }
        int assemblies = 2 * m * positions;
        if (g.heightTotal() > 2) {
            assemblies += 2 * m * g.getPartitions();
        }
        return assemblies;
    }

    /** Emits the rods of a wide tank and returns its assembly count. */
    private int addWideRods(PartQuantities parts, TankGeometry g, int m, String spec, String suffix) {
        TieRodLengthTable lengths = tables.getTieRodLengths();
        int loc = g.lengthCount();
        int nPa = g.getPartitions();

        int main = Math.max(0, (loc - 1) * m * 2 + (int) (nPa * m * (4.565 * m - 8.525)));
        parts.add(rodPart(spec, TieRodLengthTable.SEGMENT_LENGTH, suffix), "Tie Rod 4000mm", main);

        boolean allLarge = allCompartmentsLarge(g);
        if (allLarge && nPa > 0) {
            parts.add(rodPart(spec, 2880, suffix), "Tie Rod 2880mm", (nPa + 1) * 3 * m);
            parts.add(rodPart(spec, 1880, suffix), "Tie Rod 1880mm", (loc - 1) * m + nPa * 2);
        } else {
            DimensionDecomposition first = g.length(1);
            int firstQty = Math.max(0, first.getCount() - 1) * m * 3;
            List<Integer> firstSegments = lengths.segmentsFor(rodLengthMm(first));
            boolean fullSpan = firstSegments.size() == 1 && firstSegments.get(0) == 4880;
            if (!fullSpan) {
                for (int segment : firstSegments) {
                    parts.add(rodPart(spec, segment, suffix), "Tie Rod " + segment + "mm", firstQty);
                }
            }

            Map<Integer, Integer> positionsByRod = new LinkedHashMap<>();
            for (int slot = 2; slot <= 4; slot++) {
                DimensionDecomposition compartment = g.length(slot);
                if (!compartment.isPresent()) {
                    continue;
                }
                for (int segment : lengths.segmentsFor(rodLengthMm(compartment))) {
                    positionsByRod.merge(segment, Math.max(0, compartment.getCount() - 1), Integer::sum);
                }
            }
            int wallExtra = nPa > 0 ? nPa * m - 1 : 0;
            positionsByRod.forEach((segment, positions) -> {
                int qty = positions * m * 3 + wallExtra;
                if (qty > 0) {
                    parts.add(rodPart(spec, segment, suffix), "Tie Rod " + segment + "mm", qty);
                }
            });
        }

        parts.add("TC-" + spec + "60" + suffix, "Tie Rod Connector", main);

        if (nPa == 0) {
            return narrowAssemblies(g, m);
        }
        int assemblies = allLarge
                ? (int) ((loc - 1) * m + nPa * m * 4.9)
                : (loc - 1) * m * 2 + nPa * 4;
        return Math.max(0, assemblies); // all compartments under a metre
    }

    private static boolean allCompartmentsLarge(TankGeometry g) {
        if (g.length(1).value() < 5) {
            return false;
        }
        for (int slot = 2; slot <= 4; slot++) {
            DimensionDecomposition compartment = g.length(slot);
            if (compartment.isPresent() && compartment.value() < 5) {
                return false;
            }
        }
        return true;
    }

    static int rodLengthMm(DimensionDecomposition span) {
        return span.halfUnits() * 500 - END_FITTING_ALLOWANCE_MM;
    }

    private static String rodPart(String spec, int lengthMm, String suffix) {
        return "TR-" + spec + lengthMm + suffix;
    }
}
