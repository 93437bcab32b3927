package com.grp.tank.engine;

import com.grp.tank.domain.PanelOptions;
import com.grp.tank.domain.PartCategory;
import com.grp.tank.engine.table.LookupTables;
import com.grp.tank.engine.table.PanelCodeTable;
import com.grp.tank.engine.table.PanelSlot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Roof, bottom, drain, side and partition panels, plus the 50 mm sealing tape their joints need.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PanelCalculator {

    static final String MANHOLE = "MF00M";
    static final String ROOF_FULL = "RF00M";
    static final String ROOF_HALF = "RH10M";
    static final String ROOF_QUARTER = "RQ10M";

    // Subtracted from the full roof count alongside manholes and quarter panels. Pinned at zero.
    static final int ROOF_ADJUSTMENT = 0;

    private final LookupTables tables;

    public PanelResult calculate(TankGeometry g, PanelOptions options) {
        if (!options.getProductType().includesPanels()) {
            log.debug("Panels not included, skipping panel derivation");
            return new PanelResult(List.of(), 0);
        }
        PartQuantities parts = new PartQuantities(PartCategory.PANELS);
        PanelCodeTable codes = tables.getPanelCodes();
        double h = g.heightTotal();

        int wc = g.widthCount();
        int loc = g.lengthCount();
        int lengthHalves = g.lengthHalfCount();
        int widthHalf = g.getWidth().halfUnitFlag();
        int nPa = g.getPartitions();

        // Manhole and roof
        int manholes = 1 + nPa;
        int quarter = g.widthHalf() && lengthHalves > 0 ? lengthHalves : 0;
        parts.add(MANHOLE, "Manhole Panel", manholes);
        parts.add(ROOF_FULL, "Roof Panel 1x1m", Math.max(0, wc * loc - manholes - quarter - ROOF_ADJUSTMENT));
        parts.add(ROOF_HALF, "Half Roof Panel 0.5x1m", wc * lengthHalves + widthHalf * loc);
        parts.add(ROOF_QUARTER, "Quarter Roof Panel 0.5x0.5m", quarter);

        // Bottom and drain
        String bottom = codes.code(h, PanelSlot.BOTTOM);
        int partitionBottom = wc * nPa;
        int halfAdjustment = g.widthHalf() ? nPa : 0;
        parts.add("BF" + bottom, "Bottom Panel 1x1m", Math.max(0, wc * loc - partitionBottom - manholes));
        parts.add("BH" + bottom, "Half Bottom Panel 0.5x1m",
                Math.max(0, wc * lengthHalves + widthHalf * loc - halfAdjustment));
        parts.add("BQ" + bottom, "Quarter Bottom Panel 0.5x0.5m", quarter);
        parts.add("BF" + bottom.substring(0, bottom.length() - 1) + "P", "Partition Bottom Panel", partitionBottom);
        parts.add(codes.code(h, PanelSlot.DRAIN), "Drain Panel", manholes);

        addSidePanels(parts, codes, g, options);
        if (g.isPartitioned()) {
            addPartitionPanels(parts, codes, g, options);
        }

        int tape = panelTape(g);
        log.debug("Panels derived: {} lines, tape subtotal {}", parts.toList().size(), tape);
        return new PanelResult(parts.toList(), tape);
    }

    private void addSidePanels(PartQuantities parts, PanelCodeTable codes, TankGeometry g, PanelOptions options) {
        double h = g.heightTotal();
        int nPa = g.getPartitions();
        int corners = nPa; // left and right each
        int sideFull = Math.max(0, (g.widthCount() + g.lengthCount()) * 2 - corners * 2);
        int sideHalf = (g.getWidth().halfUnitFlag() + g.lengthHalfCount()) * 2;

        String top = (options.isUseSidePanel1x1() ? "SF" : "SL") + codes.code(h, PanelSlot.SIDE);
        addSideRow(parts, top, "Side Panel (Top)", sideFull, corners);
        codes.find(h, PanelSlot.SIDE_MID)
                .ifPresent(mid -> addSideRow(parts, mid, "Side Panel (Mid)", sideFull, corners));
        codes.find(h, PanelSlot.SIDE_LOW)
                .ifPresent(low -> addSideRow(parts, low, "Side Panel (Low)", sideFull, corners));
        parts.add(codes.code(h, PanelSlot.SIDE_HALF), "Half Side Panel 0.5x1m", sideHalf);
    }

    private static void addSideRow(PartQuantities parts, String code, String description, int full, int corners) {
        parts.add(code, description, full);
        parts.add(code + "L", "Corner " + description + " Left", corners);
        parts.add(code + "R", "Corner " + description + " Right", corners);
    }

    private void addPartitionPanels(PartQuantities parts, PanelCodeTable codes, TankGeometry g, PanelOptions options) {
        double h = g.heightTotal();
        int wc = g.widthCount();
        int nPa = g.getPartitions();

        Optional<String> top = codes.find(h, PanelSlot.PARTITION_TOP);
        if (top.isPresent()) {
            int perRow = wc * nPa;
            parts.add(top.get(), "Partition Panel (Top)", perRow);
            codes.find(h, PanelSlot.PARTITION_MID)
                    .ifPresent(mid -> parts.add(mid, "Partition Panel (Mid)", perRow));
            parts.add(codes.code(h, PanelSlot.PARTITION_LOW), "Partition Panel (Low)", perRow);
            return;
        }

        int hc = g.heightCount();
        int full = wc * hc * nPa;
        int half = g.widthHalf() ? (int) (0.5 * hc * nPa) : 0;
        if (g.heightHalf()) {
            full += wc * nPa;
            half += g.widthHalf() ? (int) (0.5 * nPa) : 0;
        }
        String prefix = options.isUsePartitionPanel1x1() ? "SF" : "SL";
        parts.add(prefix + codes.code(h, PanelSlot.SIDE), "Partition Panel", full);
        parts.add(codes.code(h, PanelSlot.SIDE_HALF), "Half Partition Panel", half);
    }

    static int panelTape(TankGeometry g) {
        int wc = g.widthCount();
        int loc = g.lengthCount();
        int hc = g.heightCount();
        if (g.isPartitioned()) {
            return wc * loc * 6 + (wc + loc) * hc * 10;
        }
        return (wc + loc) * 8 + (wc * loc * 4 + 2) * hc;
    }
}
