package com.grp.tank.engine;

import com.grp.tank.domain.PartCategory;
import com.grp.tank.domain.SteelOptions;
import com.grp.tank.domain.SteelSkidType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Steel skid under the tank floor: connectors, long and width frames, sub frames, liner and anchor brackets.
 */
@Slf4j
@Component
public class SteelSkidCalculator {

    static final String LINER = "LNR-3.0T";
    static final String ANCHOR_BRACKET = "WBR-5010Z";
    static final String CENTRE_SUB_FRAME = "WFF-0994AMZ";

    // liner sheets per square metre of skid footprint, including one metre of margin on each axis
    private static final BigDecimal LINER_DENSITY = new BigDecimal("4.6");

    public SteelSkidResult calculate(TankGeometry g, SteelOptions options) {
        SkidFamily family = SkidFamily.resolve(options.getSteelSkid(), g.heightTotal());
        boolean excepted = options.getSteelSkid() == SteelSkidType.EXCEPT_SKB;
        log.debug("Steel skid family {} (excepted={})", family, excepted);

        PartQuantities parts = new PartQuantities(PartCategory.STEEL_SKID);
        double wo = g.widthTotal();
        double lo = g.lengthTotal();
        int wc = g.widthCount();
        boolean large = wo > 5 || lo > 5;

        parts.add(family.getMainConnector(), "Steel Skid Connector", (int) ((wo + 1) * 2));
        parts.add(family.getCrossConnector(), "Steel Skid Connector", large ? 8 : 4);

        parts.add("WFF-1990" + family.getLongSuffix() + "Z", "Steel Skid(Main-L)",
                (int) (Math.floor(lo / 2) * (wc + 1)));
        parts.add("WFF-0990" + family.getLongSuffix() + "Z", "Steel Skid(Main-L)",
                (int) ((lo % 2) * (wc + 1)));

        addWidthFrames(parts, g, family);
        addSubFrames(parts, g, family);

        parts.add(LINER, "Liner", linerQuantity(wo, lo));
        int anchors = (int) (wo + lo);
        parts.add(ANCHOR_BRACKET, "Anchor Bracket with bolt and nut set", g.heightTotal() >= 4 ? anchors * 2 : anchors);

        if (!excepted) {
            return new SteelSkidResult(parts.toList(), family, false);
        }
        // Same lines, all forced to zero so the category still reports
        List<PartQuantity> zeroed = parts.toList().stream()
                .filter(part -> part.getQuantity() > 0)
                .map(part -> new PartQuantity(part.getPartNo(), part.getDescription(), part.getCategory(), 0))
                .collect(Collectors.toList());
        return new SteelSkidResult(zeroed, family, true);
    }

    /**
     * Two skid lines across the width. Each has a left and a right side frame plus 2 m centre frames; the side frame
     * length follows the parity of the whole-metre width and whether a half metre is added.
     */
    private void addWidthFrames(PartQuantities parts, TankGeometry g, SkidFamily family) {
        double wo = g.widthTotal();
        int wc = g.widthCount();
        String centre = "WFF-2000" + family.getShortSuffix() + "Z";
        if (wo < 2.5) {
            if (wo >= 2) {
                parts.add(centre, "Steel Skid(Main-W)", 2);
            }
            return;
        }

        boolean even = wc % 2 == 0;
        int sideMm;
        int centresPerLine;
        if (!g.widthHalf()) {
            sideMm = even ? 2000 : 1500;
            centresPerLine = even ? (wc - 4) / 2 : (wc - 3) / 2;
        } else {
            sideMm = even ? 1250 : 1750;
            centresPerLine = even ? (wc - 2) / 2 : (wc - 3) / 2;
        }

        if (centresPerLine > 0) {
            parts.add(centre, "Steel Skid(Main-W)", centresPerLine * 2);
        }
        String side = "WFF-" + (sideMm + family.getSideFrameOverhangMm()) + family.getShortSuffix();
        parts.add(side + "ZR", "Steel Skid(Main-W) Right", 2);
        parts.add(side + "ZL", "Steel Skid(Main-W) Left", 2);
    }

    private void addSubFrames(PartQuantities parts, TankGeometry g, SkidFamily family) {
        double wo = g.widthTotal();
        double lo = g.lengthTotal();
        int wc = g.widthCount();

        int side;
        if (wo > 5) {
            side = Math.max(0, (wc - 3) * 2);
            if (lo > 10) {
                side *= 2;
            }
        } else {
            side = Math.max(0, (wc - 1) * 2);
        }
        parts.add(family.getSideSubFrame(), "Steel Skid(Sub)", side);

        int corner;
        if (lo > 10) {
            corner = 4 + (int) Math.ceil(lo / 1.5);
        } else if (lo > 5) {
            corner = 4 + (int) Math.ceil(lo / 3);
        } else {
            corner = 4;
        }
        parts.add(family.getCornerSubFrame(), "Steel Skid(Sub)", corner);

        int centre;
        if (wo > 5 || lo > 5) {
            double factor = lo > 10 ? 0.726 : 0.68;
            centre = Math.max(0, (int) Math.rint((wc - 1) * lo * factor));
        } else {
            centre = Math.max(0, (wc - 1) * 2);
        }
        parts.add(CENTRE_SUB_FRAME, "Steel Skid(Sub)", centre);
    }

    static int linerQuantity(double widthTotal, double lengthTotal) {
        return BigDecimal.valueOf(widthTotal + 1)
                .multiply(BigDecimal.valueOf(lengthTotal + 1))
                .multiply(LINER_DENSITY)
                .setScale(0, RoundingMode.CEILING)
                .intValueExact();
    }
}
