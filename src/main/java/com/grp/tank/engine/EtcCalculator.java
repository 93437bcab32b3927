package com.grp.tank.engine;

import com.grp.tank.domain.AccessoryOptions;
import com.grp.tank.domain.PartCategory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Air vents, roof supporters, ladders, sealant, level indicator and sealing tapes.
 */
@Slf4j
@Component
public class EtcCalculator {

    static final String TAPE_50MM = "WST-0050RO";
    static final String TAPE_120MM = "WST-0120RO";
    static final String SILICON = "Silicon";
    static final double LARGE_VENT_CAPACITY_M3 = 100;

    public EtcResult calculate(TankGeometry g, AccessoryOptions options, PanelResult panels,
                               ReinforcingResult reinforcing) {
        PartQuantities parts = new PartQuantities(PartCategory.ETC);
        int mm = g.heightMm();
        int sections = 1 + g.getPartitions();
        double floorArea = g.widthTotal() * g.lengthTotal();

        String vent = g.nominalVolume() < LARGE_VENT_CAPACITY_M3 ? "WAV-0050A" : "WAV-0100A";
        parts.add(vent, "Air Vent", Math.max(sections, (int) Math.ceil(floorArea / 30)));
        parts.add("WRS-" + mm + "F", "Roof Supporter", roofSupporters(g));

        int internalLadders = options.getInternalLadderQty() >= 0 ? options.getInternalLadderQty() : sections;
        parts.add("WLD-" + mm + options.getInternalLadderMaterial().getPartSuffix(), "Internal Ladder",
                internalLadders);
        int externalLadders = options.getExternalLadderQty() >= 0 ? options.getExternalLadderQty() : 1;
        parts.add("WLD-" + mm + options.getExternalLadderMaterial().getPartSuffix(), "External Ladder",
                externalLadders);

        parts.add(SILICON, "Silicon Sealant", Math.max(1, (int) Math.ceil(0.1 * floorArea)));

        switch (options.getLevelIndicator()) {
            case GENERAL:
                parts.add("WLV-" + mm + "SET(G)", "Level Indicator (General)", sections);
                break;
            case SENSOR:
                parts.add("WLV-0000SET(S)", "Level Indicator (Sensor)", sections);
                break;
            default:
                break; // not needed
        }

        int tape50 = panels.getTapeSubtotal() + reinforcing.getTapeSubtotal();
        parts.add(TAPE_50MM, "Sealing Tape 50mm", tape50);
        parts.add(TAPE_120MM, "Sealing Tape 120mm", (int) (4 * g.heightTotal() + 1));

        log.debug("ETC derived: vent {}, 50mm tape {}", vent, tape50);
        return new EtcResult(parts.toList(), tape50);
    }

    /** Partitioned tanks take one supporter per five roof panels; open tanks one per four inner panel crossings. */
    static int roofSupporters(TankGeometry g) {
        if (g.isPartitioned()) {
            return g.widthCount() * g.lengthCount() / 5 + (g.lengthTotal() > 10 ? 2 : 0);
        }
        double length = g.length(1).value();
        if (length <= 1) {
            return 0;
        }
        return Math.max(0, (int) Math.ceil((g.widthTotal() - 1) * (length - 1) / 4));
    }
}
