package com.grp.tank.engine;

import com.grp.tank.domain.BomResult;
import com.grp.tank.domain.CapacitySummary;
import com.grp.tank.domain.RecommendedFitting;
import com.grp.tank.domain.TankConfiguration;
import com.grp.tank.domain.TankDimensions;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;

/**
 * Runs the calculators in dependency order and assembles the priced BOM.
 * <p>
 * Panels, skid and tie rods depend on geometry only. Reinforcing feeds its cross-plate counts to bolts and
 * its tape subtotal, together with the panel tape, to ETC.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TankBomEngine {

    private final DimensionDecomposer decomposer;
    private final PanelCalculator panelCalculator;
    private final SteelSkidCalculator steelSkidCalculator;
    private final TieRodCalculator tieRodCalculator;
    private final ReinforcingCalculator reinforcingCalculator;
    private final BoltsCalculator boltsCalculator;
    private final EtcCalculator etcCalculator;
    private final FittingsResolver fittingsResolver;
    private final CapacityCalculator capacityCalculator;
    private final FittingRecommender fittingRecommender;
    private final BomAssembler assembler;

    /**
     * @param config validated configuration with every option group and the exchange rate set
     */
    public BomResult calculate(TankConfiguration config) {
        TankGeometry g = decomposer.geometryOf(config.getDimensions());

        PanelResult panels = panelCalculator.calculate(g, config.getPanelOptions());
        SteelSkidResult skid = steelSkidCalculator.calculate(g, config.getSteelOptions());
        TieRodResult tieRods = tieRodCalculator.calculate(g, config.getSteelOptions());
        ReinforcingResult reinforcing = reinforcingCalculator.calculate(g, config.getPanelOptions(),
                config.getSteelOptions());
        BoltsResult bolts = boltsCalculator.calculate(g, config.getSteelOptions(), skid, reinforcing);
        EtcResult etc = etcCalculator.calculate(g, config.getAccessoryOptions(), panels, reinforcing);
        FittingsResult fittings = fittingsResolver.resolve(config.getFittings());

        BomResult result = assembler.assemble(
                List.of(panels, skid, bolts, reinforcing, tieRods, etc, fittings),
                config.getDimensions().getQuantity(),
                BigDecimal.valueOf(config.getExchangeRate()),
                capacityCalculator.calculate(g),
                config.getOrderInfo());

        log.info("BOM for {} x {} x {} m ({} partitions, qty {}): {} lines, {} USD",
                g.widthTotal(), g.lengthTotal(), g.heightTotal(), g.getPartitions(),
                config.getDimensions().getQuantity(), result.getBom().size(), result.getCostSummary().getTotalUsd());
        return result;
    }

    public CapacitySummary capacity(TankDimensions dimensions) {
        return capacityCalculator.calculate(decomposer.geometryOf(dimensions));
    }

    public List<RecommendedFitting> recommendFittings(TankDimensions dimensions) {
        return fittingRecommender.recommend(decomposer.geometryOf(dimensions));
    }
}
