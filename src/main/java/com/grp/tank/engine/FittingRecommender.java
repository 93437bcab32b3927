package com.grp.tank.engine;

import com.grp.tank.domain.RecommendedFitting;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Suggests drain, overflow and inlet/outlet flange fittings sized by nominal capacity.
 */
@Component
public class FittingRecommender {

    private static final double[] CAPACITY_STEPS = {10, 50, 100, 200, 500};
    private static final double[] FLANGE_STEPS = {20, 50, 100, 200, 500};

    private static final int[] DRAIN_SIZES = {40, 50, 65, 80, 100, 150};
    private static final int[] OVERFLOW_SIZES = {50, 65, 80, 100, 125, 150};
    private static final int[] FLANGE_SIZES = {50, 65, 80, 100, 125, 150};

    public List<RecommendedFitting> recommend(TankGeometry g) {
        double capacity = g.nominalVolume();
        int sections = 1 + g.getPartitions();
        return List.of(
                fitting(FittingType.SD, "Drain", sizeFor(capacity, CAPACITY_STEPS, DRAIN_SIZES), sections),
                fitting(FittingType.SF, "Overflow", sizeFor(capacity, CAPACITY_STEPS, OVERFLOW_SIZES), sections),
                fitting(FittingType.FL, "Flange", sizeFor(capacity, FLANGE_STEPS, FLANGE_SIZES), 2)); // inlet + outlet
    }

    static int sizeFor(double capacity, double[] steps, int[] sizes) {
        for (int i = 0; i < steps.length; i++) {
            if (capacity < steps[i]) {
                return sizes[i];
            }
        }
        return sizes[sizes.length - 1];
    }

    private static RecommendedFitting fitting(FittingType type, String use, int size, int quantity) {
        return RecommendedFitting.builder()
                .fittingType(type.partNumber(size))
                .size(size)
                .quantity(quantity)
                .description(use + " " + size + "mm")
                .build();
    }
}
