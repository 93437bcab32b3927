package com.grp.tank.engine;

import com.grp.tank.domain.CapacitySummary;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

@Component
public class CapacityCalculator {

    static final double FREEBOARD_M = 0.2; // unusable water depth below the roof

    public CapacitySummary calculate(TankGeometry g) {
        double w = g.widthTotal();
        double l = g.lengthTotal();
        double h = g.heightTotal();
        double surface = 2 * (w * l + w * h + l * h) + w * h * g.getPartitions();
        return CapacitySummary.builder()
                .nominalCapacityM3(round2(w * l * h))
                .actualCapacityM3(round2(Math.max(0, w * l * (h - FREEBOARD_M))))
                .surfaceAreaM2(round2(surface))
                .totalLength(l)
                .numPartitions(g.getPartitions())
                .build();
    }

    private static BigDecimal round2(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP);
    }
}
