package com.grp.tank.engine;

import com.grp.tank.domain.BomResult;
import com.grp.tank.domain.PanelOptions;
import com.grp.tank.domain.PartCategory;
import com.grp.tank.domain.SteelOptions;
import com.grp.tank.domain.SteelSkidType;
import com.grp.tank.domain.TankConfiguration;
import com.grp.tank.domain.TankDimensions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Properties that hold for every buildable tank, checked over a grid of shapes.
 */
class BomInvariantsTest {

    private static final double[] WIDTHS = {0.5, 2.5, 5, 5.5, 7, 12.5, 20};
    private static final double[][] LENGTHS = {
            {0.5, 0, 0, 0}, {3, 0, 0, 0}, {12, 0, 0, 0}, {4, 2, 2, 0}, {5, 5, 5, 0}, {2.5, 1.5, 0, 0}, {6, 6, 6, 6}
    };

    private final TankBomEngine engine = EngineFixtures.engine();

    private static List<TankDimensions> shapes() {
        List<TankDimensions> shapes = new ArrayList<>();
        for (double height : EngineFixtures.tables().getHeightMultipliers().heights()) {
            for (double width : WIDTHS) {
                for (double[] l : LENGTHS) {
                    shapes.add(EngineFixtures.dimensions(width, l[0], l[1], l[2], l[3], height));
                }
            }
        }
        return shapes;
    }

    @Test
    void calculate_everyQuantityIsNonNegative() {
        for (TankDimensions shape : shapes()) {
            BomResult result = engine.calculate(EngineFixtures.configuration(shape));
            assertThat(result.getBom()).as("%s", shape).allMatch(line -> line.getQuantity() >= 0);
        }
    }

    @Test
    void calculate_repeatedCallsAreIdentical() {
        for (TankDimensions shape : shapes()) {
            TankConfiguration config = EngineFixtures.configuration(shape);
            assertThat(engine.calculate(config)).as("%s", shape).isEqualTo(engine.calculate(config));
        }
    }

    @Test
    void calculate_twoPartitionsMeanThreeManholes() {
        for (TankDimensions shape : shapes()) {
            if (shape.getLength2() > 0 && shape.getLength3() > 0 && shape.getLength4() == 0) {
                BomResult result = engine.calculate(EngineFixtures.configuration(shape));
                assertThat(result.quantityOf("MF00M")).as("%s", shape).isEqualTo(3);
            }
        }
    }

    @Test
    void calculate_exceptedSkidReportsZeroSkidLines() {
        for (TankDimensions shape : shapes()) {
            TankConfiguration config = EngineFixtures.configuration(shape).toBuilder()
                    .steelOptions(SteelOptions.defaults().toBuilder().steelSkid(SteelSkidType.EXCEPT_SKB).build())
                    .build();

            BomResult result = engine.calculate(config);

            assertThat(result.linesIn(PartCategory.STEEL_SKID)).as("%s", shape)
                    .isNotEmpty()
                    .allMatch(line -> line.getQuantity() == 0);
            assertThat(result.getCostSummary().getByCategory().get(PartCategory.STEEL_SKID.getLabel()))
                    .isEqualByComparingTo("0");
        }
    }

    @Test
    void calculate_sealingTapeIsPanelPlusReinforcingTape() {
        PanelCalculator panels = new PanelCalculator(EngineFixtures.tables());
        ReinforcingCalculator reinforcing = new ReinforcingCalculator();
        DimensionDecomposer decomposer = new DimensionDecomposer();

        for (TankDimensions shape : shapes()) {
            TankGeometry g = decomposer.geometryOf(shape);
            int expected = panels.calculate(g, PanelOptions.defaults()).getTapeSubtotal()
                    + reinforcing.calculate(g, PanelOptions.defaults(), SteelOptions.defaults()).getTapeSubtotal();

            BomResult result = engine.calculate(EngineFixtures.configuration(shape));

            assertThat(result.quantityOf(EtcCalculator.TAPE_50MM)).as("%s", shape).isEqualTo(expected);
        }
    }
}
