package com.grp.tank.engine;

import com.grp.tank.domain.PanelOptions;
import com.grp.tank.domain.PartCategory;
import com.grp.tank.domain.ProductType;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PanelCalculatorTest {

    private final PanelCalculator calculator = new PanelCalculator(EngineFixtures.tables());

    @Test
    void calculate_singleTierOpenTank() {
        PanelResult result = calculator.calculate(EngineFixtures.geometry(5, 5, 2), PanelOptions.defaults());

        assertThat(result.quantityOf("MF00M")).isEqualTo(1);
        assertThat(result.quantityOf("RF00M")).isEqualTo(24);
        assertThat(result.quantityOf("BF20M")).isEqualTo(24);
        assertThat(result.quantityOf("DN20M")).isEqualTo(1);
        assertThat(result.quantityOf("SL20S")).isEqualTo(20);
        assertThat(result.quantityOf("RH10M")).isZero();
        assertThat(result.getTapeSubtotal()).isEqualTo(284);
        assertThat(result.getParts()).allMatch(part -> part.getCategory() == PartCategory.PANELS);
    }

    @Test
    void calculate_halfWidthAddsHalfPanels() {
        PanelResult result = calculator.calculate(EngineFixtures.geometry(5.5, 5, 2), PanelOptions.defaults());

        assertThat(result.quantityOf("RH10M")).isEqualTo(5);
        assertThat(result.quantityOf("BH20M")).isEqualTo(5);
        assertThat(result.quantityOf("SH20M")).isEqualTo(2);
        assertThat(result.quantityOf("RQ10M")).isZero();
    }

    @Test
    void calculate_halfWidthAndHalfLengthAddQuarterPanels() {
        PanelResult result = calculator.calculate(EngineFixtures.geometry(5.5, 5.5, 2), PanelOptions.defaults());

        assertThat(result.quantityOf("RQ10M")).isEqualTo(1);
        assertThat(result.quantityOf("BQ20M")).isEqualTo(1);
        assertThat(result.quantityOf("RF00M")).isEqualTo(23);
        assertThat(result.quantityOf("RH10M")).isEqualTo(10);
        assertThat(result.quantityOf("SH20M")).isEqualTo(4);
    }

    @Test
    void calculate_multiTierPartitionedTank() {
        PanelResult result = calculator.calculate(EngineFixtures.geometry(10, 4, 2, 2, 0, 3), PanelOptions.defaults());

        assertThat(result.quantityOf("MF00M")).isEqualTo(3);
        assertThat(result.quantityOf("RF00M")).isEqualTo(77);
        assertThat(result.quantityOf("BF30M")).isEqualTo(57);
        assertThat(result.quantityOf("BF30P")).isEqualTo(20);
        assertThat(result.quantityOf("SL20T")).isEqualTo(32);
        assertThat(result.quantityOf("SL20TL")).isEqualTo(2);
        assertThat(result.quantityOf("SL20TR")).isEqualTo(2);
        assertThat(result.quantityOf("SF30L")).isEqualTo(32);
        assertThat(result.quantityOf("PL20TCB")).isEqualTo(20);
        assertThat(result.quantityOf("PF30M")).isEqualTo(20);
        assertThat(result.quantityOf("SN30M")).isZero();
        assertThat(result.getTapeSubtotal()).isEqualTo(1020);
    }

    @Test
    void calculate_fourMetreTankHasMiddleRows() {
        PanelResult result = calculator.calculate(EngineFixtures.geometry(10, 5, 5, 5, 0, 4), PanelOptions.defaults());

        assertThat(result.quantityOf("SF30M")).isEqualTo(46);
        assertThat(result.quantityOf("SF30ML")).isEqualTo(2);
        assertThat(result.quantityOf("SN30M")).isEqualTo(20);
        assertThat(result.quantityOf("PF40M")).isEqualTo(20);
    }

    @Test
    void calculate_singleTierPartitionUsesSidePanels() {
        PanelResult result = calculator.calculate(EngineFixtures.geometry(6, 3, 3, 0, 0, 2), PanelOptions.defaults());

        // 22 shell panels plus 12 for the partition wall
        assertThat(result.quantityOf("SL20S")).isEqualTo(34);
        assertThat(result.quantityOf("SL20SL")).isEqualTo(1);
        assertThat(result.quantityOf("BF20P")).isEqualTo(6);
        assertThat(result.quantityOf("MF00M")).isEqualTo(2);
    }

    @Test
    void calculate_oneByOneSidePanelsSwitchPrefix() {
        PanelOptions options = PanelOptions.defaults().toBuilder().useSidePanel1x1(true).build();

        PanelResult result = calculator.calculate(EngineFixtures.geometry(5, 5, 2), options);

        assertThat(result.quantityOf("SF20S")).isEqualTo(20);
        assertThat(result.quantityOf("SL20S")).isZero();
    }

    @Test
    void calculate_panelsNotIncludedEmitsNothing() {
        PanelOptions options = PanelOptions.defaults().toBuilder().productType(ProductType.NOT_INCLUDED).build();

        PanelResult result = calculator.calculate(EngineFixtures.geometry(5, 5, 2), options);

        assertThat(result.getParts()).isEmpty();
        assertThat(result.getTapeSubtotal()).isZero();
    }

    @Test
    void calculate_manholesFollowCompartments() {
        for (double height : EngineFixtures.tables().getHeightMultipliers().heights()) {
            PanelResult result = calculator.calculate(EngineFixtures.geometry(7.5, 2, 3.5, 1, 0, height),
                    PanelOptions.defaults());
            assertThat(result.quantityOf("MF00M")).as("height %s", height).isEqualTo(3);
        }
    }
}
