package com.grp.tank.engine;

import com.grp.tank.error.InvalidGeometryException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DimensionDecomposerTest {

    private final DimensionDecomposer decomposer = new DimensionDecomposer();

    @Test
    void decompose_splitsWholeAndHalfUnits() {
        DimensionDecomposition d = decomposer.decompose("width", 5.5);

        assertThat(d.getCount()).isEqualTo(5);
        assertThat(d.isHalf()).isTrue();
        assertThat(d.fraction()).isEqualTo(0.5);
        assertThat(d.halfUnitFlag()).isEqualTo(1);
        assertThat(d.halfUnits()).isEqualTo(11);
    }

    @Test
    void decompose_roundTripsEveryGridValue() {
        for (int halfUnits = 0; halfUnits <= 40; halfUnits++) {
            double value = halfUnits / 2.0;
            DimensionDecomposition d = decomposer.decompose("length1", value);
            assertThat(d.getCount() + d.fraction()).as("value %s", value).isEqualTo(value);
            assertThat(d.value()).isEqualTo(value);
        }
    }

    @Test
    void decompose_zeroIsAbsent() {
        assertThat(decomposer.decompose("length2", 0)).isEqualTo(DimensionDecomposition.ABSENT);
        assertThat(DimensionDecomposition.ABSENT.isPresent()).isFalse();
        assertThat(decomposer.decompose("length2", 0.5).isPresent()).isTrue();
    }

    @Test
    void decompose_rejectsOffGridAndNegativeValues() {
        assertThatThrownBy(() -> decomposer.decompose("width", 5.3))
                .isInstanceOf(InvalidGeometryException.class)
                .hasMessageContaining("width");
        assertThatThrownBy(() -> decomposer.decompose("height", -1))
                .isInstanceOf(InvalidGeometryException.class);
        assertThatThrownBy(() -> decomposer.decompose("height", Double.NaN))
                .isInstanceOf(InvalidGeometryException.class);
    }

    @Test
    void geometryOf_countsPartitionsFromPresentCompartments() {
        TankGeometry g = EngineFixtures.geometry(10, 4, 2, 2, 0, 3);

        assertThat(g.getPartitions()).isEqualTo(2);
        assertThat(g.isPartitioned()).isTrue();
        assertThat(g.lengthCount()).isEqualTo(8);
        assertThat(g.lengthTotal()).isEqualTo(8.0);
        assertThat(g.getLengths()).hasSize(4);
        assertThat(g.length(4)).isEqualTo(DimensionDecomposition.ABSENT);
    }

    @Test
    void geometryOf_aggregatesHalfUnitsAcrossCompartments() {
        TankGeometry g = EngineFixtures.geometry(6.5, 3, 3.5, 0.5, 0, 2.5);

        assertThat(g.widthCount()).isEqualTo(6);
        assertThat(g.widthHalf()).isTrue();
        assertThat(g.lengthCount()).isEqualTo(6);
        assertThat(g.lengthHalfCount()).isEqualTo(2);
        assertThat(g.lengthTotal()).isEqualTo(7.0);
        assertThat(g.heightMm()).isEqualTo(2500);
        assertThat(g.heightCode()).isEqualTo(25);
        assertThat(g.getPartitions()).isEqualTo(2);
    }
}
