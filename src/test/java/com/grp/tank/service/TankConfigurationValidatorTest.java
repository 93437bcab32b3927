package com.grp.tank.service;

import com.grp.tank.domain.AccessoryOptions;
import com.grp.tank.domain.FittingItem;
import com.grp.tank.domain.PanelOptions;
import com.grp.tank.domain.SteelOptions;
import com.grp.tank.domain.TankConfiguration;
import com.grp.tank.domain.TankDimensions;
import com.grp.tank.engine.EngineFixtures;
import com.grp.tank.error.InvalidGeometryException;
import com.grp.tank.error.UnresolvedOptionException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TankConfigurationValidatorTest {

    private final TankConfigurationValidator validator = new TankConfigurationValidator(EngineFixtures.tables());

    private static TankConfiguration valid() {
        return EngineFixtures.configuration(EngineFixtures.dimensions(10, 4, 2, 2, 0, 3));
    }

    @Test
    void validate_acceptsDefaults() {
        assertThatCode(() -> validator.validate(valid())).doesNotThrowAnyException();
    }

    @ParameterizedTest
    @ValueSource(doubles = {0, 0.25, 5.3, 20.5, -1})
    void validateDimensions_rejectsBadWidth(double width) {
        TankDimensions dimensions = EngineFixtures.dimensions(width, 3, 0, 0, 0, 2);

        assertThatThrownBy(() -> validator.validateDimensions(dimensions))
                .isInstanceOf(InvalidGeometryException.class)
                .hasMessageContaining("width");
    }

    @Test
    void validateDimensions_optionalLengthsMayBeZeroButNotOffGrid() {
        assertThatCode(() -> validator.validateDimensions(EngineFixtures.dimensions(3, 3, 0, 0, 0, 2)))
                .doesNotThrowAnyException();
        assertThatThrownBy(() -> validator.validateDimensions(EngineFixtures.dimensions(3, 3, 1.2, 0, 0, 2)))
                .isInstanceOf(InvalidGeometryException.class)
                .hasMessageContaining("length2");
    }

    @ParameterizedTest
    @ValueSource(doubles = {0.5, 2.25, 5.5, 6})
    void validateDimensions_rejectsNonStandardHeight(double height) {
        assertThatThrownBy(() -> validator.validateDimensions(EngineFixtures.dimensions(3, 3, 0, 0, 0, height)))
                .isInstanceOf(InvalidGeometryException.class)
                .hasMessageContaining("height");
    }

    @Test
    void validateDimensions_rejectsZeroQuantity() {
        TankDimensions dimensions = EngineFixtures.dimensions(3, 3, 0, 0, 0, 2);
        dimensions.setQuantity(0);

        assertThatThrownBy(() -> validator.validateDimensions(dimensions))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void validateDimensions_capsBatchQuantity() {
        TankDimensions largest = EngineFixtures.dimensions(3, 3, 0, 0, 0, 2);
        largest.setQuantity(TankConfigurationValidator.MAX_TANK_QUANTITY);
        TankDimensions tooMany = EngineFixtures.dimensions(3, 3, 0, 0, 0, 2);
        tooMany.setQuantity(TankConfigurationValidator.MAX_TANK_QUANTITY + 1);

        assertThatCode(() -> validator.validateDimensions(largest)).doesNotThrowAnyException();
        assertThatThrownBy(() -> validator.validateDimensions(tooMany))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("between 1 and 1000");
    }

    @Test
    void validate_missingOptionIsUnresolved() {
        TankConfiguration config = valid().toBuilder()
                .steelOptions(SteelOptions.defaults().toBuilder().steelSkid(null).build())
                .build();

        assertThatThrownBy(() -> validator.validate(config))
                .isInstanceOf(UnresolvedOptionException.class)
                .hasMessageContaining("steel_skid");
    }

    @Test
    void validate_missingOptionGroupIsUnresolved() {
        TankConfiguration config = valid().toBuilder().panelOptions(null).build();

        assertThatThrownBy(() -> validator.validate(config))
                .isInstanceOf(UnresolvedOptionException.class)
                .hasMessageContaining("panel_options");
    }

    @Test
    void validate_ladderQuantityBounds() {
        TankConfiguration tooMany = valid().toBuilder()
                .accessoryOptions(AccessoryOptions.defaults().toBuilder().externalLadderQty(6).build())
                .build();
        TankConfiguration none = valid().toBuilder()
                .accessoryOptions(AccessoryOptions.defaults().toBuilder().internalLadderQty(0).build())
                .build();

        assertThatThrownBy(() -> validator.validate(tooMany))
                .isInstanceOf(UnresolvedOptionException.class)
                .hasMessageContaining("external_ladder_qty");
        assertThatCode(() -> validator.validate(none)).doesNotThrowAnyException();
    }

    @Test
    void validate_fittings() {
        TankConfiguration unknown = valid().toBuilder()
                .fittings(List.of(FittingItem.builder().fittingType("WXX-100A").quantity(1).build()))
                .build();
        TankConfiguration zero = valid().toBuilder()
                .fittings(List.of(FittingItem.builder().fittingType("WFL-100A").quantity(0).build()))
                .build();

        assertThatThrownBy(() -> validator.validate(unknown)).isInstanceOf(UnresolvedOptionException.class);
        assertThatThrownBy(() -> validator.validate(zero))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("WFL-100A");
    }

    @Test
    void validate_exchangeRateMustBePositive() {
        TankConfiguration config = valid().toBuilder().exchangeRate(0.0).build();

        assertThatThrownBy(() -> validator.validate(config))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Exchange rate");
    }

    @Test
    void validate_panelOptionsDefaultsPass() {
        TankConfiguration config = valid().toBuilder().panelOptions(PanelOptions.defaults()).build();

        assertThatCode(() -> validator.validate(config)).doesNotThrowAnyException();
    }
}
