package com.grp.tank.service;

import com.grp.tank.domain.AccessoryOptions;
import com.grp.tank.domain.FittingItem;
import com.grp.tank.domain.PanelOptions;
import com.grp.tank.domain.SteelOptions;
import com.grp.tank.domain.TankConfiguration;
import com.grp.tank.domain.TankDimensions;
import com.grp.tank.engine.FittingType;
import com.grp.tank.engine.table.LookupTables;
import com.grp.tank.error.InvalidGeometryException;
import com.grp.tank.error.UnresolvedOptionException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Rejects configurations the engine does not accept, before any calculator runs.
 */
@Component
@RequiredArgsConstructor
public class TankConfigurationValidator {

    static final double MIN_SPAN = 0.5;
    static final double MAX_SPAN = 20.0;
    static final int MIN_LADDER_QTY = -1;
    static final int MAX_LADDER_QTY = 5;
    static final int MAX_TANK_QUANTITY = 1000; // keeps batch line quantities within int range

    private final LookupTables tables;

    public void validate(TankConfiguration config) {
        validateDimensions(config.getDimensions());
        validatePanelOptions(config.getPanelOptions());
        validateSteelOptions(config.getSteelOptions());
        validateAccessoryOptions(config.getAccessoryOptions());
        if (config.getFittings() != null) {
            config.getFittings().forEach(this::validateFitting);
        }
        if (config.getExchangeRate() == null || !(config.getExchangeRate() > 0)) {
            throw new IllegalArgumentException("Exchange rate must be positive");
        }
    }

    public void validateDimensions(TankDimensions dimensions) {
        if (dimensions == null) {
            throw new IllegalArgumentException("Dimensions cannot be null");
        }
        span("width", dimensions.getWidth(), false);
        span("length1", dimensions.getLength1(), false);
        span("length2", dimensions.getLength2(), true);
        span("length3", dimensions.getLength3(), true);
        span("length4", dimensions.getLength4(), true);
        if (!tables.getHeightMultipliers().supports(dimensions.getHeight())) {
            throw new InvalidGeometryException("height", dimensions.getHeight(),
                    "must be one of " + tables.getHeightMultipliers().heights());
        }
        if (dimensions.getQuantity() < 1 || dimensions.getQuantity() > MAX_TANK_QUANTITY) {
            throw new IllegalArgumentException("Tank quantity must be between 1 and " + MAX_TANK_QUANTITY);
        }
    }

    private static void span(String field, double value, boolean optional) {
        if (optional && value == 0) {
            return;
        }
        if (Double.isNaN(value) || value < MIN_SPAN || value > MAX_SPAN) {
            throw new InvalidGeometryException(field, value, "must be between " + MIN_SPAN + " and " + MAX_SPAN);
        }
        if (value * 2 != Math.rint(value * 2)) {
            throw new InvalidGeometryException(field, value, "must be a multiple of 0.5");
        }
    }

    private static void validatePanelOptions(PanelOptions options) {
        required("panel_options", options);
        required("product_type", options.getProductType());
        required("insulation", options.getInsulation());
    }

    private static void validateSteelOptions(SteelOptions options) {
        required("steel_options", options);
        required("reinforcing_type", options.getReinforcingType());
        required("steel_skid", options.getSteelSkid());
        required("internal_material", options.getInternalMaterial());
        required("bolts_nuts", options.getBoltsNuts());
        required("tie_rod_material", options.getTieRodMaterial());
        required("tie_rod_spec", options.getTieRodSpec());
    }

    private static void validateAccessoryOptions(AccessoryOptions options) {
        required("accessory_options", options);
        required("level_indicator", options.getLevelIndicator());
        required("internal_ladder_material", options.getInternalLadderMaterial());
        required("external_ladder_material", options.getExternalLadderMaterial());
        ladderQuantity("internal_ladder_qty", options.getInternalLadderQty());
        ladderQuantity("external_ladder_qty", options.getExternalLadderQty());
    }

    private void validateFitting(FittingItem item) {
        if (item.getFittingType() == null || FittingType.describe(item.getFittingType()).isEmpty()) {
            throw new UnresolvedOptionException("fitting_type", item.getFittingType());
        }
        if (item.getQuantity() <= 0) {
            throw new IllegalArgumentException("Fitting quantity must be positive: " + item.getFittingType());
        }
    }

    private static void ladderQuantity(String option, int quantity) {
        if (quantity < MIN_LADDER_QTY || quantity > MAX_LADDER_QTY) {
            throw new UnresolvedOptionException(option, String.valueOf(quantity),
                    "must be between " + MIN_LADDER_QTY + " and " + MAX_LADDER_QTY);
        }
    }

    private static void required(String option, Object value) {
        if (value == null) {
            throw new UnresolvedOptionException(option, null, "a value is required");
        }
    }
}
