package com.grp.tank.service;

import com.grp.tank.catalog.CatalogEntry;
import com.grp.tank.catalog.CatalogPage;
import com.grp.tank.catalog.PriceWeightCatalog;
import com.grp.tank.config.TankBomProperties;
import com.grp.tank.domain.AccessoryOptions;
import com.grp.tank.domain.BoltsNutsOption;
import com.grp.tank.domain.BomResult;
import com.grp.tank.domain.CapacitySummary;
import com.grp.tank.domain.ExternalLadderMaterial;
import com.grp.tank.domain.InsulationType;
import com.grp.tank.domain.InternalLadderMaterial;
import com.grp.tank.domain.InternalMaterial;
import com.grp.tank.domain.LevelIndicator;
import com.grp.tank.domain.OptionLabel;
import com.grp.tank.domain.PanelOptions;
import com.grp.tank.domain.ProductType;
import com.grp.tank.domain.RecommendedFitting;
import com.grp.tank.domain.ReinforcingType;
import com.grp.tank.domain.SteelOptions;
import com.grp.tank.domain.SteelSkidType;
import com.grp.tank.domain.TankConfiguration;
import com.grp.tank.domain.TankDimensions;
import com.grp.tank.domain.TankOptions;
import com.grp.tank.domain.TieRodMaterial;
import com.grp.tank.domain.TieRodSpec;
import com.grp.tank.engine.FittingType;
import com.grp.tank.engine.TankBomEngine;
import com.grp.tank.engine.table.LookupTables;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Service
@RequiredArgsConstructor
public class TankBomService {

    private final TankBomEngine engine;
    private final TankConfigurationValidator validator;
    private final PriceWeightCatalog catalog;
    private final LookupTables tables;
    private final TankBomProperties properties;

    public BomResult calculate(TankConfiguration config) {
        if (config == null) {
            throw new IllegalArgumentException("Configuration cannot be null");
        }
        // Fallback to defaults for missing option groups
        TankConfiguration resolved = config.toBuilder()
                .panelOptions(config.getPanelOptions() != null ? config.getPanelOptions() : PanelOptions.defaults())
                .steelOptions(config.getSteelOptions() != null ? config.getSteelOptions() : SteelOptions.defaults())
                .accessoryOptions(config.getAccessoryOptions() != null
                        ? config.getAccessoryOptions() : AccessoryOptions.defaults())
                .fittings(config.getFittings() != null ? config.getFittings() : new ArrayList<>())
                .exchangeRate(config.getExchangeRate() != null
                        ? config.getExchangeRate() : properties.getDefaultExchangeRate().doubleValue())
                .build();
        validator.validate(resolved);
        return engine.calculate(resolved);
    }

    public CapacitySummary capacity(TankDimensions dimensions) {
        validator.validateDimensions(dimensions);
        return engine.capacity(dimensions);
    }

    public List<RecommendedFitting> recommendFittings(TankDimensions dimensions) {
        validator.validateDimensions(dimensions);
        return engine.recommendFittings(dimensions);
    }

    public CatalogEntry findPart(String partNo) {
        return catalog.resolve(partNo);
    }

    public CatalogPage listParts(int skip, int limit) {
        if (skip < 0 || limit < 1) {
            throw new IllegalArgumentException("skip must be >= 0 and limit >= 1");
        }
        return CatalogPage.of(catalog, skip, limit);
    }

    public TankOptions options() {
        return TankOptions.builder()
                .productTypes(OptionLabel.labels(ProductType.class))
                .insulationTypes(OptionLabel.labels(InsulationType.class))
                .reinforcingTypes(OptionLabel.labels(ReinforcingType.class))
                .steelSkidTypes(OptionLabel.labels(SteelSkidType.class))
                .internalMaterials(OptionLabel.labels(InternalMaterial.class))
                .boltsNutsOptions(OptionLabel.labels(BoltsNutsOption.class))
                .tieRodMaterials(OptionLabel.labels(TieRodMaterial.class))
                .tieRodSpecs(OptionLabel.labels(TieRodSpec.class))
                .levelIndicators(OptionLabel.labels(LevelIndicator.class))
                .ladderMaterialsInternal(OptionLabel.labels(InternalLadderMaterial.class))
                .ladderMaterialsExternal(OptionLabel.labels(ExternalLadderMaterial.class))
                .fittingTypes(FittingType.allPartNumbers())
                .availableHeights(tables.getHeightMultipliers().heights())
                .build();
    }
}
