package com.grp.tank.domain;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Every value the configurator accepts, for building input forms.
 */
@Value
@Builder
public class TankOptions {
    List<String> productTypes;
    List<String> insulationTypes;
    List<String> reinforcingTypes;
    List<String> steelSkidTypes;
    List<String> internalMaterials;
    List<String> boltsNutsOptions;
    List<String> tieRodMaterials;
    List<String> tieRodSpecs;
    List<String> levelIndicators;
    List<String> ladderMaterialsInternal;
    List<String> ladderMaterialsExternal;
    List<String> fittingTypes;
    List<Double> availableHeights;
}
