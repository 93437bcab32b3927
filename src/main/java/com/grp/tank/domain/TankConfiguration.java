package com.grp.tank.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Validated input of one BOM calculation.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class TankConfiguration {
    private TankDimensions dimensions;
    private PanelOptions panelOptions;
    private SteelOptions steelOptions;
    private AccessoryOptions accessoryOptions;
    @Builder.Default
    private List<FittingItem> fittings = new ArrayList<>();
    private Double exchangeRate; // USD to local currency, null means configured default
    private OrderInfo orderInfo;
}
