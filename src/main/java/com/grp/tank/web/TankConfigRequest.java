package com.grp.tank.web;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.grp.tank.domain.AccessoryOptions;
import com.grp.tank.domain.BoltsNutsOption;
import com.grp.tank.domain.ExternalLadderMaterial;
import com.grp.tank.domain.FittingItem;
import com.grp.tank.domain.InsulationType;
import com.grp.tank.domain.InternalLadderMaterial;
import com.grp.tank.domain.InternalMaterial;
import com.grp.tank.domain.LevelIndicator;
import com.grp.tank.domain.OrderInfo;
import com.grp.tank.domain.PanelOptions;
import com.grp.tank.domain.ProductType;
import com.grp.tank.domain.ReinforcingType;
import com.grp.tank.domain.SteelOptions;
import com.grp.tank.domain.SteelSkidType;
import com.grp.tank.domain.TankConfiguration;
import com.grp.tank.domain.TieRodMaterial;
import com.grp.tank.domain.TieRodSpec;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Wire form of a BOM request. Options travel as their display labels; every group may be omitted.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TankConfigRequest {
    private OrderInfo orderInfo;
    @Valid
    @NotNull
    private DimensionsRequest dimensions;
    private PanelOptionsRequest panelOptions = new PanelOptionsRequest();
    private SteelOptionsRequest steelOptions = new SteelOptionsRequest();
    private AccessoryOptionsRequest accessoryOptions = new AccessoryOptionsRequest();
    private List<FittingItem> fittings = new ArrayList<>();
    private Double exchangeRate; // null: configured default

    public TankConfiguration toConfiguration() {
        return TankConfiguration.builder()
                .dimensions(dimensions.toDimensions())
                .panelOptions(panelOptions == null ? null : panelOptions.toOptions())
                .steelOptions(steelOptions == null ? null : steelOptions.toOptions())
                .accessoryOptions(accessoryOptions == null ? null : accessoryOptions.toOptions())
                .fittings(fittings == null ? new ArrayList<>() : fittings)
                .exchangeRate(exchangeRate)
                .orderInfo(orderInfo)
                .build();
    }

    @Data
    @NoArgsConstructor
    public static class PanelOptionsRequest {
        private String productType = ProductType.MNT.getLabel();
        private String insulation = InsulationType.NON_INSULATED.getLabel();
        @JsonProperty("use_side_panel_1x1")
        private boolean useSidePanel1x1;
        @JsonProperty("use_partition_panel_1x1")
        private boolean usePartitionPanel1x1;

        PanelOptions toOptions() {
            return PanelOptions.builder()
                    .productType(ProductType.fromLabel(productType))
                    .insulation(InsulationType.fromLabel(insulation))
                    .useSidePanel1x1(useSidePanel1x1)
                    .usePartitionPanel1x1(usePartitionPanel1x1)
                    .build();
        }
    }

    @Data
    @NoArgsConstructor
    public static class SteelOptionsRequest {
        private String reinforcingType = ReinforcingType.INTERNAL.getLabel();
        private String steelSkid = SteelSkidType.DEFAULT.getLabel();
        private String internalMaterial = InternalMaterial.SS316.getLabel();
        private String boltsNuts = BoltsNutsOption.EXT_HDG_INT_SS316.getLabel();
        private String tieRodMaterial = TieRodMaterial.SS316.getLabel();
        private String tieRodSpec = TieRodSpec.M12.getLabel();

        SteelOptions toOptions() {
            return SteelOptions.builder()
                    .reinforcingType(ReinforcingType.fromLabel(reinforcingType))
                    .steelSkid(SteelSkidType.fromLabel(steelSkid))
                    .internalMaterial(InternalMaterial.fromLabel(internalMaterial))
                    .boltsNuts(BoltsNutsOption.fromLabel(boltsNuts))
                    .tieRodMaterial(TieRodMaterial.fromLabel(tieRodMaterial))
                    .tieRodSpec(TieRodSpec.fromLabel(tieRodSpec))
                    .build();
        }
    }

    @Data
    @NoArgsConstructor
    public static class AccessoryOptionsRequest {
        private String levelIndicator = LevelIndicator.GENERAL.getLabel();
        private String internalLadderMaterial = InternalLadderMaterial.GRP.getLabel();
        private int internalLadderQty = AccessoryOptions.DEFAULT_QUANTITY;
        private String externalLadderMaterial = ExternalLadderMaterial.HDG.getLabel();
        private int externalLadderQty = AccessoryOptions.DEFAULT_QUANTITY;

        AccessoryOptions toOptions() {
            return AccessoryOptions.builder()
                    .levelIndicator(LevelIndicator.fromLabel(levelIndicator))
                    .internalLadderMaterial(InternalLadderMaterial.fromLabel(internalLadderMaterial))
                    .internalLadderQty(internalLadderQty)
                    .externalLadderMaterial(ExternalLadderMaterial.fromLabel(externalLadderMaterial))
                    .externalLadderQty(externalLadderQty)
                    .build();
        }
    }
}
