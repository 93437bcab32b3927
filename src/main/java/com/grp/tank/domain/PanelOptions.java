package com.grp.tank.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PanelOptions {
    private ProductType productType;
    private InsulationType insulation;
    private boolean useSidePanel1x1;      // SF (1x1) instead of SL (1x2) side panels
    private boolean usePartitionPanel1x1; // same choice for partition walls

    public static PanelOptions defaults() {
        return PanelOptions.builder()
                .productType(ProductType.MNT)
                .insulation(InsulationType.NON_INSULATED)
                .build();
    }
}
