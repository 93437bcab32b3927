package com.grp.tank.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AccessoryOptions {

    /** Ladder quantity meaning "derive it from the tank". */
    public static final int DEFAULT_QUANTITY = -1;

    private LevelIndicator levelIndicator;
    private InternalLadderMaterial internalLadderMaterial;
    @Builder.Default
    private int internalLadderQty = DEFAULT_QUANTITY;
    private ExternalLadderMaterial externalLadderMaterial;
    @Builder.Default
    private int externalLadderQty = DEFAULT_QUANTITY;

    public static AccessoryOptions defaults() {
        return AccessoryOptions.builder()
                .levelIndicator(LevelIndicator.GENERAL)
                .internalLadderMaterial(InternalLadderMaterial.GRP)
                .externalLadderMaterial(ExternalLadderMaterial.HDG)
                .build();
    }
}
