package com.grp.tank.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SteelOptions {
    private ReinforcingType reinforcingType;
    private SteelSkidType steelSkid;
    private InternalMaterial internalMaterial;
    private BoltsNutsOption boltsNuts;
    private TieRodMaterial tieRodMaterial;
    private TieRodSpec tieRodSpec;

    public static SteelOptions defaults() {
        return SteelOptions.builder()
                .reinforcingType(ReinforcingType.INTERNAL)
                .steelSkid(SteelSkidType.DEFAULT)
                .internalMaterial(InternalMaterial.SS316)
                .boltsNuts(BoltsNutsOption.EXT_HDG_INT_SS316)
                .tieRodMaterial(TieRodMaterial.SS316)
                .tieRodSpec(TieRodSpec.M12)
                .build();
    }
}
