package com.grp.tank.engine;

import com.grp.tank.domain.BoltsNutsOption;
import com.grp.tank.error.UnresolvedOptionException;
import lombok.Value;

/**
 * External, internal and reinforcing fastener grades parsed from a combined option label such as
 * {@code EXT:HDG/INT:SS304+R/F:HDG}. Both "Except" options select no fasteners at all.
 */
@Value
public class BoltMaterialSelection {

    private static final String EXTERNAL = "EXT:";
    private static final String INTERNAL = "/INT:";
    private static final String REINFORCING = "+R/F:";

    BoltMaterial external;    // null when fasteners are excluded
    BoltMaterial internal;
    BoltMaterial reinforcing; // null unless the label names it

    public boolean isExcluded() {
        return external == null && internal == null;
    }

    public static BoltMaterialSelection parse(BoltsNutsOption option) {
        String label = option.getLabel();
        if (label.startsWith("Except")) {
            return new BoltMaterialSelection(null, null, null);
        }
        int internalAt = label.indexOf(INTERNAL);
        if (!label.startsWith(EXTERNAL) || internalAt < 0) {
            throw new UnresolvedOptionException("bolts_nuts", label, "expected EXT:<grade>/INT:<grade>");
        }
        BoltMaterial external = BoltMaterial.fromGrade(label.substring(EXTERNAL.length(), internalAt));

        String internalPart = label.substring(internalAt + INTERNAL.length());
        BoltMaterial reinforcing = null;
        int reinforcingAt = internalPart.indexOf(REINFORCING);
        if (reinforcingAt >= 0) {
            reinforcing = BoltMaterial.fromGrade(internalPart.substring(reinforcingAt + REINFORCING.length()));
            internalPart = internalPart.substring(0, reinforcingAt);
        }
        return new BoltMaterialSelection(external, BoltMaterial.fromGrade(internalPart), reinforcing);
    }
}
