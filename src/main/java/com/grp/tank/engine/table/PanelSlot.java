package com.grp.tank.engine.table;

/**
 * Structural position of a height-dependent panel code.
 */
public enum PanelSlot {
    SIDE,            // side panel suffix, prefixed SF or SL by option
    BOTTOM,          // bottom panel suffix shared by BF/BH/BQ
    DRAIN,
    SIDE_HALF,
    SIDE_MID,        // only for tanks with a middle side tier
    SIDE_LOW,        // only for multi-tier tanks
    PARTITION_TOP,
    PARTITION_MID,
    PARTITION_LOW
}
