package com.grp.tank.engine;

import com.grp.tank.domain.SteelSkidType;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Steel section family of the skid, with the part-number fragments that vary by section.
 */
@Getter
@RequiredArgsConstructor
public enum SkidFamily {
    ANGLE_75("AL", "AS", "WBR-7575Z", "WBR-0240Z", "WFF-0957AMZ", "WFF-1063AMZ", 70),
    CHANNEL_125("CL", "CS", "WBR-0120Z", "WBR-21590Z", "WFF-0962AMZ", "WFF-1053AMZ", 60),
    CHANNEL_150("HCL", "HCS", "WBR-0150Z", "WBR-22310Z", "WFF-0962AMZ", "WFF-1053AMZ", 60);

    private final String longSuffix;
    private final String shortSuffix;
    private final String mainConnector;
    private final String crossConnector;
    private final String sideSubFrame;
    private final String cornerSubFrame;
    private final int sideFrameOverhangMm; // added to the nominal width-frame length

    /**
     * Family for a skid option. "Default" and "Except SKB" both resolve by tank height.
     */
    public static SkidFamily resolve(SteelSkidType type, double height) {
        switch (type) {
            case ANGLE_75:
                return ANGLE_75;
            case CHANNEL_125:
                return CHANNEL_125;
            case CHANNEL_150:
                return CHANNEL_150;
            default:
                if (height > 4.3) {
                    return CHANNEL_150;
                }
                return height > 2.5 ? CHANNEL_125 : ANGLE_75;
        }
    }
}
