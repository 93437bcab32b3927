package com.grp.tank.engine;

import com.grp.tank.domain.SteelOptions;
import com.grp.tank.domain.SteelSkidType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class SteelSkidCalculatorTest {

    private final SteelSkidCalculator calculator = new SteelSkidCalculator();

    private static SteelOptions skid(SteelSkidType type) {
        return SteelOptions.defaults().toBuilder().steelSkid(type).build();
    }

    @Test
    void calculate_angleSkidForTwoMetreTank() {
        SteelSkidResult result = calculator.calculate(EngineFixtures.geometry(5, 5, 2), SteelOptions.defaults());

        assertThat(result.getFamily()).isEqualTo(SkidFamily.ANGLE_75);
        assertThat(result.isExcepted()).isFalse();
        assertThat(result.quantityOf("WBR-7575Z")).isEqualTo(12);
        assertThat(result.quantityOf("WBR-0240Z")).isEqualTo(4);
        assertThat(result.quantityOf("WFF-1990ALZ")).isEqualTo(12);
        assertThat(result.quantityOf("WFF-0990ALZ")).isEqualTo(6);
        assertThat(result.quantityOf("WFF-2000ASZ")).isEqualTo(2);
        assertThat(result.quantityOf("WFF-1570ASZR")).isEqualTo(2);
        assertThat(result.quantityOf("WFF-1570ASZL")).isEqualTo(2);
        assertThat(result.quantityOf("WFF-0957AMZ")).isEqualTo(8);
        assertThat(result.quantityOf("WFF-1063AMZ")).isEqualTo(4);
        assertThat(result.quantityOf("WFF-0994AMZ")).isEqualTo(8);
        assertThat(result.quantityOf("LNR-3.0T")).isEqualTo(166);
        assertThat(result.quantityOf("WBR-5010Z")).isEqualTo(10);
    }

    @Test
    void calculate_largeTankUsesCentreSubFrameFactor() {
        SteelSkidResult result = calculator.calculate(EngineFixtures.geometry(10, 5, 5, 5, 0, 4),
                SteelOptions.defaults());

        assertThat(result.getFamily()).isEqualTo(SkidFamily.CHANNEL_125);
        assertThat(result.quantityOf("WBR-21590Z")).isEqualTo(8);
        assertThat(result.quantityOf("WFF-1990CLZ")).isEqualTo(77);
        assertThat(result.quantityOf("WFF-0990CLZ")).isEqualTo(11);
        assertThat(result.quantityOf("WFF-2060CSZR")).isEqualTo(2);
        assertThat(result.quantityOf("WFF-2000CSZ")).isEqualTo(6);
        assertThat(result.quantityOf("WFF-0962AMZ")).isEqualTo(28);
        assertThat(result.quantityOf("WFF-1053AMZ")).isEqualTo(14);
        assertThat(result.quantityOf("WFF-0994AMZ")).isEqualTo(98);
        assertThat(result.quantityOf("LNR-3.0T")).isEqualTo(810);
        assertThat(result.quantityOf("WBR-5010Z")).isEqualTo(50);
    }

    @ParameterizedTest(name = "width {0}")
    @CsvSource({
            "2.0, WFF-2000ASZ, 2, ",
            "2.5, WFF-1320ASZR, 2, ",
            "3.0, WFF-1570ASZR, 2, ",
            "6.5, WFF-1320ASZR, 2, 4",
            "7.0, WFF-1570ASZR, 2, 4",
            "7.5, WFF-1820ASZR, 2, 4",
            "8.0, WFF-2070ASZR, 2, 4"
    })
    void calculate_widthFramesFollowWidthParity(double width, String sideFrame, int sideQty, Integer centreQty) {
        SteelSkidResult result = calculator.calculate(EngineFixtures.geometry(width, 5, 2), SteelOptions.defaults());

        assertThat(result.quantityOf(sideFrame)).isEqualTo(sideQty);
        if (centreQty != null) {
            assertThat(result.quantityOf("WFF-2000ASZ")).isEqualTo(centreQty);
        }
    }

    @Test
    void calculate_explicitFamilyOverridesHeight() {
        SteelSkidResult result = calculator.calculate(EngineFixtures.geometry(5, 5, 2), skid(SteelSkidType.CHANNEL_150));

        assertThat(result.getFamily()).isEqualTo(SkidFamily.CHANNEL_150);
        assertThat(result.quantityOf("WBR-0150Z")).isEqualTo(12);
        assertThat(result.quantityOf("WFF-1990HCLZ")).isEqualTo(12);
        assertThat(result.quantityOf("WFF-1560HCSZL")).isEqualTo(2);
    }

    @Test
    void calculate_tallTankDoublesAnchorBrackets() {
        SteelSkidResult result = calculator.calculate(EngineFixtures.geometry(5, 5, 4.5), SteelOptions.defaults());

        assertThat(result.getFamily()).isEqualTo(SkidFamily.CHANNEL_150);
        assertThat(result.quantityOf("WBR-5010Z")).isEqualTo(20);
    }

    @Test
    void calculate_exceptSkidKeepsLinesAtZero() {
        SteelSkidResult result = calculator.calculate(EngineFixtures.geometry(5, 5, 2), skid(SteelSkidType.EXCEPT_SKB));

        assertThat(result.isExcepted()).isTrue();
        assertThat(result.retainsZeroLines()).isTrue();
        assertThat(result.getParts()).hasSize(12);
        assertThat(result.getParts()).allMatch(part -> part.getQuantity() == 0);
        assertThat(result.getParts()).extracting(PartQuantity::getPartNo)
                .contains("WBR-7575Z", "LNR-3.0T", "WFF-1570ASZR");
    }

    @Test
    void linerQuantity_roundsUp() {
        assertThat(SteelSkidCalculator.linerQuantity(5, 5)).isEqualTo(166);
        assertThat(SteelSkidCalculator.linerQuantity(10, 15)).isEqualTo(810);
        assertThat(SteelSkidCalculator.linerQuantity(10, 8)).isEqualTo(456);
    }

    @Test
    void resolve_defaultFamilyByHeight() {
        assertThat(SkidFamily.resolve(SteelSkidType.DEFAULT, 2.5)).isEqualTo(SkidFamily.ANGLE_75);
        assertThat(SkidFamily.resolve(SteelSkidType.DEFAULT, 3.0)).isEqualTo(SkidFamily.CHANNEL_125);
        assertThat(SkidFamily.resolve(SteelSkidType.DEFAULT, 4.0)).isEqualTo(SkidFamily.CHANNEL_125);
        assertThat(SkidFamily.resolve(SteelSkidType.DEFAULT, 4.5)).isEqualTo(SkidFamily.CHANNEL_150);
        assertThat(SkidFamily.resolve(SteelSkidType.EXCEPT_SKB, 3.0)).isEqualTo(SkidFamily.CHANNEL_125);
        assertThat(SkidFamily.resolve(SteelSkidType.ANGLE_75, 5.0)).isEqualTo(SkidFamily.ANGLE_75);
    }
}
