package com.grp.tank;

import com.grp.tank.catalog.PriceWeightCatalog;
import com.grp.tank.config.TankBomProperties;
import com.grp.tank.engine.table.LookupTables;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {"tank.bom.demo.enabled=true", "tank.bom.local-currency=AED"})
@ExtendWith(OutputCaptureExtension.class)
class TankBomApplicationTest {

    @Autowired
    private TankBomProperties properties;

    @Autowired
    private PriceWeightCatalog catalog;

    @Autowired
    private LookupTables tables;

    @Autowired
    private DemoRunner demoRunner;

    @Test
    void context_loadsBundledData() {
        assertThat(properties.getLocalCurrency()).isEqualTo("AED");
        assertThat(properties.getSpareFactor()).isEqualByComparingTo("1.00");
        assertThat(catalog.size()).isEqualTo(339);
        assertThat(tables.getHeightMultipliers().supports(3.5)).isTrue();
    }

    @Test
    void demoRunner_printsReferenceBom(CapturedOutput output) {
        demoRunner.run();

        assertThat(output.getOut())
                .contains("10 x (4+2+2) x 3 m")
                .contains("MF00M")
                .contains("Steel Skid")
                .contains("AED");
    }
}
