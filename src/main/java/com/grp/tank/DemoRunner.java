package com.grp.tank;

import com.grp.tank.domain.AccessoryOptions;
import com.grp.tank.domain.BomLineItem;
import com.grp.tank.domain.BomResult;
import com.grp.tank.domain.CapacitySummary;
import com.grp.tank.domain.PanelOptions;
import com.grp.tank.domain.SteelOptions;
import com.grp.tank.domain.TankConfiguration;
import com.grp.tank.domain.TankDimensions;
import com.grp.tank.service.TankBomService;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Prints the BOM of a reference partitioned tank at startup ({@code tank.bom.demo.enabled=true}).
 */
@Component
@ConditionalOnProperty(prefix = "tank.bom.demo", name = "enabled", havingValue = "true")
public class DemoRunner implements CommandLineRunner {

    private final TankBomService service;

    public DemoRunner(TankBomService service) {
        this.service = service;
    }

    @Override
    public void run(String... args) {
        System.out.println("=== GRP TANK BOM DEMO: 10 x (4+2+2) x 3 m, two partitions ===");

        TankConfiguration config = TankConfiguration.builder()
                .dimensions(TankDimensions.builder()
                        .width(10).length1(4).length2(2).length3(2).height(3)
                        .quantity(1)
                        .build())
                .panelOptions(PanelOptions.defaults())
                .steelOptions(SteelOptions.defaults())
                .accessoryOptions(AccessoryOptions.defaults())
                .build();

        BomResult result = service.calculate(config);

        CapacitySummary capacity = result.getCapacity();
        System.out.printf("Capacity: %s m3 nominal, %s m3 actual, %s m2 surface%n",
                capacity.getNominalCapacityM3(), capacity.getActualCapacityM3(), capacity.getSurfaceAreaM2());

        System.out.println("\n--- BILL OF MATERIALS ---");
        for (BomLineItem line : result.getBom()) {
            System.out.printf("%-22s %-16s %6d  %10s USD%n",
                    line.getCategory().getLabel(), line.getPartNo(), line.getQuantity(), line.getTotalPriceUsd());
        }

        System.out.println("\n--- COST BY CATEGORY ---");
        result.getCostSummary().getByCategory().forEach((category, usd) ->
                System.out.printf("%-22s %12s USD%n", category, usd));
        System.out.printf("Total: %s USD / %s %s%n", result.getCostSummary().getTotalUsd(),
                result.getCostSummary().getTotalLocal(), result.getCostSummary().getLocalCurrency());
        System.out.printf("Weight: %s kg%n", result.getWeightSummary().getTotalKg());
    }
}
