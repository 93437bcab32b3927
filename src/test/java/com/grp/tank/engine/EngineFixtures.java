package com.grp.tank.engine;

import com.grp.tank.catalog.JsonPriceWeightCatalog;
import com.grp.tank.catalog.PriceWeightCatalog;
import com.grp.tank.config.TankBomProperties;
import com.grp.tank.domain.AccessoryOptions;
import com.grp.tank.domain.PanelOptions;
import com.grp.tank.domain.SteelOptions;
import com.grp.tank.domain.TankConfiguration;
import com.grp.tank.domain.TankDimensions;
import com.grp.tank.engine.table.LookupTables;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

/**
 * Engine wiring for tests that run without a Spring context. Tables and catalog come from the bundled resources.
 */
public final class EngineFixtures {

    private static LookupTables tables;
    private static PriceWeightCatalog catalog;

    private EngineFixtures() {
    }

    public static synchronized LookupTables tables() {
        if (tables == null) {
            try (InputStream in = open("/data/lookup-tables.json")) {
                tables = LookupTables.load(in);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }
        return tables;
    }

    public static synchronized PriceWeightCatalog catalog() {
        if (catalog == null) {
            try (InputStream in = open("/data/catalog.json")) {
                catalog = JsonPriceWeightCatalog.load(in);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }
        return catalog;
    }

    public static TankBomEngine engine() {
        return engine(new TankBomProperties());
    }

    public static TankBomEngine engine(TankBomProperties properties) {
        LookupTables t = tables();
        return new TankBomEngine(
                new DimensionDecomposer(),
                new PanelCalculator(t),
                new SteelSkidCalculator(),
                new TieRodCalculator(t),
                new ReinforcingCalculator(),
                new BoltsCalculator(properties),
                new EtcCalculator(),
                new FittingsResolver(),
                new CapacityCalculator(),
                new FittingRecommender(),
                new BomAssembler(catalog(), properties));
    }

    public static TankDimensions dimensions(double width, double length1, double length2, double length3,
                                            double length4, double height) {
        return TankDimensions.builder()
                .width(width)
                .length1(length1)
                .length2(length2)
                .length3(length3)
                .length4(length4)
                .height(height)
                .quantity(1)
                .build();
    }

    public static TankGeometry geometry(double width, double length1, double height) {
        return geometry(width, length1, 0, 0, 0, height);
    }

    public static TankGeometry geometry(double width, double length1, double length2, double length3,
                                        double length4, double height) {
        return new DimensionDecomposer().geometryOf(dimensions(width, length1, length2, length3, length4, height));
    }

    /** Configuration with every option group at its default and the default exchange rate. */
    public static TankConfiguration configuration(TankDimensions dimensions) {
        return TankConfiguration.builder()
                .dimensions(dimensions)
                .panelOptions(PanelOptions.defaults())
                .steelOptions(SteelOptions.defaults())
                .accessoryOptions(AccessoryOptions.defaults())
                .exchangeRate(3.75)
                .build();
    }

    private static InputStream open(String resource) {
        InputStream in = EngineFixtures.class.getResourceAsStream(resource);
        if (in == null) {
            throw new IllegalStateException("Missing test resource " + resource);
        }
        return in;
    }
}
