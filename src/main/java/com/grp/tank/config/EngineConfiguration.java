package com.grp.tank.config;

import com.grp.tank.catalog.JsonPriceWeightCatalog;
import com.grp.tank.catalog.PriceWeightCatalog;
import com.grp.tank.engine.table.LookupTables;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

/**
 * Lookup tables and the price catalog, read once at startup and shared read-only by every calculation.
 */
@Configuration(proxyBeanMethods = false)
public class EngineConfiguration {

    @Bean
    public LookupTables lookupTables(TankBomProperties properties, ResourceLoader resourceLoader) {
        try (InputStream in = open(resourceLoader, properties.getLookupTablesLocation())) {
            return LookupTables.load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot open lookup tables at " + properties.getLookupTablesLocation(), e);
        }
    }

    @Bean
    public PriceWeightCatalog priceWeightCatalog(TankBomProperties properties, ResourceLoader resourceLoader) {
        try (InputStream in = open(resourceLoader, properties.getCatalogLocation())) {
            return JsonPriceWeightCatalog.load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot open price catalog at " + properties.getCatalogLocation(), e);
        }
    }

    private static InputStream open(ResourceLoader resourceLoader, String location) throws IOException {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new IllegalStateException("Resource not found: " + location);
        }
        return resource.getInputStream();
    }
}
