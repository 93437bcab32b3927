package com.grp.tank.catalog;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Catalog read from the bundled price sheet export:
 * <pre>
 * { "parts": [ { "part_no": "MF00M", "name": "Manhole Panel", "price_usd": 61.2, "weight_kg": 14.5 }, ... ] }
 * </pre>
 */
@Slf4j
public class JsonPriceWeightCatalog implements PriceWeightCatalog {

    private final Map<String, CatalogEntry> entries;

    public JsonPriceWeightCatalog(Map<String, CatalogEntry> entries) {
        this.entries = Collections.unmodifiableMap(new TreeMap<>(entries));
    }

    public static JsonPriceWeightCatalog load(InputStream json) {
        JsonNode root;
        try {
            root = new ObjectMapper()
                    .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
                    .readTree(json);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read price catalog", e);
        }
        JsonNode parts = root.get("parts");
        if (parts == null || !parts.isArray()) {
            throw new IllegalStateException("Price catalog is missing the 'parts' array");
        }

        Map<String, CatalogEntry> entries = new TreeMap<>();
        for (JsonNode part : parts) {
            String partNo = part.path("part_no").asText();
            if (partNo.isEmpty()) {
                throw new IllegalStateException("Price catalog entry without part_no: " + part);
            }
            CatalogEntry entry = new CatalogEntry(
                    partNo,
                    part.path("name").asText(partNo),
                    part.path("price_usd").decimalValue(),
                    part.path("weight_kg").decimalValue());
            if (entries.put(partNo, entry) != null) {
                throw new IllegalStateException("Duplicate part in price catalog: " + partNo);
            }
        }
        log.info("Loaded price catalog with {} parts", entries.size());
        return new JsonPriceWeightCatalog(entries);
    }

    @Override
    public Optional<CatalogEntry> find(String partNo) {
        return Optional.ofNullable(entries.get(partNo));
    }

    @Override
    public List<CatalogEntry> entries() {
        return new ArrayList<>(entries.values());
    }

    @Override
    public int size() {
        return entries.size();
    }
}
