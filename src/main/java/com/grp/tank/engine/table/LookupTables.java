package com.grp.tank.engine.table;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;

/**
 * The engine's constant layer, read once from a JSON document:
 * <pre>
 * {
 *   "height_multipliers": { "2.0": 1, ... },
 *   "tie_rod_lengths_mm": [ 280, ... ],
 *   "panel_codes": { "3.0": { "SIDE": "20T", ... }, ... }
 * }
 * </pre>
 */
@Slf4j
@Value
public class LookupTables {

    HeightMultiplierTable heightMultipliers;
    TieRodLengthTable tieRodLengths;
    PanelCodeTable panelCodes;

    public static LookupTables load(InputStream json) {
        JsonNode root;
        try {
            root = new ObjectMapper().readTree(json);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read lookup tables", e);
        }

        Map<Integer, Integer> multipliers = new HashMap<>();
        fields(required(root, "height_multipliers")).forEachRemaining(entry ->
                multipliers.put(HeightKey.parse(entry.getKey()), entry.getValue().asInt()));

        JsonNode lengthsNode = required(root, "tie_rod_lengths_mm");
        int[] lengths = new int[lengthsNode.size()];
        for (int i = 0; i < lengths.length; i++) {
            lengths[i] = lengthsNode.get(i).asInt();
        }

        Map<Integer, Map<PanelSlot, String>> codes = new HashMap<>();
        fields(required(root, "panel_codes")).forEachRemaining(entry -> {
            Map<PanelSlot, String> row = new EnumMap<>(PanelSlot.class);
            fields(entry.getValue()).forEachRemaining(slot ->
                    row.put(PanelSlot.valueOf(slot.getKey()), slot.getValue().asText()));
            codes.put(HeightKey.parse(entry.getKey()), row);
        });

        log.info("Loaded lookup tables: {} heights, {} tie rod lengths, {} panel code rows",
                multipliers.size(), lengths.length, codes.size());
        return new LookupTables(new HeightMultiplierTable(multipliers), new TieRodLengthTable(lengths),
                new PanelCodeTable(codes));
    }

    private static JsonNode required(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            throw new IllegalStateException("Lookup tables are missing '" + field + "'");
        }
        return node;
    }

    private static Iterator<Map.Entry<String, JsonNode>> fields(JsonNode node) {
        return node.fields();
    }
}
