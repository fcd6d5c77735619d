package com.buildingsync.loader.impl;

import com.buildingsync.exception.MalformedPayloadException;
import com.buildingsync.loader.BuildingRecordParser;
import com.buildingsync.loader.GeometryExtractor;
import com.buildingsync.model.Building;
import com.buildingsync.model.EnergySummary;
import com.buildingsync.model.ParsedPayload;
import com.buildingsync.model.RgbColor;
import com.buildingsync.model.SyncWarning;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Parser for the buildings-energy payload: a JSON array of records or an object
 * with a {@code results} array.
 */
@Component
public class BuildingRecordParserImpl implements BuildingRecordParser {
    
    private static final Logger logger = LoggerFactory.getLogger(BuildingRecordParserImpl.class);
    
    static final String PRIMARY_KEY_FIELD = "modified_gml_id";
    static final String SECONDARY_KEY_FIELD = "gml_id";
    static final String ENERGY_FIELD = "energy_demand_specific";
    static final String CO2_FIELD = "co2_from_energy_demand";
    static final String COLOR_FIELD = "energy_demand_specific_color";
    
    private static final String[] ENERGY_CONTAINERS = {"energy_result", "energy_data", "result"};
    private static final double KG_PER_TONNE = 1000.0;
    
    private final ObjectMapper objectMapper;
    
    // Sorted map keys give a canonical snapshot independent of field order
    private final ObjectMapper canonicalMapper;
    
    private final GeometryExtractor geometryExtractor;
    
    public BuildingRecordParserImpl(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.canonicalMapper = objectMapper.copy().enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
        this.geometryExtractor = new GeometryExtractor(objectMapper);
    }
    
    @Override
    public ParsedPayload parse(String payload) throws MalformedPayloadException {
        if (payload == null || payload.isBlank()) {
            throw new MalformedPayloadException("Empty payload");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new MalformedPayloadException("Payload is not valid JSON: " + e.getOriginalMessage(), e);
        }
        
        JsonNode records;
        if (root != null && root.isArray()) {
            records = root;
        } else if (root != null && root.isObject() && root.has("results") && root.get("results").isArray()) {
            records = root.get("results");
        } else {
            throw new MalformedPayloadException("Payload is neither an array nor an object with a results array");
        }
        
        long now = System.currentTimeMillis();
        List<Building> buildings = new ArrayList<>(records.size());
        List<SyncWarning> warnings = new ArrayList<>();
        int index = 0;
        for (JsonNode record : records) {
            try {
                parseRecord(record, index, now, warnings).ifPresent(buildings::add);
            } catch (RuntimeException e) {
                warnings.add(SyncWarning.of(SyncWarning.Kind.MALFORMED_RECORD, textOrNull(record, PRIMARY_KEY_FIELD),
                        index, "Unreadable record: " + e.getMessage()));
            }
            index++;
        }
        
        for (SyncWarning warning : warnings) {
            logger.warn("Record {} ({}): {} - {}", warning.getRecordIndex(), warning.getKey(),
                    warning.getKind(), warning.getMessage());
        }
        return new ParsedPayload(records.size(), Collections.unmodifiableList(buildings),
                Collections.unmodifiableList(warnings));
    }
    
    private Optional<Building> parseRecord(JsonNode record, int index, long timestamp, List<SyncWarning> warnings) {
        if (record == null || !record.isObject()) {
            warnings.add(SyncWarning.of(SyncWarning.Kind.MALFORMED_RECORD, null, index, "Record is not an object"));
            return Optional.empty();
        }
        String primaryKey = textOrNull(record, PRIMARY_KEY_FIELD);
        if (primaryKey == null || primaryKey.isBlank()) {
            warnings.add(SyncWarning.of(SyncWarning.Kind.MALFORMED_RECORD, textOrNull(record, SECONDARY_KEY_FIELD),
                    index, "Missing " + PRIMARY_KEY_FIELD));
            return Optional.empty();
        }
        String secondaryKey = textOrNull(record, SECONDARY_KEY_FIELD);
        if (secondaryKey != null && secondaryKey.isBlank()) {
            secondaryKey = null;
        }
        
        JsonNode container = energyContainer(record);
        JsonNode end = firstObject(container, "end", "after");
        JsonNode begin = firstObject(container, "begin", "before");
        JsonNode endResult = resultOf(end);
        JsonNode beginResult = resultOf(begin);
        
        Double energyValue = valueOf(endResult, ENERGY_FIELD);
        
        String colorToken = colorToken(end);
        String colorHex = RgbColor.MID_GRAY.toHex();
        RgbColor color = RgbColor.MID_GRAY;
        if (colorToken != null) {
            Optional<String> canonical = RgbColor.canonicalHex(colorToken);
            if (canonical.isPresent()) {
                colorHex = canonical.get();
                color = RgbColor.parseHex(colorHex).orElse(RgbColor.MID_GRAY);
            } else {
                warnings.add(SyncWarning.of(SyncWarning.Kind.INVALID_COLOR, primaryKey, index,
                        "Unparseable color '" + colorToken + "', using " + colorHex));
            }
        }
        
        GeometryExtractor.Extraction geometry = geometryExtractor.extract(record);
        if (!geometry.isClean()) {
            warnings.add(SyncWarning.of(SyncWarning.Kind.INVALID_GEOMETRY, primaryKey, index,
                    String.format("Geometry yields %s (%d branches skipped)", geometry.getFootprint(),
                            geometry.getRejectedBranches())));
        }
        
        EnergySummary summary = EnergySummary.builder()
                .energyDemandSpecificBefore(valueOf(beginResult, ENERGY_FIELD))
                .energyDemandSpecificAfter(energyValue)
                .co2TonnesBefore(tonnes(valueOf(beginResult, CO2_FIELD)))
                .co2TonnesAfter(tonnes(valueOf(endResult, CO2_FIELD)))
                .build();
        
        Building building = Building.builder()
                .id(primaryKey)
                .secondaryKey(secondaryKey)
                .recordId(record.hasNonNull("id") && record.get("id").canConvertToLong() ? record.get("id").asLong() : null)
                .timestamp(timestamp)
                .attributesSnapshot(canonicalSnapshot(record))
                .energyValue(energyValue)
                .colorHex(colorHex)
                .color(color)
                .energySummary(summary)
                .footprint(geometry.getFootprint())
                .build();
        return Optional.of(building);
    }
    
    String canonicalSnapshot(JsonNode record) {
        try {
            Object tree = canonicalMapper.treeToValue(record, Object.class);
            return canonicalMapper.writeValueAsString(tree);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize record", e);
        }
    }
    
    private static JsonNode energyContainer(JsonNode record) {
        for (String name : ENERGY_CONTAINERS) {
            JsonNode candidate = record.get(name);
            if (candidate != null && candidate.isObject()) {
                return candidate;
            }
        }
        return record;
    }
    
    private static JsonNode firstObject(JsonNode node, String... names) {
        if (node == null) {
            return null;
        }
        for (String name : names) {
            JsonNode candidate = node.get(name);
            if (candidate != null && candidate.isObject()) {
                return candidate;
            }
        }
        return null;
    }
    
    private static JsonNode resultOf(JsonNode state) {
        if (state == null) {
            return null;
        }
        JsonNode result = state.get("result");
        return result != null && result.isObject() ? result : state;
    }
    
    private static String colorToken(JsonNode end) {
        if (end == null) {
            return null;
        }
        String token = textOrNull(end.get("color"), COLOR_FIELD);
        if (token == null) {
            JsonNode result = end.get("result");
            token = result != null ? textOrNull(result.get("color"), COLOR_FIELD) : null;
        }
        return token;
    }
    
    /**
     * Numeric {@code <field>.value}, or the field itself when it is a bare number
     */
    private static Double valueOf(JsonNode node, String field) {
        if (node == null) {
            return null;
        }
        JsonNode value = node.get(field);
        if (value != null && value.isObject()) {
            value = value.get("value");
        }
        return toDouble(value);
    }
    
    private static Double toDouble(JsonNode value) {
        if (value == null || value.isNull()) {
            return null;
        }
        double result;
        if (value.isNumber()) {
            result = value.asDouble();
        } else if (value.isTextual()) {
            try {
                result = Double.parseDouble(value.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        } else {
            return null;
        }
        return Double.isFinite(result) ? result : null;
    }
    
    private static Double tonnes(Double kilograms) {
        return kilograms == null ? null : kilograms / KG_PER_TONNE;
    }
    
    private static String textOrNull(JsonNode node, String field) {
        if (node == null || !node.isObject()) {
            return null;
        }
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return null;
        }
        return value.asText();
    }
}
