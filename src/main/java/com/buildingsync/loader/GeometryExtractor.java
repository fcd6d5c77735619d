package com.buildingsync.loader;

import com.buildingsync.model.Footprint;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Value;
import org.locationtech.jts.geom.Coordinate;

import java.util.ArrayList;
import java.util.List;

/**
 * Extracts footprint rings from the loosely shaped geometry of a source record.
 * <p>
 * Accepts a ring of coordinate pairs ({@code [[x,y],...]}), a polygon
 * ({@code [[[x,y],...],...]}) or a multi-polygon (one more level). Leaves are
 * arrays of 2 or 3 numbers; z is dropped. Branches of any other shape are
 * skipped and counted. A string is read as JSON first, then as a flat list of
 * numbers taken pairwise.
 */
public class GeometryExtractor {
    
    /** Levels of array nesting allowed above a ring */
    static final int MAX_RING_DEPTH = 3;
    
    private final ObjectMapper objectMapper;
    
    public GeometryExtractor(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }
    
    @Value
    public static class Extraction {
        Footprint footprint;
        int rejectedBranches;
        
        /** True when the record carried geometry of any kind */
        boolean present;
        
        public boolean isClean() {
            return !present || (rejectedBranches == 0 && footprint.isUsable());
        }
    }
    
    /**
     * Read the geometry of a record from {@code coordinates}, {@code geom.coordinates}
     * or {@code position}, in that order
     */
    public Extraction extract(JsonNode record) {
        JsonNode geometry = null;
        if (hasValue(record, "coordinates")) {
            geometry = record.get("coordinates");
        } else if (record.has("geom") && record.get("geom").isObject() && hasValue(record.get("geom"), "coordinates")) {
            geometry = record.get("geom").get("coordinates");
        } else if (hasValue(record, "position")) {
            geometry = record.get("position");
        }
        if (geometry == null) {
            return new Extraction(Footprint.empty(), 0, false);
        }
        return extractValue(geometry);
    }
    
    /**
     * Extract from a geometry value: array, GeoJSON-like object or string
     */
    public Extraction extractValue(JsonNode geometry) {
        if (geometry.isTextual()) {
            return fromText(geometry.asText());
        }
        if (geometry.isObject() && geometry.has("coordinates")) {
            return extractValue(geometry.get("coordinates"));
        }
        if (!geometry.isArray()) {
            return new Extraction(Footprint.empty(), 1, true);
        }
        
        List<List<Coordinate>> rings = new ArrayList<>();
        int[] rejected = {0};
        if (isPair(geometry)) {
            rings.add(List.of(toCoordinate(geometry)));
        } else {
            collectRings(geometry, 1, rings, rejected);
        }
        return new Extraction(Footprint.of(rings), rejected[0], true);
    }
    
    private void collectRings(JsonNode node, int depth, List<List<Coordinate>> rings, int[] rejected) {
        if (depth > MAX_RING_DEPTH) {
            rejected[0]++;
            return;
        }
        if (node.size() > 0 && looksLikeRing(node)) {
            List<Coordinate> ring = new ArrayList<>(node.size());
            for (JsonNode element : node) {
                if (isPair(element)) {
                    ring.add(toCoordinate(element));
                } else {
                    rejected[0]++;
                }
            }
            if (!ring.isEmpty()) {
                rings.add(ring);
            }
            return;
        }
        for (JsonNode child : node) {
            if (child.isArray() && child.size() > 0) {
                collectRings(child, depth + 1, rings, rejected);
            } else {
                rejected[0]++;
            }
        }
    }
    
    /**
     * A ring is an array whose first element is a coordinate pair
     */
    private static boolean looksLikeRing(JsonNode node) {
        return isPair(node.get(0));
    }
    
    private static boolean isPair(JsonNode node) {
        if (node == null || !node.isArray() || node.size() < 2 || node.size() > 3) {
            return false;
        }
        for (JsonNode value : node) {
            if (!value.isNumber() || !Double.isFinite(value.asDouble())) {
                return false;
            }
        }
        return true;
    }
    
    private static Coordinate toCoordinate(JsonNode pair) {
        return new Coordinate(pair.get(0).asDouble(), pair.get(1).asDouble());
    }
    
    private Extraction fromText(String text) {
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return new Extraction(Footprint.empty(), 0, false);
        }
        if (trimmed.startsWith("[") || trimmed.startsWith("{")) {
            try {
                return extractValue(objectMapper.readTree(trimmed));
            } catch (JsonProcessingException e) {
                // not JSON, fall through to the flat number list
            }
        }
        
        String[] tokens = trimmed.replace("[", " ").replace("]", " ").split("[,\\s]+");
        List<Double> numbers = new ArrayList<>();
        for (String token : tokens) {
            if (token.isEmpty()) {
                continue;
            }
            try {
                double value = Double.parseDouble(token);
                if (!Double.isFinite(value)) {
                    return new Extraction(Footprint.empty(), 1, true);
                }
                numbers.add(value);
            } catch (NumberFormatException e) {
                return new Extraction(Footprint.empty(), 1, true);
            }
        }
        List<Coordinate> ring = new ArrayList<>(numbers.size() / 2);
        for (int i = 0; i + 1 < numbers.size(); i += 2) {
            ring.add(new Coordinate(numbers.get(i), numbers.get(i + 1)));
        }
        int rejected = numbers.size() % 2;
        return new Extraction(ring.isEmpty() ? Footprint.empty() : Footprint.ofRing(ring), rejected, true);
    }
    
    private static boolean hasValue(JsonNode node, String field) {
        return node.has(field) && !node.get(field).isNull();
    }
}
