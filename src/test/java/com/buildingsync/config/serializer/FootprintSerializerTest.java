package com.buildingsync.config.serializer;

import com.buildingsync.model.Building;
import com.buildingsync.model.Footprint;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FootprintSerializerTest {
    
    private final ObjectMapper objectMapper = new ObjectMapper();
    
    @Test
    void testSerializeFootprint() throws Exception {
        Footprint footprint = Footprint.ofRing(List.of(
                new Coordinate(0, 0), new Coordinate(10, 0), new Coordinate(10, 20), new Coordinate(0, 20)));
        
        JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(footprint));
        
        assertEquals(1, json.get("rings").size());
        assertEquals(10.0, json.get("rings").get(0).get(1).get(0).asDouble());
        assertEquals(0.0, json.get("bounds").get("minX").asDouble());
        assertEquals(20.0, json.get("bounds").get("maxY").asDouble());
        assertTrue(json.get("usable").asBoolean());
    }
    
    @Test
    void testSerializeEmptyFootprint() throws Exception {
        JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(Footprint.empty()));
        
        assertEquals(0, json.get("rings").size());
        assertFalse(json.has("bounds"));
        assertFalse(json.get("usable").asBoolean());
    }
    
    @Test
    void testBuildingJsonHidesSnapshot() throws Exception {
        Building building = Building.builder()
                .id("DEBW_001")
                .attributesSnapshot("{\"modified_gml_id\":\"DEBW_001\"}")
                .footprint(Footprint.ofRing(List.of(
                        new Coordinate(0, 0), new Coordinate(10, 0), new Coordinate(10, 10))))
                .build();
        
        JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(building));
        
        assertEquals("DEBW_001", json.get("id").asText());
        assertFalse(json.has("attributesSnapshot"));
        assertEquals("#808080", json.get("colorHex").asText());
        assertTrue(json.get("footprint").has("rings"));
    }
}
