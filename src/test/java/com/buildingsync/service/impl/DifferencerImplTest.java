package com.buildingsync.service.impl;

import com.buildingsync.loader.impl.BuildingRecordParserImpl;
import com.buildingsync.model.Building;
import com.buildingsync.model.ChangeKind;
import com.buildingsync.model.ChangeRecord;
import com.buildingsync.model.DiffResult;
import com.buildingsync.model.SyncWarning;
import com.buildingsync.repository.impl.IdentityResolverImpl;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static com.buildingsync.support.PayloadFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class DifferencerImplTest {
    
    private DifferencerImpl differencer;
    private IdentityResolverImpl identityResolver;
    private BuildingRecordParserImpl parser;
    
    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = new ObjectMapper();
        identityResolver = new IdentityResolverImpl();
        differencer = new DifferencerImpl();
        differencer.identityResolver = identityResolver;
        differencer.objectMapper = objectMapper;
        parser = new BuildingRecordParserImpl(objectMapper);
    }
    
    private List<Building> parse(String... records) throws Exception {
        return parser.parse(results(records)).getBuildings();
    }
    
    private static Map<String, Building> byKey(List<Building> buildings) {
        Map<String, Building> map = new LinkedHashMap<>();
        buildings.forEach(b -> map.put(b.getId(), b));
        return map;
    }
    
    private static List<ChangeKind> kinds(DiffResult result) {
        return result.getRecords().stream().map(ChangeRecord::getKind).collect(Collectors.toList());
    }
    
    @Test
    void testExampleScenario() throws Exception {
        // cycle 1: empty cache
        List<Building> first = parse(record("DEBW_001", "#808080", 120.0));
        DiffResult cycle1 = differencer.diff(Map.of(), first);
        assertEquals(1, cycle1.getChanges().size());
        assertEquals("DEBW_001", cycle1.getChanges().get(0).getKey());
        assertEquals(ChangeKind.NEW, cycle1.getChanges().get(0).getKind());
        
        // cycle 2: identical payload
        DiffResult cycle2 = differencer.diff(byKey(first), parse(record("DEBW_001", "#808080", 120.0)));
        assertTrue(cycle2.getChanges().isEmpty());
        
        // cycle 3: color changes
        DiffResult cycle3 = differencer.diff(byKey(first), parse(record("DEBW_001", "#FF0000", 120.0)));
        assertEquals(List.of(ChangeKind.COLOR_CHANGED), kinds(cycle3));
    }
    
    @Test
    void testIdempotence() throws Exception {
        String payload = results(record("A", "#808080", 1.0), record("B", "#66b032", 2.0), record("C", "#ff0000", 3.0));
        List<Building> first = parser.parse(payload).getBuildings();
        
        DiffResult again = differencer.diff(byKey(first), parser.parse(payload).getBuildings());
        
        assertTrue(again.getChanges().isEmpty());
        assertEquals(3, again.count(ChangeKind.UNCHANGED));
    }
    
    @Test
    void testEnergyChangeIsAttributeChange() throws Exception {
        List<Building> before = parse(record("A", "#808080", 120.0));
        
        DiffResult result = differencer.diff(byKey(before), parse(record("A", "#808080", 95.0)));
        
        assertEquals(List.of(ChangeKind.ATTRIBUTE_CHANGED), kinds(result));
        assertEquals(before.get(0).getAttributesSnapshot(), result.getRecords().get(0).getPreviousSnapshot());
    }
    
    @Test
    void testEnergyNoiseBelowEpsilonIsUnchanged() throws Exception {
        List<Building> before = parse(record("A", "#808080", 120.0));
        
        DiffResult result = differencer.diff(byKey(before), parse(record("A", "#808080", 120.004)));
        
        assertEquals(List.of(ChangeKind.UNCHANGED), kinds(result));
    }
    
    @Test
    void testColorCaseOnlyChangeIsNotColorChange() throws Exception {
        List<Building> before = parse(record("A", "#66b032", 120.0));
        
        // different raw token, same canonical color, other attribute identical
        DiffResult result = differencer.diff(byKey(before), parse(record("A", "#66B032", 120.0)));
        
        assertEquals(List.of(ChangeKind.ATTRIBUTE_CHANGED), kinds(result));
    }
    
    @Test
    void testOtherAttributeChange() throws Exception {
        List<Building> before = parser.parse("[{\"modified_gml_id\":\"A\",\"name\":\"old\"}]").getBuildings();
        List<Building> after = parser.parse("[{\"modified_gml_id\":\"A\",\"name\":\"new\"}]").getBuildings();
        
        assertEquals(List.of(ChangeKind.ATTRIBUTE_CHANGED), kinds(differencer.diff(byKey(before), after)));
    }
    
    @Test
    void testRemovedAreReportedAfterIncoming() throws Exception {
        List<Building> before = parse(record("A", "#808080", 1.0), record("B", "#808080", 2.0));
        
        DiffResult result = differencer.diff(byKey(before), parse(record("C", "#808080", 3.0), record("A", "#808080", 1.0)));
        
        List<String> keys = result.getRecords().stream().map(ChangeRecord::getKey).collect(Collectors.toList());
        assertEquals(List.of("C", "A", "B"), keys);
        assertEquals(List.of(ChangeKind.NEW, ChangeKind.UNCHANGED, ChangeKind.REMOVED), kinds(result));
        assertEquals(1, result.getRemoved().size());
        assertEquals(1, result.getChanges().size());
    }
    
    @Test
    void testEncounterOrderIsPreserved() throws Exception {
        DiffResult result = differencer.diff(Map.of(),
                parse(record("Z", "#808080", 1.0), record("M", "#808080", 1.0), record("A", "#808080", 1.0)));
        
        assertEquals(List.of("Z", "M", "A"),
                result.getChanges().stream().map(ChangeRecord::getKey).collect(Collectors.toList()));
    }
    
    @Test
    void testDuplicateKeyLastOccurrenceWins() throws Exception {
        DiffResult result = differencer.diff(Map.of(),
                parse(record("A", "#808080", 1.0), record("B", "#808080", 1.0), record("A", "#ff0000", 1.0)));
        
        assertEquals(2, result.getRecords().size());
        assertEquals("A", result.getRecords().get(0).getKey());
        assertEquals("#ff0000", result.getIncoming().get("A").getColorHex());
    }
    
    @Test
    void testConfirmsObservedKeyPairs() throws Exception {
        differencer.diff(Map.of(), parse(record("DEBW_001", "DEBWX001", "#808080", 1.0, SQUARE_0_10)));
        
        assertEquals("DEBWX001", identityResolver.secondaryFor("DEBW_001").orElseThrow());
    }
    
    @Test
    void testAmbiguousKeyMappingIsWarning() throws Exception {
        identityResolver.recordConfirmedMapping("DEBW_001", "DEBWX001");
        
        DiffResult result = differencer.diff(Map.of(), parse(record("DEBW_001", "#808080", 1.0)));
        
        assertEquals(1, result.getChanges().size());
        assertEquals(1, result.getWarnings().size());
        assertEquals(SyncWarning.Kind.AMBIGUOUS_KEY_MAPPING, result.getWarnings().get(0).getKind());
        assertEquals("DEBWX001", identityResolver.secondaryFor("DEBW_001").orElseThrow());
    }
    
    @Test
    void testPersistingKeyConflictIsReportedOnce() throws Exception {
        identityResolver.recordConfirmedMapping("DEBW_001", "DEBWX001");
        
        DiffResult first = differencer.diff(Map.of(), parse(record("DEBW_001", "#808080", 1.0)));
        DiffResult second = differencer.diff(byKey(parse(record("DEBW_001", "#808080", 1.0))),
                parse(record("DEBW_001", "#808080", 1.0)));
        
        assertEquals(1, first.getWarnings().size());
        assertTrue(second.getWarnings().isEmpty());
        assertTrue(second.getChanges().isEmpty());
    }
    
    @Test
    void testInputsAreNotModified() throws Exception {
        Map<String, Building> previous = byKey(parse(record("A", "#808080", 1.0)));
        List<Building> incoming = parse(record("B", "#808080", 1.0));
        
        differencer.diff(previous, incoming);
        
        assertEquals(1, previous.size());
        assertEquals(1, incoming.size());
    }
    
    @Test
    void testEnergyDiffers() {
        assertFalse(DifferencerImpl.energyDiffers(120.0, 120.009));
        assertTrue(DifferencerImpl.energyDiffers(120.0, 120.02));
        assertTrue(DifferencerImpl.energyDiffers(null, 1.0));
        assertFalse(DifferencerImpl.energyDiffers(null, null));
    }
}
