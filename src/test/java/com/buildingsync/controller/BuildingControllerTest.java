package com.buildingsync.controller;

import com.buildingsync.exception.MalformedPayloadException;
import com.buildingsync.model.Building;
import com.buildingsync.model.ChangeKind;
import com.buildingsync.model.ChangeRecord;
import com.buildingsync.model.PickResolution;
import com.buildingsync.model.SyncCycleResult;
import com.buildingsync.model.result.ApiResponse;
import com.buildingsync.model.result.PollerStatus;
import com.buildingsync.poller.AdaptivePoller;
import com.buildingsync.service.BuildingSyncService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.locationtech.jts.geom.Coordinate;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BuildingControllerTest {
    
    @Mock
    private BuildingSyncService syncService;
    
    @Mock
    private AdaptivePoller poller;
    
    @InjectMocks
    private BuildingController controller;
    
    private static Building building(String key) {
        return Building.builder().id(key).secondaryKey(key.replace('_', 'X')).build();
    }
    
    @Test
    void testGetBuildingByEitherKey() {
        // Given
        when(syncService.findByAnyKey("DEBWX001")).thenReturn(Optional.of(building("DEBW_001")));
        
        // When
        ResponseEntity<ApiResponse<Building>> response = controller.getBuilding("DEBWX001");
        
        // Then
        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertTrue(response.getBody().getOk());
        assertEquals("DEBW_001", response.getBody().getData().getId());
        assertNotNull(response.getBody().getElapsed());
    }
    
    @Test
    void testGetBuildingNotFound() {
        when(syncService.findByAnyKey("missing")).thenReturn(Optional.empty());
        
        ResponseEntity<ApiResponse<Building>> response = controller.getBuilding("missing");
        
        assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
        assertFalse(response.getBody().getOk());
        assertTrue(response.getBody().getError().contains("missing"));
    }
    
    @Test
    void testGetBuildingAtIgnoresZ() {
        when(syncService.findByPoint(any(Coordinate.class))).thenReturn(Optional.of(building("DEBW_001")));
        
        ResponseEntity<ApiResponse<Building>> response = controller.getBuildingAt(5.0, 6.0, 300.0);
        
        assertEquals(HttpStatus.OK, response.getStatusCode());
        verify(syncService).findByPoint(argThat(c -> c.x == 5.0 && c.y == 6.0));
    }
    
    @Test
    void testPick() {
        when(syncService.resolvePick(eq("DEBW_001"), any(Coordinate.class)))
                .thenReturn(PickResolution.of(PickResolution.Strategy.SPATIAL, building("DEBW_002")));
        
        ResponseEntity<ApiResponse<PickResolution>> response = controller.pick("DEBW_001", 1.0, 2.0, null);
        
        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertEquals(PickResolution.Strategy.SPATIAL, response.getBody().getData().getStrategy());
    }
    
    @Test
    void testPickNotFound() {
        when(syncService.resolvePick(any(), any(Coordinate.class))).thenReturn(PickResolution.notFound());
        
        ResponseEntity<ApiResponse<PickResolution>> response = controller.pick(null, 1.0, 2.0, null);
        ResponseEntity<ApiResponse<PickResolution>> claimed = controller.pick("DEBW_001", 1.0, 2.0, null);
        
        assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
        assertEquals("No building at (1.0, 2.0)", response.getBody().getError());
        assertEquals("No building for pick DEBW_001 at (1.0, 2.0)", claimed.getBody().getError());
    }
    
    @Test
    void testCanonicalKey() {
        when(syncService.canonicalKey("DEBWX001")).thenReturn(Optional.of("DEBW_001"));
        when(syncService.canonicalKey("nope")).thenReturn(Optional.empty());
        
        ResponseEntity<ApiResponse<Map<String, String>>> found = controller.canonicalKey("DEBWX001");
        ResponseEntity<ApiResponse<Map<String, String>>> missing = controller.canonicalKey("nope");
        
        assertEquals("DEBW_001", found.getBody().getData().get("canonical"));
        assertEquals(HttpStatus.NOT_FOUND, missing.getStatusCode());
    }
    
    @Test
    void testRefreshConflictWhenBusy() {
        when(poller.refreshNow()).thenReturn(false);
        
        ResponseEntity<ApiResponse<PollerStatus>> response = controller.refresh();
        
        assertEquals(HttpStatus.CONFLICT, response.getStatusCode());
        verify(poller, never()).getStatus();
    }
    
    @Test
    void testStartAndStopPoller() {
        when(poller.getStatus()).thenReturn(PollerStatus.builder().state("FAST").build());
        
        assertEquals(HttpStatus.OK, controller.startPoller().getStatusCode());
        assertEquals(HttpStatus.OK, controller.stopPoller().getStatusCode());
        
        verify(poller).start();
        verify(poller).stop();
    }
    
    @Test
    void testIngest() throws Exception {
        SyncCycleResult result = SyncCycleResult.builder()
                .cycle(1)
                .changes(List.of(ChangeRecord.of("DEBW_001", ChangeKind.NEW, null)))
                .removed(List.of())
                .warnings(List.of())
                .build();
        when(syncService.ingest("[]")).thenReturn(result);
        
        ResponseEntity<ApiResponse<SyncCycleResult>> response = controller.ingest("[]");
        
        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertEquals(1, response.getBody().getData().getChanges().size());
    }
    
    @Test
    void testIngestMalformedPayload() throws Exception {
        when(syncService.ingest("{")).thenThrow(new MalformedPayloadException("Payload is not valid JSON"));
        
        ResponseEntity<ApiResponse<SyncCycleResult>> response = controller.ingest("{");
        
        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        assertEquals("Payload is not valid JSON", response.getBody().getError());
    }
    
    @Test
    void testClearCache() {
        ResponseEntity<?> response = controller.clearCache();
        
        assertEquals(HttpStatus.OK, response.getStatusCode());
        verify(syncService).invalidate();
    }
}
