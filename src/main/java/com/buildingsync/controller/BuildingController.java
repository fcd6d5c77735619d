package com.buildingsync.controller;

import com.buildingsync.aspect.TimingAspect;
import com.buildingsync.exception.MalformedPayloadException;
import com.buildingsync.model.Building;
import com.buildingsync.model.CacheStatistics;
import com.buildingsync.model.PickResolution;
import com.buildingsync.model.SyncCycleResult;
import com.buildingsync.model.result.ApiResponse;
import com.buildingsync.model.result.PollerStatus;
import com.buildingsync.poller.AdaptivePoller;
import com.buildingsync.service.BuildingSyncService;
import jakarta.validation.ConstraintViolationException;
import jakarta.validation.constraints.NotBlank;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Coordinate;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.Optional;

/**
 * HTTP read accessors for the renderer and UI, plus poller and cache control
 */
@RestController
@RequestMapping("/api/v1")
@Validated
@Slf4j
public class BuildingController {
    
    @Autowired
    private BuildingSyncService syncService;
    
    @Autowired
    private AdaptivePoller poller;
    
    /**
     * GET /api/v1/buildings/{key} - either identifier format
     */
    @GetMapping("/buildings/{key}")
    public ResponseEntity<ApiResponse<Building>> getBuilding(@PathVariable @NotBlank String key) {
        return found(syncService.findByAnyKey(key), "Building not found: " + key);
    }
    
    /**
     * GET /api/v1/buildings/at?x=&y=[&z=] - pick point, z is ignored
     */
    @GetMapping("/buildings/at")
    public ResponseEntity<ApiResponse<Building>> getBuildingAt(
            @RequestParam double x,
            @RequestParam double y,
            @RequestParam(required = false) Double z) {
        Optional<Building> building = syncService.findByPoint(new Coordinate(x, y));
        return found(building, String.format("No building at (%s, %s)", x, y));
    }
    
    /**
     * GET /api/v1/buildings/pick?key=&x=&y=[&z=] - validate a renderer pick
     */
    @GetMapping("/buildings/pick")
    public ResponseEntity<ApiResponse<PickResolution>> pick(
            @RequestParam(required = false) String key,
            @RequestParam double x,
            @RequestParam double y,
            @RequestParam(required = false) Double z) {
        PickResolution resolution = syncService.resolvePick(key, new Coordinate(x, y));
        if (!resolution.isFound()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(ApiResponse.error(key == null || key.isBlank()
                            ? String.format("No building at (%s, %s)", x, y)
                            : String.format("No building for pick %s at (%s, %s)", key, x, y)));
        }
        return ResponseEntity.ok(ApiResponse.success(resolution, TimingAspect.getAndClearExecutionTime()));
    }
    
    @GetMapping("/buildings/hash/{hash}")
    public ResponseEntity<ApiResponse<Building>> getBuildingByHash(@PathVariable @NotBlank String hash) {
        return found(syncService.findByCoordinateHash(hash), "No building with coordinate hash " + hash);
    }
    
    @GetMapping("/keys/{key}/canonical")
    public ResponseEntity<ApiResponse<Map<String, String>>> canonicalKey(@PathVariable @NotBlank String key) {
        return syncService.canonicalKey(key)
                .map(canonical -> ResponseEntity.ok(ApiResponse.success(Map.of("key", key, "canonical", canonical))))
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(ApiResponse.error("Unknown key: " + key)));
    }
    
    @GetMapping("/stats")
    public ResponseEntity<ApiResponse<CacheStatistics>> stats() {
        return ResponseEntity.ok(ApiResponse.success(syncService.statistics()));
    }
    
    @GetMapping("/poller")
    public ResponseEntity<ApiResponse<PollerStatus>> pollerStatus() {
        return ResponseEntity.ok(ApiResponse.success(poller.getStatus()));
    }
    
    @PostMapping("/poller/start")
    public ResponseEntity<ApiResponse<PollerStatus>> startPoller() {
        poller.start();
        return ResponseEntity.ok(ApiResponse.success(poller.getStatus()));
    }
    
    @PostMapping("/poller/stop")
    public ResponseEntity<ApiResponse<PollerStatus>> stopPoller() {
        poller.stop();
        return ResponseEntity.ok(ApiResponse.success(poller.getStatus()));
    }
    
    /**
     * POST /api/v1/poller/refresh - force a cycle; 409 when stopped or busy
     */
    @PostMapping("/poller/refresh")
    public ResponseEntity<ApiResponse<PollerStatus>> refresh() {
        if (!poller.refreshNow()) {
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(ApiResponse.error("Poller is stopped or a cycle is in flight"));
        }
        return ResponseEntity.ok(ApiResponse.success(poller.getStatus()));
    }
    
    @PostMapping("/cache/clear")
    public ResponseEntity<ApiResponse<CacheStatistics>> clearCache() {
        syncService.invalidate();
        log.info("Cache cleared through the API");
        return ResponseEntity.ok(ApiResponse.success(syncService.statistics()));
    }
    
    /**
     * POST /api/v1/ingest - push a payload through the diff/cache/notify path
     */
    @PostMapping("/ingest")
    public ResponseEntity<ApiResponse<SyncCycleResult>> ingest(@RequestBody @NotBlank String payload) {
        try {
            SyncCycleResult result = syncService.ingest(payload);
            return ResponseEntity.ok(ApiResponse.success(result, TimingAspect.getAndClearExecutionTime()));
        } catch (MalformedPayloadException e) {
            TimingAspect.getAndClearExecutionTime();
            return ResponseEntity.badRequest().body(ApiResponse.error(e.getMessage()));
        }
    }
    
    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ApiResponse<Void>> handleConstraintViolation(ConstraintViolationException e) {
        return ResponseEntity.badRequest().body(ApiResponse.error(e.getMessage()));
    }
    
    private ResponseEntity<ApiResponse<Building>> found(Optional<Building> building, String notFoundMessage) {
        String elapsed = TimingAspect.getAndClearExecutionTime();
        return building
                .map(b -> ResponseEntity.ok(ApiResponse.success(b, elapsed)))
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND).body(ApiResponse.error(notFoundMessage)));
    }
}
