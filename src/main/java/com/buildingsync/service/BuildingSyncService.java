package com.buildingsync.service;

import com.buildingsync.exception.MalformedPayloadException;
import com.buildingsync.model.Building;
import com.buildingsync.model.CacheStatistics;
import com.buildingsync.model.PickResolution;
import com.buildingsync.model.SyncCycleResult;
import org.locationtech.jts.geom.Coordinate;

import java.util.Optional;

/**
 * Service interface for the building sync pipeline and its read accessors
 */
public interface BuildingSyncService {
    
    /**
     * Run one diff, cache update and notify pass over a fetched payload.
     * Passes never overlap. On a malformed payload the cache is left untouched.
     */
    SyncCycleResult processPayload(String payload) throws MalformedPayloadException;
    
    /**
     * Push a payload through the same path without fetching
     */
    SyncCycleResult ingest(String payload) throws MalformedPayloadException;
    
    /**
     * Count a fetch that failed before producing a payload
     */
    void recordTransportFailure(Exception cause);
    
    Optional<Building> findByAnyKey(String key);
    
    Optional<Building> findByPoint(Coordinate point);
    
    Optional<Building> findByCoordinateHash(String hash);
    
    /**
     * Validate a renderer pick: the claimed building if its footprint contains the
     * point, else the spatial match, else the claimed key by identifier
     */
    PickResolution resolvePick(String claimedKey, Coordinate point);
    
    Optional<String> canonicalKey(String key);
    
    CacheStatistics statistics();
    
    /**
     * Explicit invalidation, e.g. after the data source changed
     */
    void invalidate();
    
    long getCycleCount();
    
    Optional<SyncCycleResult> getLastResult();
}
