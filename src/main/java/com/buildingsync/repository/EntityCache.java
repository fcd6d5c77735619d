package com.buildingsync.repository;

import com.buildingsync.model.Building;
import com.buildingsync.model.CacheStatistics;
import org.locationtech.jts.geom.Coordinate;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * System of record for buildings, addressable by primary key, secondary key,
 * pick point and coordinate hash. Owns every building and key mapping.
 */
public interface EntityCache {
    
    /**
     * Insert or replace by primary key, reconciling the secondary key through the
     * identity resolver first.
     *
     * @throws IllegalArgumentException when the primary key is empty
     */
    void upsert(Building building);
    
    Optional<Building> get(String primaryKey);
    
    /**
     * Direct lookup, then resolution of either key format
     */
    Optional<Building> getByAnyKey(String key);
    
    /**
     * Spatial lookup with the configured tolerance
     */
    Optional<Building> getByPoint(Coordinate point);
    
    Optional<Building> getByPoint(Coordinate point, double tolerance);
    
    Optional<Building> getByCoordinateHash(String hash);
    
    List<Building> snapshotAll();
    
    /**
     * Current buildings by primary key, used as the diff baseline
     */
    Map<String, Building> snapshotMap();
    
    boolean remove(String primaryKey);
    
    void clear();
    
    int size();
    
    CacheStatistics statistics();
}
