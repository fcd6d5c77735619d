package com.buildingsync.repository.impl;

import com.buildingsync.config.BuildingSyncProperties;
import com.buildingsync.model.Bounds;
import com.buildingsync.model.Building;
import com.buildingsync.model.CacheStatistics;
import com.buildingsync.model.KeyMapping;
import com.buildingsync.repository.EntityCache;
import com.buildingsync.repository.IdentityResolver;
import com.buildingsync.repository.SpatialIndex;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Coordinate;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Implementation of EntityCache over concurrent maps.
 * Each write replaces one building atomically; readers never block. Buildings
 * are copied on the way in and on the way out, so callers never hold the stored
 * instance.
 */
@Repository
@Slf4j
public class EntityCacheImpl implements EntityCache {
    
    private final IdentityResolver identityResolver;
    private final SpatialIndex spatialIndex;
    private final BuildingSyncProperties properties;
    
    private final Map<String, Building> buildings = new ConcurrentHashMap<>();
    private final Map<String, String> keysByCoordinateHash = new ConcurrentHashMap<>();
    private final Map<String, String> keysBySecondaryKey = new ConcurrentHashMap<>();
    
    public EntityCacheImpl(IdentityResolver identityResolver, SpatialIndex spatialIndex,
                           BuildingSyncProperties properties) {
        this.identityResolver = identityResolver;
        this.spatialIndex = spatialIndex;
        this.properties = properties;
    }
    
    @Override
    public void upsert(Building building) {
        if (building == null || building.getId() == null || building.getId().isBlank()) {
            throw new IllegalArgumentException("Building primary key must not be empty");
        }
        String primaryKey = building.getId();
        Building stored = building.toBuilder().build();
        
        Optional<KeyMapping> conflict;
        if (stored.hasSecondaryKey()) {
            conflict = identityResolver.recordConfirmedMapping(primaryKey, stored.getSecondaryKey());
        } else {
            conflict = identityResolver.recordHeuristicMapping(primaryKey);
            identityResolver.mappingFor(primaryKey)
                    .filter(KeyMapping::isConfirmed)
                    .ifPresent(m -> stored.setSecondaryKey(m.getSecondaryKey()));
        }
        conflict.ifPresent(c -> log.debug("Key mapping for {} reconciled against {}", primaryKey, c));
        
        Building previous = buildings.put(primaryKey, stored);
        spatialIndex.index(primaryKey, stored.getFootprint());
        reindexSecondaryKey(primaryKey, previous, stored);
        
        String previousHash = previous != null ? previous.getCoordinateHash() : null;
        String hash = stored.getCoordinateHash();
        if (previousHash != null && !previousHash.equals(hash)) {
            keysByCoordinateHash.remove(previousHash, primaryKey);
        }
        if (hash != null) {
            keysByCoordinateHash.put(hash, primaryKey);
        }
    }
    
    /**
     * Keep the secondary key on exactly one cached building. When it moved here
     * from another building, that building loses it.
     */
    private void reindexSecondaryKey(String primaryKey, Building previous, Building stored) {
        String oldKey = previous != null ? previous.getSecondaryKey() : null;
        String newKey = stored.hasSecondaryKey() ? stored.getSecondaryKey() : null;
        if (oldKey != null && !oldKey.equals(newKey)) {
            keysBySecondaryKey.remove(oldKey, primaryKey);
        }
        if (newKey == null) {
            return;
        }
        String formerOwner = keysBySecondaryKey.put(newKey, primaryKey);
        if (formerOwner != null && !formerOwner.equals(primaryKey)) {
            buildings.computeIfPresent(formerOwner, (key, owner) -> newKey.equals(owner.getSecondaryKey())
                    ? owner.toBuilder().secondaryKey(null).build()
                    : owner);
            log.debug("Secondary key {} taken from {} by {}", newKey, formerOwner, primaryKey);
        }
    }
    
    private static Building detached(Building building) {
        return building == null ? null : building.toBuilder().build();
    }
    
    @Override
    public Optional<Building> get(String primaryKey) {
        return primaryKey == null ? Optional.empty() : Optional.ofNullable(detached(buildings.get(primaryKey)));
    }
    
    @Override
    public Optional<Building> getByAnyKey(String key) {
        if (key == null || key.isEmpty()) {
            return Optional.empty();
        }
        Building direct = buildings.get(key);
        if (direct != null) {
            return Optional.of(detached(direct));
        }
        return identityResolver.resolve(key).map(buildings::get).map(EntityCacheImpl::detached);
    }
    
    @Override
    public Optional<Building> getByPoint(Coordinate point) {
        return getByPoint(point, properties.getSpatial().getToleranceMeters());
    }
    
    @Override
    public Optional<Building> getByPoint(Coordinate point, double tolerance) {
        return spatialIndex.resolve(point, tolerance).map(buildings::get).map(EntityCacheImpl::detached);
    }
    
    @Override
    public Optional<Building> getByCoordinateHash(String hash) {
        if (hash == null) {
            return Optional.empty();
        }
        String key = keysByCoordinateHash.get(hash);
        return key == null ? Optional.empty() : Optional.ofNullable(detached(buildings.get(key)));
    }
    
    @Override
    public List<Building> snapshotAll() {
        List<Building> copies = new ArrayList<>(buildings.size());
        buildings.values().forEach(b -> copies.add(detached(b)));
        return Collections.unmodifiableList(copies);
    }
    
    @Override
    public Map<String, Building> snapshotMap() {
        Map<String, Building> copies = new HashMap<>();
        buildings.forEach((key, b) -> copies.put(key, detached(b)));
        return Collections.unmodifiableMap(copies);
    }
    
    @Override
    public boolean remove(String primaryKey) {
        if (primaryKey == null) {
            return false;
        }
        Building removed = buildings.remove(primaryKey);
        if (removed == null) {
            return false;
        }
        spatialIndex.remove(primaryKey);
        identityResolver.remove(primaryKey);
        String hash = removed.getCoordinateHash();
        if (hash != null) {
            keysByCoordinateHash.remove(hash, primaryKey);
        }
        if (removed.hasSecondaryKey()) {
            keysBySecondaryKey.remove(removed.getSecondaryKey(), primaryKey);
        }
        return true;
    }
    
    @Override
    public void clear() {
        int size = buildings.size();
        buildings.clear();
        keysByCoordinateHash.clear();
        keysBySecondaryKey.clear();
        spatialIndex.clear();
        identityResolver.clear();
        log.info("Cleared entity cache ({} buildings)", size);
    }
    
    @Override
    public int size() {
        return buildings.size();
    }
    
    @Override
    public CacheStatistics statistics() {
        return CacheStatistics.builder()
                .buildings(buildings.size())
                .confirmedMappings(identityResolver.confirmedCount())
                .heuristicMappings(identityResolver.heuristicCount())
                .indexedFootprints(spatialIndex.size() - spatialIndex.unresolvableCount())
                .unresolvableFootprints(spatialIndex.unresolvableCount())
                .coordinateHashes(keysByCoordinateHash.size())
                .extent(Bounds.of(spatialIndex.extent()))
                .build();
    }
}
