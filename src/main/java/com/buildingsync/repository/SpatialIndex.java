package com.buildingsync.repository;

import com.buildingsync.model.Footprint;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;

import java.util.Optional;

/**
 * Repository interface for footprint indexing and point resolution
 */
public interface SpatialIndex {
    
    /**
     * Store or replace the footprint of a building
     */
    void index(String key, Footprint footprint);
    
    void remove(String key);
    
    /**
     * Resolve a pick point to a building key.
     * Candidates are buildings whose bounding box lies less than {@code tolerance}
     * away from the point. The tightest candidate whose polygon contains the point
     * wins, otherwise the candidate with the smallest bounding box.
     * Footprints with fewer than 3 vertices are never matched.
     */
    Optional<String> resolve(Coordinate point, double tolerance);
    
    /**
     * Exact containment test against one indexed footprint
     */
    boolean contains(String key, Coordinate point);
    
    Optional<Envelope> bounds(String key);
    
    int size();
    
    /**
     * Number of stored footprints that can never be matched
     */
    int unresolvableCount();
    
    /**
     * Envelope of every usable footprint, null envelope when empty
     */
    Envelope extent();
    
    void clear();
}
