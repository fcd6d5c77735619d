package com.buildingsync.service;

import com.buildingsync.model.Building;
import com.buildingsync.model.DiffResult;

import java.util.List;
import java.util.Map;

/**
 * Classifies each incoming building against the previous snapshot
 */
public interface Differencer {
    
    /**
     * Energy values closer than this are considered equal
     */
    double ENERGY_EPSILON = 0.01;
    
    /**
     * Compare incoming buildings with the previous snapshot.
     * Records follow encounter order; buildings missing from {@code incoming}
     * are appended as REMOVED. Neither argument is modified.
     */
    DiffResult diff(Map<String, Building> previous, List<Building> incoming);
}
