package com.buildingsync.repository;

import com.buildingsync.model.KeyMapping;

import java.util.Optional;

/**
 * Maps between the two identifier formats of the remote source.
 * <p>
 * Format A ({@code modified_gml_id}) is the canonical primary key. Format B
 * ({@code gml_id}) is derivable by substitution, but a mapping observed in the
 * source always outranks the derived guess.
 */
public interface IdentityResolver {
    
    /**
     * Apply the deterministic substitution. Total: never fails, null maps to "".
     */
    String deriveSecondary(String primaryKey);
    
    /**
     * Store a mapping observed in a single source record. Replaces any heuristic
     * mapping for the primary key.
     *
     * @return the previous confirmed mapping when it named a different secondary key
     */
    Optional<KeyMapping> recordConfirmedMapping(String primaryKey, String secondaryKey);
    
    /**
     * Store the derived mapping unless a confirmed one exists for the primary key.
     *
     * @return the confirmed mapping when it disagrees with the derived key
     */
    Optional<KeyMapping> recordHeuristicMapping(String primaryKey);
    
    /**
     * Canonical primary key for a key in either format
     */
    Optional<String> resolve(String eitherKey);
    
    Optional<KeyMapping> mappingFor(String primaryKey);
    
    /**
     * Secondary key for a primary key, confirmed mapping first
     */
    Optional<String> secondaryFor(String primaryKey);
    
    void remove(String primaryKey);
    
    void clear();
    
    int confirmedCount();
    
    int heuristicCount();
}
