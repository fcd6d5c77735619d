package com.buildingsync.model;

import lombok.Value;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Outcome of resolving a renderer pick (claimed key plus pick point)
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PickResolution {
    
    public enum Strategy {
        /** The claimed building's footprint contains the pick point */
        CLAIMED_VALIDATED,
        /** The claimed key was wrong or absent; the spatial index found the building */
        SPATIAL,
        /** No footprint matched; fell back to the claimed identifier */
        IDENTIFIER,
        NOT_FOUND
    }
    
    Strategy strategy;
    Building building;
    
    public static PickResolution of(Strategy strategy, Building building) {
        return new PickResolution(strategy, building);
    }
    
    public static PickResolution notFound() {
        return new PickResolution(Strategy.NOT_FOUND, null);
    }
    
    public boolean isFound() {
        return building != null;
    }
}
