package com.buildingsync.model;

import lombok.Builder;
import lombok.Value;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Point-in-time counters of the entity cache and its key/spatial indexes
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CacheStatistics {
    int buildings;
    int confirmedMappings;
    int heuristicMappings;
    int indexedFootprints;
    int unresolvableFootprints;
    int coordinateHashes;
    Bounds extent;
}
