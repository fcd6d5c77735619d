package com.buildingsync.model.base;

import lombok.Data;
import lombok.experimental.SuperBuilder;
import lombok.NoArgsConstructor;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Builder;
import com.buildingsync.model.Footprint;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.locationtech.jts.geom.Coordinate;

/**
 * Base spatial entity with footprint support using generics
 * Extends BaseEntity with ground outline capabilities
 */
@Data
@SuperBuilder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(callSuper = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public abstract class BaseSpatialEntity<ID> extends BaseEntity<ID> {
    
    /**
     * Ground outline of the entity, never null
     */
    @Builder.Default
    private Footprint footprint = Footprint.empty();
    
    /**
     * Get the bounding box center for quick access
     */
    @JsonIgnore
    public Coordinate getCenterPoint() {
        return footprint != null ? footprint.getCenter() : null;
    }
    
    /**
     * Check if the footprint contains the given point
     */
    public boolean covers(Coordinate point) {
        return footprint != null && point != null && footprint.contains(point);
    }
}
