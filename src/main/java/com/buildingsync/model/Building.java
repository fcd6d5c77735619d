package com.buildingsync.model;

import lombok.Data;
import lombok.experimental.SuperBuilder;
import lombok.AllArgsConstructor;
import lombok.NoArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Builder;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.buildingsync.model.base.BaseSpatialEntity;
import org.locationtech.jts.geom.Coordinate;

/**
 * Building - one physical building as last ingested from the remote source.
 * The entity id is the primary key (the {@code modified_gml_id} format).
 */
@Data
@SuperBuilder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(callSuper = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Building extends BaseSpatialEntity<String> {
    
    /**
     * Key in the attribute-endpoint format ({@code gml_id}), null when not confirmed
     */
    private String secondaryKey;
    
    /**
     * Numeric record id from the source, when supplied
     */
    private Long recordId;
    
    /**
     * Canonical JSON of the full source record, only used for equality
     */
    @JsonIgnore
    private String attributesSnapshot;
    
    /**
     * Specific energy demand after renovation, the field tracked for changes
     */
    private Double energyValue;
    
    /**
     * Canonical color token, e.g. {@code #66b032}
     */
    @Builder.Default
    private String colorHex = RgbColor.MID_GRAY.toHex();
    
    @Builder.Default
    private RgbColor color = RgbColor.MID_GRAY;
    
    @Builder.Default
    private EnergySummary energySummary = EnergySummary.empty();
    
    public String getPrimaryKey() {
        return getId();
    }
    
    /**
     * Third cache key: bounding box center snapped to a 1-unit grid,
     * {@code "<floor(x)>:<floor(y)>"}. Null without a usable footprint.
     */
    public String getCoordinateHash() {
        Footprint footprint = getFootprint();
        if (footprint == null || !footprint.isUsable()) {
            return null;
        }
        Coordinate center = footprint.getCenter();
        return coordinateHash(center.x, center.y);
    }
    
    public static String coordinateHash(double x, double y) {
        return (long) Math.floor(x) + ":" + (long) Math.floor(y);
    }
    
    @JsonIgnore
    public boolean hasSecondaryKey() {
        return secondaryKey != null && !secondaryKey.isEmpty();
    }
}
