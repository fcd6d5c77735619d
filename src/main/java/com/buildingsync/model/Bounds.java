package com.buildingsync.model;

import lombok.Data;
import lombok.Builder;
import lombok.AllArgsConstructor;
import lombok.NoArgsConstructor;
import org.locationtech.jts.geom.Envelope;

/**
 * Bounds represents the bounding box of a footprint or of the whole cache
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Bounds {
    private double minX;
    private double minY;
    private double maxX;
    private double maxY;
    
    /**
     * Convert a JTS envelope, null for a null envelope
     */
    public static Bounds of(Envelope envelope) {
        if (envelope == null || envelope.isNull()) {
            return null;
        }
        return Bounds.builder()
                .minX(envelope.getMinX())
                .minY(envelope.getMinY())
                .maxX(envelope.getMaxX())
                .maxY(envelope.getMaxY())
                .build();
    }
    
    public double getWidth() {
        return maxX - minX;
    }
    
    public double getHeight() {
        return maxY - minY;
    }
}
