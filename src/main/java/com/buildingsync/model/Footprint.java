package com.buildingsync.model;

import com.buildingsync.config.serializer.FootprintSerializer;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.locationtech.jts.algorithm.RayCrossingCounter;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Location;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Polygon ground outline of a building, possibly made of several rings.
 * <p>
 * Containment uses the even-odd rule over all rings together, so inner rings
 * act as holes. Rings with fewer than 3 vertices never contribute to containment,
 * and a footprint without any such ring is not usable for spatial resolution.
 * Instances are immutable.
 */
@JsonSerialize(using = FootprintSerializer.class)
public final class Footprint {
    
    public static final int MIN_RING_VERTICES = 3;
    
    private static final Footprint EMPTY = new Footprint(Collections.emptyList());
    
    private final List<List<Coordinate>> rings;
    private final Envelope envelope;
    private final boolean usable;
    private final int vertexCount;
    
    private Footprint(List<List<Coordinate>> rings) {
        List<List<Coordinate>> copy = new ArrayList<>(rings.size());
        Envelope env = new Envelope();
        boolean hasPolygonRing = false;
        int vertices = 0;
        for (List<Coordinate> ring : rings) {
            if (ring == null || ring.isEmpty()) {
                continue;
            }
            List<Coordinate> ringCopy = new ArrayList<>(ring.size());
            for (Coordinate c : ring) {
                ringCopy.add(new Coordinate(c));
                env.expandToInclude(c);
            }
            vertices += ringCopy.size();
            if (openVertexCount(ringCopy) >= MIN_RING_VERTICES) {
                hasPolygonRing = true;
            }
            copy.add(Collections.unmodifiableList(ringCopy));
        }
        this.rings = Collections.unmodifiableList(copy);
        this.envelope = env;
        this.usable = hasPolygonRing;
        this.vertexCount = vertices;
    }
    
    public static Footprint empty() {
        return EMPTY;
    }
    
    public static Footprint of(List<List<Coordinate>> rings) {
        if (rings == null || rings.isEmpty()) {
            return EMPTY;
        }
        return new Footprint(rings);
    }
    
    public static Footprint ofRing(List<Coordinate> ring) {
        return of(List.of(ring));
    }
    
    public List<List<Coordinate>> getRings() {
        return rings;
    }
    
    /**
     * Axis-aligned bounding box of all vertices. Null envelope when empty.
     */
    public Envelope getEnvelope() {
        return new Envelope(envelope);
    }
    
    public boolean isEmpty() {
        return rings.isEmpty();
    }
    
    /**
     * Whether at least one ring can enclose an area
     */
    public boolean isUsable() {
        return usable;
    }
    
    public int getVertexCount() {
        return vertexCount;
    }
    
    /**
     * Center of the bounding box, or null when empty
     */
    public Coordinate getCenter() {
        return envelope.isNull() ? null : envelope.centre();
    }
    
    /**
     * Even-odd ray casting over every ring. Points on an edge count as inside.
     */
    public boolean contains(Coordinate point) {
        if (!usable || point == null || Double.isNaN(point.x) || Double.isNaN(point.y)) {
            return false;
        }
        if (!envelope.covers(point.x, point.y)) {
            return false;
        }
        
        Coordinate p = new Coordinate(point.x, point.y);
        RayCrossingCounter counter = new RayCrossingCounter(p);
        for (List<Coordinate> ring : rings) {
            int n = openVertexCount(ring);
            if (n < MIN_RING_VERTICES) {
                continue;
            }
            for (int i = 0; i < n; i++) {
                Coordinate a = ring.get(i);
                Coordinate b = ring.get((i + 1) % n);
                counter.countSegment(flat(a), flat(b));
                if (counter.isOnSegment()) {
                    return true;
                }
            }
        }
        return counter.getLocation() == Location.INTERIOR;
    }
    
    /**
     * Number of vertices ignoring an explicit closing vertex
     */
    private static int openVertexCount(List<Coordinate> ring) {
        int n = ring.size();
        if (n > 1 && ring.get(0).equals2D(ring.get(n - 1))) {
            n--;
        }
        return n;
    }
    
    private static Coordinate flat(Coordinate c) {
        return new Coordinate(c.x, c.y);
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Footprint)) return false;
        Footprint other = (Footprint) o;
        if (rings.size() != other.rings.size()) return false;
        for (int i = 0; i < rings.size(); i++) {
            List<Coordinate> a = rings.get(i);
            List<Coordinate> b = other.rings.get(i);
            if (a.size() != b.size()) return false;
            for (int j = 0; j < a.size(); j++) {
                if (!a.get(j).equals2D(b.get(j))) return false;
            }
        }
        return true;
    }
    
    @Override
    public int hashCode() {
        int hash = 1;
        for (List<Coordinate> ring : rings) {
            for (Coordinate c : ring) {
                hash = 31 * hash + Objects.hash(c.x, c.y);
            }
        }
        return hash;
    }
    
    @Override
    public String toString() {
        return String.format("Footprint{rings=%d, vertices=%d, usable=%s}", rings.size(), vertexCount, usable);
    }
}
