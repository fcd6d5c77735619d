package com.buildingsync.repository.impl;

import com.buildingsync.aspect.Timed;
import com.buildingsync.model.Footprint;
import com.buildingsync.repository.SpatialIndex;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.index.quadtree.Quadtree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Implementation of SpatialIndex using a JTS Quadtree over footprint envelopes.
 * The quadtree supports removal, so a re-indexed building only touches its own entry.
 */
@Repository
public class SpatialIndexImpl implements SpatialIndex {
    
    private static final Logger logger = LoggerFactory.getLogger(SpatialIndexImpl.class);
    
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    
    // Quadtree is not thread-safe; guarded by lock
    private final Quadtree tree = new Quadtree();
    
    // Single source of truth for stored footprints
    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    
    @Override
    public void index(String key, Footprint footprint) {
        if (key == null) {
            return;
        }
        Footprint value = footprint != null ? footprint : Footprint.empty();
        Entry entry = new Entry(key, value);
        
        lock.writeLock().lock();
        try {
            Entry previous = entries.put(key, entry);
            if (previous != null && previous.isMatchable()) {
                tree.remove(previous.envelope, previous);
            }
            if (entry.isMatchable()) {
                tree.insert(entry.envelope, entry);
            }
        } finally {
            lock.writeLock().unlock();
        }
        
        if (!entry.isMatchable()) {
            logger.debug("Footprint of {} stored but not resolvable ({})", key, value);
        }
    }
    
    @Override
    public void remove(String key) {
        if (key == null) {
            return;
        }
        lock.writeLock().lock();
        try {
            Entry previous = entries.remove(key);
            if (previous != null && previous.isMatchable()) {
                tree.remove(previous.envelope, previous);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }
    
    @Override
    @Timed("spatial resolve")
    public Optional<String> resolve(Coordinate point, double tolerance) {
        if (point == null || Double.isNaN(point.x) || Double.isNaN(point.y)) {
            return Optional.empty();
        }
        double reach = Math.max(0.0, tolerance);
        Envelope search = new Envelope(point.x - reach, point.x + reach, point.y - reach, point.y + reach);
        Envelope pointEnvelope = new Envelope(point.x, point.x, point.y, point.y);
        
        List<Entry> candidates = new ArrayList<>();
        lock.readLock().lock();
        try {
            for (Object item : tree.query(search)) {
                Entry entry = (Entry) item;
                if (isCandidate(entry.envelope, pointEnvelope, reach)) {
                    candidates.add(entry);
                }
            }
        } finally {
            lock.readLock().unlock();
        }
        
        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        candidates.sort(TIGHTEST_FIRST);
        
        for (Entry candidate : candidates) {
            if (candidate.footprint.contains(point)) {
                return Optional.of(candidate.key);
            }
        }
        return Optional.of(candidates.get(0).key);
    }
    
    /**
     * Strictly closer than the tolerance, or inside the box
     */
    private static boolean isCandidate(Envelope box, Envelope pointEnvelope, double tolerance) {
        if (box.covers(pointEnvelope)) {
            return true;
        }
        return box.distance(pointEnvelope) < tolerance;
    }
    
    @Override
    public boolean contains(String key, Coordinate point) {
        Entry entry = key != null ? entries.get(key) : null;
        return entry != null && entry.isMatchable() && entry.footprint.contains(point);
    }
    
    @Override
    public Optional<Envelope> bounds(String key) {
        Entry entry = key != null ? entries.get(key) : null;
        if (entry == null || entry.envelope.isNull()) {
            return Optional.empty();
        }
        return Optional.of(new Envelope(entry.envelope));
    }
    
    @Override
    public int size() {
        return entries.size();
    }
    
    @Override
    public int unresolvableCount() {
        return (int) entries.values().stream().filter(e -> !e.isMatchable()).count();
    }
    
    @Override
    public Envelope extent() {
        Envelope extent = new Envelope();
        for (Entry entry : entries.values()) {
            if (entry.isMatchable()) {
                extent.expandToInclude(entry.envelope);
            }
        }
        return extent;
    }
    
    @Override
    public void clear() {
        lock.writeLock().lock();
        try {
            for (Entry entry : entries.values()) {
                if (entry.isMatchable()) {
                    tree.remove(entry.envelope, entry);
                }
            }
            entries.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }
    
    private static final Comparator<Entry> TIGHTEST_FIRST = Comparator
            .comparingDouble((Entry e) -> e.envelope.getArea())
            .thenComparing(e -> e.key);
    
    private static final class Entry {
        final String key;
        final Footprint footprint;
        final Envelope envelope;
        
        Entry(String key, Footprint footprint) {
            this.key = key;
            this.footprint = footprint;
            this.envelope = footprint.getEnvelope();
        }
        
        boolean isMatchable() {
            return footprint.isUsable();
        }
    }
}
