package com.buildingsync.model;

/**
 * Where a primary/secondary key association came from.
 * Declaration order is rank: a later constant outranks an earlier one.
 */
public enum KeySource {
    HEURISTIC,
    CONFIRMED;
    
    public boolean outranks(KeySource other) {
        return other == null || compareTo(other) > 0;
    }
}
