package com.buildingsync.model;

import lombok.Value;

/**
 * Bidirectional association between the two identifier formats of one building
 */
@Value
public class KeyMapping {
    
    String primaryKey;
    String secondaryKey;
    KeySource source;
    
    public static KeyMapping confirmed(String primaryKey, String secondaryKey) {
        return new KeyMapping(primaryKey, secondaryKey, KeySource.CONFIRMED);
    }
    
    public static KeyMapping heuristic(String primaryKey, String secondaryKey) {
        return new KeyMapping(primaryKey, secondaryKey, KeySource.HEURISTIC);
    }
    
    public boolean isConfirmed() {
        return source == KeySource.CONFIRMED;
    }
}
