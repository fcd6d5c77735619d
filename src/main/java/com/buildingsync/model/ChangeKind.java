package com.buildingsync.model;

/**
 * Classification of one building between two consecutive fetches
 */
public enum ChangeKind {
    NEW,
    ATTRIBUTE_CHANGED,
    COLOR_CHANGED,
    UNCHANGED,
    /** Present in the previous snapshot but missing from the latest payload */
    REMOVED;
    
    /**
     * Whether this kind describes new or modified data in the latest payload
     */
    public boolean isModification() {
        return this == NEW || this == ATTRIBUTE_CHANGED || this == COLOR_CHANGED;
    }
}
