package com.buildingsync.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Summary of one fetch → diff → cache update → notify cycle
 */
@Value
@Builder
public class SyncCycleResult {
    
    long cycle;
    Instant completedAt;
    int totalRecords;
    int acceptedRecords;
    long skippedRecords;
    
    /** Changes applied to the cache and announced to listeners */
    List<ChangeRecord> changes;
    
    /** Buildings absent from this payload */
    List<ChangeRecord> removed;
    
    /** Whether REMOVED buildings were evicted from the cache */
    boolean removedEvicted;
    
    List<SyncWarning> warnings;
    
    /**
     * Whether this cycle counts as activity for the polling rate
     */
    public boolean hasChanges() {
        return !changes.isEmpty() || (removedEvicted && !removed.isEmpty());
    }
}
