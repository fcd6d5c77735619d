package com.buildingsync.model;

import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Output of one diff: a record per incoming building in encounter order,
 * followed by REMOVED records for buildings missing from the payload.
 */
@Value
public class DiffResult {
    
    List<ChangeRecord> records;
    
    /** Incoming buildings by canonical key, encounter order */
    Map<String, Building> incoming;
    
    List<SyncWarning> warnings;
    
    /**
     * Records describing new or modified buildings
     */
    public List<ChangeRecord> getChanges() {
        return records.stream()
                .filter(r -> r.getKind().isModification())
                .collect(Collectors.toList());
    }
    
    public List<ChangeRecord> getRemoved() {
        return records.stream()
                .filter(r -> r.getKind() == ChangeKind.REMOVED)
                .collect(Collectors.toList());
    }
    
    public long count(ChangeKind kind) {
        return records.stream().filter(r -> r.getKind() == kind).count();
    }
}
