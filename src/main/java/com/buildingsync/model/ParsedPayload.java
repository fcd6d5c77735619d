package com.buildingsync.model;

import lombok.Value;

import java.util.List;

/**
 * Buildings extracted from one raw payload, in payload order, plus per-record warnings
 */
@Value
public class ParsedPayload {
    
    int totalRecords;
    List<Building> buildings;
    List<SyncWarning> warnings;
    
    public long getSkippedRecords() {
        return warnings.stream().filter(SyncWarning::isSkip).count();
    }
}
