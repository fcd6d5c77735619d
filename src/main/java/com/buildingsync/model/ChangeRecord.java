package com.buildingsync.model;

import lombok.Value;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Per-building outcome of one diff cycle. Never kept beyond that cycle.
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ChangeRecord {
    
    String key;
    ChangeKind kind;
    
    @JsonIgnore
    String previousSnapshot;
    
    public static ChangeRecord of(String key, ChangeKind kind, String previousSnapshot) {
        return new ChangeRecord(key, kind, previousSnapshot);
    }
}
