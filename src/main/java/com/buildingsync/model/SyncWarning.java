package com.buildingsync.model;

import lombok.Value;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Non-fatal problem found while ingesting a payload
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SyncWarning {
    
    public enum Kind {
        /** Record skipped entirely */
        MALFORMED_RECORD,
        /** Record kept with the default color */
        INVALID_COLOR,
        /** Record kept without a usable footprint */
        INVALID_GEOMETRY,
        /** Derived key disagrees with a source-confirmed mapping */
        AMBIGUOUS_KEY_MAPPING
    }
    
    Kind kind;
    String key;
    int recordIndex;
    String message;
    
    public static SyncWarning of(Kind kind, String key, int recordIndex, String message) {
        return new SyncWarning(kind, key, recordIndex, message);
    }
    
    public boolean isSkip() {
        return kind == Kind.MALFORMED_RECORD;
    }
}
