package com.buildingsync.model;

import lombok.Value;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pushed to change listeners after every cycle that changed at least one building
 */
@Value
public class ChangeNotification {
    
    long cycle;
    Instant timestamp;
    List<String> keys;
    Map<String, ChangeKind> kinds;
    
    public static ChangeNotification of(long cycle, Instant timestamp, List<ChangeRecord> changes) {
        Map<String, ChangeKind> kinds = new LinkedHashMap<>();
        for (ChangeRecord change : changes) {
            kinds.put(change.getKey(), change.getKind());
        }
        return new ChangeNotification(cycle, timestamp,
                List.copyOf(kinds.keySet()), Collections.unmodifiableMap(kinds));
    }
}
