package com.buildingsync.model.polling;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * Single-owner poll-rate state. Replaced, never mutated, after each cycle.
 */
@Value
@Builder(toBuilder = true)
public class PollingState {
    
    PollingMode mode;
    Duration interval;
    int consecutiveNoChangeCount;
    
    /** Null until the first fetch completes */
    Instant lastFetchTimestamp;
}
