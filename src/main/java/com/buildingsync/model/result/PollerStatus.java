package com.buildingsync.model.result;

import com.buildingsync.model.polling.CycleOutcome;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Read-only view of the poller for the REST layer
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PollerStatus {
    
    /** FAST, SLOW or STOPPED */
    String state;
    double intervalSeconds;
    int consecutiveNoChangeCount;
    Instant lastFetchTimestamp;
    boolean inFlight;
    long cycles;
    CycleOutcome lastOutcome;
}
