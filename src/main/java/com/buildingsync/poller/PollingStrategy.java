package com.buildingsync.poller;

import com.buildingsync.model.polling.CycleOutcome;
import com.buildingsync.model.polling.PollingMode;
import com.buildingsync.model.polling.PollingState;

import java.time.Duration;
import java.time.Instant;

/**
 * Pure transition function of the adaptive poll-rate state machine.
 * <p>
 * Any cycle with changes returns to FAST and resets the quiet count. Quiet cycles
 * (including malformed payloads) increment the count, and once it reaches the
 * threshold the machine moves to SLOW. Transport failures leave the state as is.
 */
public class PollingStrategy {
    
    private final Duration fastInterval;
    private final Duration slowInterval;
    private final int quietCyclesBeforeSlowdown;
    private final boolean adaptive;
    
    public PollingStrategy(Duration fastInterval, Duration slowInterval, int quietCyclesBeforeSlowdown, boolean adaptive) {
        if (fastInterval == null || fastInterval.isNegative() || fastInterval.isZero()) {
            throw new IllegalArgumentException("fast interval must be positive");
        }
        if (slowInterval == null || slowInterval.compareTo(fastInterval) < 0) {
            throw new IllegalArgumentException("slow interval must not be shorter than the fast interval");
        }
        if (quietCyclesBeforeSlowdown < 1) {
            throw new IllegalArgumentException("quiet cycles before slowdown must be at least 1");
        }
        this.fastInterval = fastInterval;
        this.slowInterval = slowInterval;
        this.quietCyclesBeforeSlowdown = quietCyclesBeforeSlowdown;
        this.adaptive = adaptive;
    }
    
    public PollingState initial() {
        return PollingState.builder()
                .mode(PollingMode.FAST)
                .interval(fastInterval)
                .consecutiveNoChangeCount(0)
                .build();
    }
    
    public PollingState next(PollingState state, CycleOutcome outcome, Instant fetchedAt) {
        switch (outcome) {
            case TRANSPORT_FAILURE:
                return state;
            case CHANGES:
                return state.toBuilder()
                        .mode(PollingMode.FAST)
                        .interval(fastInterval)
                        .consecutiveNoChangeCount(0)
                        .lastFetchTimestamp(fetchedAt)
                        .build();
            case NO_CHANGES:
            case MALFORMED_PAYLOAD:
            default:
                int quiet = state.getConsecutiveNoChangeCount() == Integer.MAX_VALUE
                        ? Integer.MAX_VALUE
                        : state.getConsecutiveNoChangeCount() + 1;
                PollingMode mode = state.getMode();
                if (adaptive && quiet >= quietCyclesBeforeSlowdown) {
                    mode = PollingMode.SLOW;
                }
                return state.toBuilder()
                        .mode(mode)
                        .interval(mode == PollingMode.SLOW ? slowInterval : fastInterval)
                        .consecutiveNoChangeCount(quiet)
                        .lastFetchTimestamp(fetchedAt)
                        .build();
        }
    }
    
    public Duration getFastInterval() {
        return fastInterval;
    }
    
    public Duration getSlowInterval() {
        return slowInterval;
    }
    
    public int getQuietCyclesBeforeSlowdown() {
        return quietCyclesBeforeSlowdown;
    }
    
    public boolean isAdaptive() {
        return adaptive;
    }
}
