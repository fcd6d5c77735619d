package com.buildingsync.poller;

import com.buildingsync.model.polling.CycleOutcome;
import com.buildingsync.model.polling.PollingMode;
import com.buildingsync.model.polling.PollingState;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class PollingStrategyTest {
    
    private static final Duration FAST = Duration.ofSeconds(1);
    private static final Duration SLOW = Duration.ofSeconds(5);
    private static final Instant T0 = Instant.parse("2024-05-01T12:00:00Z");
    
    private final PollingStrategy strategy = new PollingStrategy(FAST, SLOW, 10, true);
    
    @Test
    void testInitialStateIsFast() {
        PollingState state = strategy.initial();
        
        assertEquals(PollingMode.FAST, state.getMode());
        assertEquals(FAST, state.getInterval());
        assertEquals(0, state.getConsecutiveNoChangeCount());
        assertNull(state.getLastFetchTimestamp());
    }
    
    @Test
    void testSlowsDownAfterQuietThreshold() {
        PollingState state = strategy.initial();
        for (int i = 1; i < 10; i++) {
            state = strategy.next(state, CycleOutcome.NO_CHANGES, T0.plusSeconds(i));
            assertEquals(PollingMode.FAST, state.getMode(), "cycle " + i);
        }
        
        state = strategy.next(state, CycleOutcome.NO_CHANGES, T0.plusSeconds(10));
        
        assertEquals(PollingMode.SLOW, state.getMode());
        assertEquals(SLOW, state.getInterval());
        assertEquals(10, state.getConsecutiveNoChangeCount());
        assertEquals(T0.plusSeconds(10), state.getLastFetchTimestamp());
    }
    
    @Test
    void testChangesReturnToFast() {
        PollingState state = strategy.initial();
        for (int i = 0; i < 15; i++) {
            state = strategy.next(state, CycleOutcome.NO_CHANGES, T0);
        }
        assertEquals(PollingMode.SLOW, state.getMode());
        
        state = strategy.next(state, CycleOutcome.CHANGES, T0);
        
        assertEquals(PollingMode.FAST, state.getMode());
        assertEquals(FAST, state.getInterval());
        assertEquals(0, state.getConsecutiveNoChangeCount());
    }
    
    @Test
    void testMalformedPayloadCountsAsQuiet() {
        PollingState state = strategy.next(strategy.initial(), CycleOutcome.MALFORMED_PAYLOAD, T0);
        
        assertEquals(1, state.getConsecutiveNoChangeCount());
    }
    
    @Test
    void testTransportFailureLeavesStateUnchanged() {
        PollingState state = strategy.next(strategy.initial(), CycleOutcome.NO_CHANGES, T0);
        
        PollingState after = strategy.next(state, CycleOutcome.TRANSPORT_FAILURE, T0.plusSeconds(1));
        
        assertSame(state, after);
    }
    
    @Test
    void testNonAdaptiveStaysFast() {
        PollingStrategy fixed = new PollingStrategy(FAST, SLOW, 2, false);
        PollingState state = fixed.initial();
        for (int i = 0; i < 5; i++) {
            state = fixed.next(state, CycleOutcome.NO_CHANGES, T0);
        }
        
        assertEquals(PollingMode.FAST, state.getMode());
        assertEquals(5, state.getConsecutiveNoChangeCount());
    }
    
    @Test
    void testQuietCountSaturates() {
        PollingState state = strategy.initial().toBuilder().consecutiveNoChangeCount(Integer.MAX_VALUE).build();
        
        state = strategy.next(state, CycleOutcome.NO_CHANGES, T0);
        
        assertEquals(Integer.MAX_VALUE, state.getConsecutiveNoChangeCount());
    }
    
    @Test
    void testRejectsInvalidConfiguration() {
        assertThrows(IllegalArgumentException.class, () -> new PollingStrategy(Duration.ZERO, SLOW, 10, true));
        assertThrows(IllegalArgumentException.class, () -> new PollingStrategy(SLOW, FAST, 10, true));
        assertThrows(IllegalArgumentException.class, () -> new PollingStrategy(FAST, SLOW, 0, true));
    }
}
