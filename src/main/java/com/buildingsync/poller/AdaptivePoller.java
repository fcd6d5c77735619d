package com.buildingsync.poller;

import com.buildingsync.config.BuildingSyncProperties;
import com.buildingsync.exception.MalformedPayloadException;
import com.buildingsync.fetcher.BuildingDataFetcher;
import com.buildingsync.fetcher.TransportException;
import com.buildingsync.model.SyncCycleResult;
import com.buildingsync.model.polling.CycleOutcome;
import com.buildingsync.model.polling.PollingState;
import com.buildingsync.model.result.PollerStatus;
import com.buildingsync.service.BuildingSyncService;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Drives fetch, diff, cache update and notify on a fast or slow cadence.
 * <p>
 * The next cycle is scheduled only when the previous one has completed, so cycles
 * never overlap. A tick that finds another cycle in flight is deferred until that
 * cycle completes. Each {@link #start()} and {@link #stop()} opens a new
 * generation; work belonging to an older generation is discarded before it
 * reaches the cache.
 */
@Component
@Slf4j
public class AdaptivePoller {
    
    private final BuildingDataFetcher fetcher;
    private final BuildingSyncService syncService;
    private final TaskScheduler taskScheduler;
    private final PollingStrategy strategy;
    private final BuildingSyncProperties properties;
    private final Clock clock;
    
    private final AtomicBoolean active = new AtomicBoolean();
    private final AtomicBoolean inFlight = new AtomicBoolean();
    private final AtomicLong generation = new AtomicLong();
    private final AtomicLong completedCycles = new AtomicLong();
    
    // guards next, deferredGeneration, the in-flight hand-off and state transitions
    private final Object scheduleLock = new Object();
    private ScheduledFuture<?> next;
    private long deferredGeneration;
    
    private volatile PollingState state;
    private volatile CycleOutcome lastOutcome;
    
    public AdaptivePoller(BuildingDataFetcher fetcher, BuildingSyncService syncService, TaskScheduler taskScheduler,
                          PollingStrategy strategy, BuildingSyncProperties properties, Clock clock) {
        this.fetcher = fetcher;
        this.syncService = syncService;
        this.taskScheduler = taskScheduler;
        this.strategy = strategy;
        this.properties = properties;
        this.clock = clock;
        this.state = strategy.initial();
    }
    
    @EventListener(ApplicationReadyEvent.class)
    public void startOnReady() {
        if (properties.getPolling().isEnabled()) {
            start();
        } else {
            log.info("Polling disabled; use POST /api/v1/poller/start to begin");
        }
    }
    
    /**
     * Enter FAST with a zero quiet count and fetch immediately
     */
    public void start() {
        synchronized (scheduleLock) {
            long gen = generation.incrementAndGet();
            cancelNext();
            state = strategy.initial();
            lastOutcome = null;
            active.set(true);
            scheduleAfter(gen, Duration.ZERO);
        }
        log.info("Poller started: fast {}s, slow {}s, slowdown after {} quiet cycles{}",
                seconds(strategy.getFastInterval()), seconds(strategy.getSlowInterval()),
                strategy.getQuietCyclesBeforeSlowdown(), strategy.isAdaptive() ? "" : " (adaptive off)");
    }
    
    /**
     * Cancel the scheduled fetch. A fetch already running completes but its result is dropped.
     */
    @PreDestroy
    public void stop() {
        boolean wasActive;
        synchronized (scheduleLock) {
            wasActive = active.getAndSet(false);
            generation.incrementAndGet();
            cancelNext();
        }
        if (wasActive) {
            log.info("Poller stopped after {} cycles", completedCycles.get());
        }
    }
    
    /**
     * Run a cycle now instead of waiting for the timer
     *
     * @return false when stopped or a cycle is in flight
     */
    public boolean refreshNow() {
        if (!active.get() || inFlight.get()) {
            return false;
        }
        synchronized (scheduleLock) {
            if (!active.get()) {
                return false;
            }
            cancelNext();
            scheduleAfter(generation.get(), Duration.ZERO);
        }
        log.debug("Forced refresh scheduled");
        return true;
    }
    
    void pollOnce(long gen) {
        synchronized (scheduleLock) {
            if (!isCurrent(gen)) {
                return;
            }
            if (inFlight.get()) {
                // picked up by the finishing cycle
                deferredGeneration = gen;
                log.debug("Previous cycle still in flight, deferring this tick");
                return;
            }
            inFlight.set(true);
        }
        CycleOutcome outcome = null;
        try {
            outcome = runCycle(gen);
        } catch (RuntimeException e) {
            log.error("Unexpected failure in poll cycle, polling state unchanged", e);
        } finally {
            complete(gen, outcome);
        }
    }
    
    /**
     * @return the outcome, or null when the result was discarded
     */
    private CycleOutcome runCycle(long gen) {
        String payload;
        try {
            payload = fetcher.fetch();
        } catch (TransportException e) {
            syncService.recordTransportFailure(e);
            return CycleOutcome.TRANSPORT_FAILURE;
        }
        
        if (!isCurrent(gen)) {
            log.debug("Poller stopped during fetch, discarding payload");
            return null;
        }
        
        try {
            SyncCycleResult result = syncService.processPayload(payload);
            return result.hasChanges() ? CycleOutcome.CHANGES : CycleOutcome.NO_CHANGES;
        } catch (MalformedPayloadException e) {
            return CycleOutcome.MALFORMED_PAYLOAD;
        }
    }
    
    private void complete(long gen, CycleOutcome outcome) {
        synchronized (scheduleLock) {
            inFlight.set(false);
            long deferred = deferredGeneration;
            deferredGeneration = 0;
            if (!isCurrent(gen)) {
                // a restart during this cycle left its first tick waiting on us
                if (deferred != 0 && isCurrent(deferred)) {
                    scheduleAfter(deferred, Duration.ZERO);
                }
                return;
            }
            if (outcome != null) {
                PollingState previous = state;
                state = strategy.next(previous, outcome, Instant.now(clock));
                lastOutcome = outcome;
                completedCycles.incrementAndGet();
                if (previous.getMode() != state.getMode()) {
                    log.info("Polling {} -> {} (interval {}s, quiet cycles {})", previous.getMode(), state.getMode(),
                            seconds(state.getInterval()), state.getConsecutiveNoChangeCount());
                }
            }
            scheduleAfter(gen, state.getInterval());
        }
    }
    
    private void scheduleAfter(long gen, Duration delay) {
        next = taskScheduler.schedule(() -> pollOnce(gen), Instant.now(clock).plus(delay));
    }
    
    private void cancelNext() {
        if (next != null) {
            next.cancel(false);
            next = null;
        }
    }
    
    private boolean isCurrent(long gen) {
        return active.get() && generation.get() == gen;
    }
    
    private static double seconds(Duration duration) {
        return duration.toMillis() / 1000.0;
    }
    
    public PollingState getState() {
        return state;
    }
    
    public boolean isActive() {
        return active.get();
    }
    
    public boolean isInFlight() {
        return inFlight.get();
    }
    
    public CycleOutcome getLastOutcome() {
        return lastOutcome;
    }
    
    public PollerStatus getStatus() {
        PollingState current = state;
        return PollerStatus.builder()
                .state(active.get() ? current.getMode().name() : "STOPPED")
                .intervalSeconds(seconds(current.getInterval()))
                .consecutiveNoChangeCount(current.getConsecutiveNoChangeCount())
                .lastFetchTimestamp(current.getLastFetchTimestamp())
                .inFlight(inFlight.get())
                .cycles(completedCycles.get())
                .lastOutcome(lastOutcome)
                .build();
    }
}
