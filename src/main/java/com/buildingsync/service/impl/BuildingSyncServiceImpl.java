package com.buildingsync.service.impl;

import com.buildingsync.aspect.Timed;
import com.buildingsync.config.BuildingSyncProperties;
import com.buildingsync.exception.MalformedPayloadException;
import com.buildingsync.loader.BuildingRecordParser;
import com.buildingsync.model.Building;
import com.buildingsync.model.CacheStatistics;
import com.buildingsync.model.ChangeKind;
import com.buildingsync.model.ChangeNotification;
import com.buildingsync.model.ChangeRecord;
import com.buildingsync.model.DiffResult;
import com.buildingsync.model.ParsedPayload;
import com.buildingsync.model.PickResolution;
import com.buildingsync.model.SyncCycleResult;
import com.buildingsync.model.SyncWarning;
import com.buildingsync.repository.EntityCache;
import com.buildingsync.repository.IdentityResolver;
import com.buildingsync.service.BuildingSyncService;
import com.buildingsync.service.ChangeNotifier;
import com.buildingsync.service.Differencer;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.locationtech.jts.geom.Coordinate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Implementation of BuildingSyncService: parse, diff against the cache, apply,
 * then notify. The entity cache stays the single source of truth.
 */
@Service
public class BuildingSyncServiceImpl implements BuildingSyncService {
    
    private static final Logger logger = LoggerFactory.getLogger(BuildingSyncServiceImpl.class);
    
    @Autowired
    BuildingRecordParser recordParser;
    
    @Autowired
    Differencer differencer;
    
    @Autowired
    EntityCache entityCache;
    
    @Autowired
    IdentityResolver identityResolver;
    
    @Autowired
    ChangeNotifier changeNotifier;
    
    @Autowired
    BuildingSyncProperties properties;
    
    @Autowired
    Clock clock;
    
    private final MeterRegistry meterRegistry;
    private final Counter skippedRecordCounter;
    private final Counter keyConflictCounter;
    private final Timer cycleTimer;
    
    private final AtomicLong cycles = new AtomicLong();
    private volatile SyncCycleResult lastResult;
    
    public BuildingSyncServiceImpl(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.skippedRecordCounter = Counter.builder("building_sync.records.skipped")
                .description("Records skipped as malformed")
                .register(meterRegistry);
        this.keyConflictCounter = Counter.builder("building_sync.key_mapping.conflicts")
                .description("Derived keys that disagreed with a confirmed mapping")
                .register(meterRegistry);
        this.cycleTimer = Timer.builder("building_sync.cycle.duration")
                .description("Diff, cache update and notify time per cycle")
                .register(meterRegistry);
    }
    
    @Override
    @Timed(value = "sync cycle", logLevel = Timed.LogLevel.DEBUG)
    public synchronized SyncCycleResult processPayload(String payload) throws MalformedPayloadException {
        Timer.Sample sample = Timer.start(meterRegistry);
        long cycle = cycles.incrementAndGet();
        try {
            ParsedPayload parsed;
            try {
                parsed = recordParser.parse(payload);
            } catch (MalformedPayloadException e) {
                countCycle("malformed_payload");
                logger.warn("Cycle {}: malformed payload, cache left untouched: {}", cycle, e.getMessage());
                throw e;
            }
            
            DiffResult diff = differencer.diff(entityCache.snapshotMap(), parsed.getBuildings());
            List<ChangeRecord> changes = diff.getChanges();
            for (ChangeRecord change : changes) {
                entityCache.upsert(diff.getIncoming().get(change.getKey()));
            }
            
            List<ChangeRecord> removed = diff.getRemoved();
            boolean evict = properties.getCache().isEvictMissing();
            if (evict) {
                removed.forEach(r -> entityCache.remove(r.getKey()));
            }
            
            List<SyncWarning> warnings = new ArrayList<>(parsed.getWarnings());
            warnings.addAll(diff.getWarnings());
            logWarnings(cycle, diff.getWarnings());
            
            SyncCycleResult result = SyncCycleResult.builder()
                    .cycle(cycle)
                    .completedAt(Instant.now(clock))
                    .totalRecords(parsed.getTotalRecords())
                    .acceptedRecords(parsed.getBuildings().size())
                    .skippedRecords(parsed.getSkippedRecords()
                            + diff.getWarnings().stream().filter(SyncWarning::isSkip).count())
                    .changes(changes)
                    .removed(removed)
                    .removedEvicted(evict)
                    .warnings(warnings)
                    .build();
            
            publish(result);
            recordMetrics(result);
            lastResult = result;
            
            if (result.hasChanges()) {
                logger.info("Cycle {}: {} new, {} attribute, {} color change(s), {} removed{}", cycle,
                        diff.count(ChangeKind.NEW), diff.count(ChangeKind.ATTRIBUTE_CHANGED),
                        diff.count(ChangeKind.COLOR_CHANGED), removed.size(), evict ? " (evicted)" : "");
            } else {
                logger.debug("Cycle {}: no changes across {} records", cycle, parsed.getTotalRecords());
            }
            return result;
        } finally {
            sample.stop(cycleTimer);
        }
    }
    
    @Override
    @Timed("ingest")
    public SyncCycleResult ingest(String payload) throws MalformedPayloadException {
        return processPayload(payload);
    }
    
    @Override
    public void recordTransportFailure(Exception cause) {
        countCycle("transport_failure");
        logger.warn("Fetch failed, polling state unchanged: {}", cause.getMessage());
    }
    
    private void publish(SyncCycleResult result) {
        List<ChangeRecord> announced = new ArrayList<>(result.getChanges());
        if (result.isRemovedEvicted()) {
            announced.addAll(result.getRemoved());
        }
        if (!announced.isEmpty()) {
            changeNotifier.publish(ChangeNotification.of(result.getCycle(), result.getCompletedAt(), announced));
        }
    }
    
    private void recordMetrics(SyncCycleResult result) {
        countCycle(result.hasChanges() ? "changes" : "no_changes");
        for (ChangeRecord change : result.getChanges()) {
            meterRegistry.counter("building_sync.changes", "kind", change.getKind().name().toLowerCase(Locale.ROOT)).increment();
        }
        if (!result.getRemoved().isEmpty()) {
            meterRegistry.counter("building_sync.changes", "kind", "removed").increment(result.getRemoved().size());
        }
        skippedRecordCounter.increment(result.getSkippedRecords());
        keyConflictCounter.increment(result.getWarnings().stream()
                .filter(w -> w.getKind() == SyncWarning.Kind.AMBIGUOUS_KEY_MAPPING)
                .count());
    }
    
    private void countCycle(String outcome) {
        meterRegistry.counter("building_sync.cycles", "outcome", outcome).increment();
    }
    
    private void logWarnings(long cycle, List<SyncWarning> warnings) {
        for (SyncWarning warning : warnings) {
            logger.warn("Cycle {}: {} for {} - {}", cycle, warning.getKind(), warning.getKey(), warning.getMessage());
        }
    }
    
    @Override
    public Optional<Building> findByAnyKey(String key) {
        return entityCache.getByAnyKey(key);
    }
    
    @Override
    public Optional<Building> findByPoint(Coordinate point) {
        return entityCache.getByPoint(point);
    }
    
    @Override
    public Optional<Building> findByCoordinateHash(String hash) {
        return entityCache.getByCoordinateHash(hash);
    }
    
    @Override
    public PickResolution resolvePick(String claimedKey, Coordinate point) {
        Optional<Building> claimed = entityCache.getByAnyKey(claimedKey);
        if (claimed.isPresent() && point != null && claimed.get().covers(point)) {
            return PickResolution.of(PickResolution.Strategy.CLAIMED_VALIDATED, claimed.get());
        }
        
        if (point != null) {
            Optional<Building> spatial = entityCache.getByPoint(point);
            if (spatial.isPresent()) {
                logger.debug("Pick for {} resolved spatially to {}", claimedKey, spatial.get().getId());
                return PickResolution.of(PickResolution.Strategy.SPATIAL, spatial.get());
            }
        }
        
        return claimed.map(b -> PickResolution.of(PickResolution.Strategy.IDENTIFIER, b))
                .orElseGet(PickResolution::notFound);
    }
    
    @Override
    public Optional<String> canonicalKey(String key) {
        if (key == null || key.isEmpty()) {
            return Optional.empty();
        }
        if (entityCache.get(key).isPresent()) {
            return Optional.of(key);
        }
        return identityResolver.resolve(key);
    }
    
    @Override
    public CacheStatistics statistics() {
        return entityCache.statistics();
    }
    
    @Override
    public synchronized void invalidate() {
        entityCache.clear();
        lastResult = null;
    }
    
    @Override
    public long getCycleCount() {
        return cycles.get();
    }
    
    @Override
    public Optional<SyncCycleResult> getLastResult() {
        return Optional.ofNullable(lastResult);
    }
}
