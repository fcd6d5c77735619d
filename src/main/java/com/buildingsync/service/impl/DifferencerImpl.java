package com.buildingsync.service.impl;

import com.buildingsync.model.Building;
import com.buildingsync.model.ChangeKind;
import com.buildingsync.model.ChangeRecord;
import com.buildingsync.model.DiffResult;
import com.buildingsync.model.KeyMapping;
import com.buildingsync.model.SyncWarning;
import com.buildingsync.repository.IdentityResolver;
import com.buildingsync.service.Differencer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Snapshot differencer. Observed key pairs are confirmed with the identity
 * resolver while walking the incoming buildings.
 */
@Service
public class DifferencerImpl implements Differencer {
    
    private static final Logger logger = LoggerFactory.getLogger(DifferencerImpl.class);
    
    @Autowired
    IdentityResolver identityResolver;
    
    @Autowired
    ObjectMapper objectMapper;
    
    private final Set<String> reportedConflicts = ConcurrentHashMap.newKeySet();
    
    @Override
    public DiffResult diff(Map<String, Building> previous, List<Building> incoming) {
        Map<String, Building> baseline = previous != null ? previous : Collections.emptyMap();
        Map<String, Building> byKey = new LinkedHashMap<>();
        List<SyncWarning> warnings = new ArrayList<>();
        
        int index = 0;
        for (Building building : incoming) {
            String key = canonicalKey(building, index, warnings);
            index++;
            if (key == null) {
                continue;
            }
            if (byKey.put(key, building) != null) {
                // last occurrence wins, reported at the first position
                logger.debug("Building {} appears more than once in the payload", key);
            }
        }
        
        List<ChangeRecord> records = new ArrayList<>(byKey.size());
        for (Map.Entry<String, Building> entry : byKey.entrySet()) {
            Building before = baseline.get(entry.getKey());
            ChangeKind kind = classify(before, entry.getValue());
            records.add(ChangeRecord.of(entry.getKey(), kind, before != null ? before.getAttributesSnapshot() : null));
        }
        
        for (Map.Entry<String, Building> entry : baseline.entrySet()) {
            if (!byKey.containsKey(entry.getKey())) {
                records.add(ChangeRecord.of(entry.getKey(), ChangeKind.REMOVED, entry.getValue().getAttributesSnapshot()));
            }
        }
        
        return new DiffResult(Collections.unmodifiableList(records), Collections.unmodifiableMap(byKey),
                Collections.unmodifiableList(warnings));
    }
    
    /**
     * Primary key of the building, after recording what the record says about its
     * secondary key. Null when the building has no primary key.
     */
    private String canonicalKey(Building building, int index, List<SyncWarning> warnings) {
        String primaryKey = building.getPrimaryKey();
        if (primaryKey == null || primaryKey.isBlank()) {
            warnings.add(SyncWarning.of(SyncWarning.Kind.MALFORMED_RECORD, building.getSecondaryKey(), index,
                    "Missing primary key"));
            return null;
        }
        
        Optional<KeyMapping> conflict;
        if (building.hasSecondaryKey()) {
            conflict = identityResolver.recordConfirmedMapping(primaryKey, building.getSecondaryKey());
            conflict.ifPresent(previous -> warnings.add(SyncWarning.of(SyncWarning.Kind.AMBIGUOUS_KEY_MAPPING,
                    primaryKey, index, String.format("Source now pairs %s with %s, previously %s",
                            primaryKey, building.getSecondaryKey(), previous.getSecondaryKey()))));
        } else {
            conflict = identityResolver.recordHeuristicMapping(primaryKey);
            conflict.ifPresent(confirmed -> {
                String derived = identityResolver.deriveSecondary(primaryKey);
                // a persisting conflict is reported once, not on every cycle
                if (reportedConflicts.add(primaryKey + '|' + derived + '|' + confirmed.getPrimaryKey() + '|'
                        + confirmed.getSecondaryKey())) {
                    warnings.add(SyncWarning.of(SyncWarning.Kind.AMBIGUOUS_KEY_MAPPING, primaryKey, index,
                            String.format("Derived key %s disagrees with confirmed mapping %s -> %s",
                                    derived, confirmed.getPrimaryKey(), confirmed.getSecondaryKey())));
                } else {
                    logger.debug("Derived key {} still disagrees with confirmed mapping {}", derived, confirmed);
                }
            });
        }
        return primaryKey;
    }
    
    ChangeKind classify(Building before, Building after) {
        if (before == null) {
            return ChangeKind.NEW;
        }
        if (Objects.equals(before.getAttributesSnapshot(), after.getAttributesSnapshot())) {
            return ChangeKind.UNCHANGED;
        }
        if (!Objects.equals(before.getColorHex(), after.getColorHex())) {
            return ChangeKind.COLOR_CHANGED;
        }
        if (energyDiffers(before.getEnergyValue(), after.getEnergyValue())) {
            return ChangeKind.ATTRIBUTE_CHANGED;
        }
        return equalWithinNoise(before.getAttributesSnapshot(), after.getAttributesSnapshot())
                ? ChangeKind.UNCHANGED
                : ChangeKind.ATTRIBUTE_CHANGED;
    }
    
    /**
     * Snapshot equality where numbers closer than the energy epsilon match
     */
    private boolean equalWithinNoise(String before, String after) {
        if (before == null || after == null) {
            return false;
        }
        try {
            JsonNode a = objectMapper.readTree(before);
            JsonNode b = objectMapper.readTree(after);
            return a.equals(NUMERIC_NOISE, b);
        } catch (JsonProcessingException e) {
            logger.debug("Snapshot not comparable as JSON: {}", e.getOriginalMessage());
            return false;
        }
    }
    
    private static final Comparator<JsonNode> NUMERIC_NOISE = (a, b) -> {
        if (a.isNumber() && b.isNumber()) {
            return energyDiffers(a.asDouble(), b.asDouble()) ? Double.compare(a.asDouble(), b.asDouble()) : 0;
        }
        return a.equals(b) ? 0 : 1;
    };
    
    static boolean energyDiffers(Double before, Double after) {
        if (before == null || after == null) {
            return before != after;
        }
        return Math.abs(before - after) > ENERGY_EPSILON;
    }
}
