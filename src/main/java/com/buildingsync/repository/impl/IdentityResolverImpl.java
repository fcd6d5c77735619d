package com.buildingsync.repository.impl;

import com.buildingsync.model.KeyMapping;
import com.buildingsync.model.KeySource;
import com.buildingsync.repository.IdentityResolver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Mapping table kept in three concurrent maps: by primary key, and the reverse
 * direction split by source so a confirmed entry is always found first.
 * Writes come from the single sync path; reads may run concurrently.
 */
@Repository
@Slf4j
public class IdentityResolverImpl implements IdentityResolver {
    
    static final char PRIMARY_DELIMITER = '_';
    static final char SECONDARY_LITERAL = 'L';
    
    private final Map<String, KeyMapping> byPrimary = new ConcurrentHashMap<>();
    private final Map<String, String> confirmedBySecondary = new ConcurrentHashMap<>();
    private final Map<String, String> heuristicBySecondary = new ConcurrentHashMap<>();
    
    @Override
    public String deriveSecondary(String primaryKey) {
        if (primaryKey == null) {
            return "";
        }
        return primaryKey.replace(PRIMARY_DELIMITER, SECONDARY_LITERAL);
    }
    
    @Override
    public Optional<KeyMapping> recordConfirmedMapping(String primaryKey, String secondaryKey) {
        if (isBlank(primaryKey) || isBlank(secondaryKey)) {
            return Optional.empty();
        }
        KeyMapping mapping = KeyMapping.confirmed(primaryKey, secondaryKey);
        KeyMapping previous = byPrimary.put(primaryKey, mapping);
        
        if (previous != null && !previous.getSecondaryKey().equals(secondaryKey)) {
            unlinkReverse(previous);
        }
        heuristicBySecondary.remove(secondaryKey, primaryKey);
        
        String other = confirmedBySecondary.put(secondaryKey, primaryKey);
        if (other != null && !other.equals(primaryKey)) {
            // the secondary key moved to another building; the old owner loses it
            byPrimary.computeIfPresent(other, (k, m) -> secondaryKey.equals(m.getSecondaryKey()) ? null : m);
            log.warn("Secondary key {} moved from {} to {}", secondaryKey, other, primaryKey);
        }
        
        if (previous != null && previous.isConfirmed() && !previous.getSecondaryKey().equals(secondaryKey)) {
            log.warn("Confirmed mapping for {} changed from {} to {}", primaryKey, previous.getSecondaryKey(), secondaryKey);
            return Optional.of(previous);
        }
        return Optional.empty();
    }
    
    @Override
    public Optional<KeyMapping> recordHeuristicMapping(String primaryKey) {
        if (isBlank(primaryKey)) {
            return Optional.empty();
        }
        String derived = deriveSecondary(primaryKey);
        KeyMapping existing = byPrimary.get(primaryKey);
        
        if (existing != null && existing.getSource().outranks(KeySource.HEURISTIC)) {
            if (!existing.getSecondaryKey().equals(derived)) {
                return Optional.of(existing);
            }
            return Optional.empty();
        }
        
        // a confirmed owner of the derived key elsewhere wins as well
        String confirmedOwner = confirmedBySecondary.get(derived);
        if (confirmedOwner != null && !confirmedOwner.equals(primaryKey)) {
            return Optional.of(KeyMapping.confirmed(confirmedOwner, derived));
        }
        
        byPrimary.put(primaryKey, KeyMapping.heuristic(primaryKey, derived));
        heuristicBySecondary.put(derived, primaryKey);
        return Optional.empty();
    }
    
    @Override
    public Optional<String> resolve(String eitherKey) {
        if (isBlank(eitherKey)) {
            return Optional.empty();
        }
        if (byPrimary.containsKey(eitherKey)) {
            return Optional.of(eitherKey);
        }
        String confirmed = confirmedBySecondary.get(eitherKey);
        if (confirmed != null) {
            return Optional.of(confirmed);
        }
        return Optional.ofNullable(heuristicBySecondary.get(eitherKey));
    }
    
    @Override
    public Optional<KeyMapping> mappingFor(String primaryKey) {
        return primaryKey == null ? Optional.empty() : Optional.ofNullable(byPrimary.get(primaryKey));
    }
    
    @Override
    public Optional<String> secondaryFor(String primaryKey) {
        return mappingFor(primaryKey).map(KeyMapping::getSecondaryKey);
    }
    
    @Override
    public void remove(String primaryKey) {
        if (primaryKey == null) {
            return;
        }
        KeyMapping removed = byPrimary.remove(primaryKey);
        if (removed != null) {
            unlinkReverse(removed);
        }
    }
    
    @Override
    public void clear() {
        byPrimary.clear();
        confirmedBySecondary.clear();
        heuristicBySecondary.clear();
    }
    
    @Override
    public int confirmedCount() {
        return (int) byPrimary.values().stream().filter(KeyMapping::isConfirmed).count();
    }
    
    @Override
    public int heuristicCount() {
        return (int) byPrimary.values().stream().filter(m -> !m.isConfirmed()).count();
    }
    
    private void unlinkReverse(KeyMapping mapping) {
        Map<String, String> reverse = mapping.isConfirmed() ? confirmedBySecondary : heuristicBySecondary;
        reverse.remove(mapping.getSecondaryKey(), mapping.getPrimaryKey());
    }
    
    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
    
    /**
     * Whether the reverse entry of a primary key points back at it
     */
    boolean isConsistent(String primaryKey) {
        KeyMapping mapping = byPrimary.get(primaryKey);
        if (mapping == null) {
            return true;
        }
        Map<String, String> reverse = mapping.isConfirmed() ? confirmedBySecondary : heuristicBySecondary;
        return Objects.equals(reverse.get(mapping.getSecondaryKey()), primaryKey);
    }
}
