package com.callsign.resolution.table;

import com.callsign.resolution.core.model.CallsignException;
import com.callsign.resolution.core.model.Entity;
import com.callsign.resolution.core.model.InvalidOperation;
import com.callsign.resolution.core.model.Prefix;
import com.callsign.resolution.core.model.TimeBounded;
import com.callsign.resolution.core.model.ZoneException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * {@link ReferenceData} backed by hash indexes from key to candidate records.
 *
 * <p>Each candidate list keeps the table's insertion order so the answers are the same as
 * the ones of {@link ScanningReferenceData}. A lookup costs O(1) on average plus the
 * number of records sharing the key.</p>
 */
public class IndexedReferenceData implements ReferenceData {
    private static final Logger log = LoggerFactory.getLogger(IndexedReferenceData.class);

    private final Map<Integer, List<Entity>> entities;
    private final Map<String, List<Prefix>> prefixes;
    private final Map<String, List<CallsignException>> callsignExceptions;
    private final Map<String, List<InvalidOperation>> invalidOperations;
    private final Map<String, List<ZoneException>> zoneExceptions;

    public IndexedReferenceData(ReferenceTable table) {
        Objects.requireNonNull(table, "table is required");
        this.entities = index(table.getEntities(), Entity::getAdif);
        this.prefixes = index(table.getPrefixes(), Prefix::key);
        this.callsignExceptions = index(table.getCallsignExceptions(), CallsignException::key);
        this.invalidOperations = index(table.getInvalidOperations(), InvalidOperation::key);
        this.zoneExceptions = index(table.getZoneExceptions(), ZoneException::key);
        log.debug("reference.index.built entities={} prefixes={} exceptions={} invalid={} zones={}",
                entities.size(), prefixes.size(), callsignExceptions.size(),
                invalidOperations.size(), zoneExceptions.size());
    }

    @Override
    public Optional<Entity> getEntity(int adif, Instant timestamp) {
        List<Entity> candidates = entities.get(adif);
        if (candidates == null) {
            return Optional.empty();
        }
        for (Entity entity : candidates) {
            if (entity.isActiveAt(timestamp)) {
                return Optional.of(entity);
            }
        }
        return Optional.empty();
    }

    @Override
    public Optional<Prefix> getPrefix(String prefix, Instant timestamp) {
        return find(prefixes, prefix, timestamp);
    }

    @Override
    public Optional<CallsignException> getCallsignException(String callsign, Instant timestamp) {
        return find(callsignExceptions, callsign, timestamp);
    }

    @Override
    public Optional<ZoneException> getZoneException(String callsign, Instant timestamp) {
        return find(zoneExceptions, callsign, timestamp);
    }

    @Override
    public boolean isInvalidOperation(String callsign, Instant timestamp) {
        return find(invalidOperations, callsign, timestamp).isPresent();
    }

    private static <T extends TimeBounded> Optional<T> find(Map<String, List<T>> index, String key,
                                                          Instant timestamp) {
        List<T> candidates = index.get(key);
        if (candidates == null) {
            return Optional.empty();
        }
        for (T record : candidates) {
            if (record.isActiveAt(timestamp)) {
                return Optional.of(record);
            }
        }
        return Optional.empty();
    }

    private static <K, T> Map<K, List<T>> index(Collection<T> records, Function<T, K> keyFunction) {
        Map<K, List<T>> index = new HashMap<>();
        for (T record : records) {
            index.computeIfAbsent(keyFunction.apply(record), k -> new ArrayList<>(1)).add(record);
        }
        // Freeze the candidate lists; insertion order is preserved by List.copyOf
        index.replaceAll((key, candidates) -> List.copyOf(candidates));
        return Map.copyOf(index);
    }
}
