package com.callsign.resolution.table;

import com.callsign.resolution.core.model.CallsignException;
import com.callsign.resolution.core.model.Entity;
import com.callsign.resolution.core.model.Prefix;
import com.callsign.resolution.core.model.TimeBounded;
import com.callsign.resolution.core.model.ZoneException;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link ReferenceData} answering every query with a linear scan over the table.
 * Needs no extra memory; each lookup is O(n) in the size of the record list.
 */
public class ScanningReferenceData implements ReferenceData {

    private final ReferenceTable table;

    public ScanningReferenceData(ReferenceTable table) {
        this.table = Objects.requireNonNull(table, "table is required");
    }

    @Override
    public Optional<Entity> getEntity(int adif, Instant timestamp) {
        return table.getEntities().stream()
                .filter(e -> e.getAdif() == adif && e.isActiveAt(timestamp))
                .findFirst();
    }

    @Override
    public Optional<Prefix> getPrefix(String prefix, Instant timestamp) {
        return find(table.getPrefixes(), prefix, timestamp);
    }

    @Override
    public Optional<CallsignException> getCallsignException(String callsign, Instant timestamp) {
        return find(table.getCallsignExceptions(), callsign, timestamp);
    }

    @Override
    public Optional<ZoneException> getZoneException(String callsign, Instant timestamp) {
        return find(table.getZoneExceptions(), callsign, timestamp);
    }

    @Override
    public boolean isInvalidOperation(String callsign, Instant timestamp) {
        return find(table.getInvalidOperations(), callsign, timestamp).isPresent();
    }

    private static <T extends TimeBounded> Optional<T> find(List<T> records, String key, Instant timestamp) {
        for (T record : records) {
            if (record.key().equals(key) && record.isActiveAt(timestamp)) {
                return Optional.of(record);
            }
        }
        return Optional.empty();
    }
}
