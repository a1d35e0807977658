package com.callsign.resolution.table;

import com.callsign.resolution.core.model.Entity;
import com.callsign.resolution.core.model.TimeBounded;
import com.callsign.resolution.core.model.ValidityWindow;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.function.ToIntFunction;

/**
 * Finds key groups of the reference table whose records have overlapping validity
 * windows. Lookups assume at most one active record per key and instant.
 */
public class WindowOverlapValidator {

    public static final String KIND_ENTITY = "entity";
    public static final String KIND_PREFIX = "prefix";
    public static final String KIND_CALLSIGN_EXCEPTION = "exception";
    public static final String KIND_INVALID_OPERATION = "invalid_operation";
    public static final String KIND_ZONE_EXCEPTION = "zone_exception";

    /**
     * Returns every overlapping pair, grouped by kind and key in table order.
     */
    public List<WindowOverlap> validate(ReferenceTable table) {
        List<WindowOverlap> overlaps = new ArrayList<>();
        collect(KIND_ENTITY, table.getEntities(), e -> String.valueOf(e.getAdif()),
                Entity::getAdif, Entity::getValidity, overlaps);
        collectBounded(KIND_PREFIX, table.getPrefixes(), overlaps);
        collectBounded(KIND_CALLSIGN_EXCEPTION, table.getCallsignExceptions(), overlaps);
        collectBounded(KIND_INVALID_OPERATION, table.getInvalidOperations(), overlaps);
        collectBounded(KIND_ZONE_EXCEPTION, table.getZoneExceptions(), overlaps);
        return overlaps;
    }

    private static <T extends TimeBounded> void collectBounded(String kind, List<T> records,
                                                               List<WindowOverlap> overlaps) {
        collect(kind, records, TimeBounded::key, TimeBounded::record, TimeBounded::validity, overlaps);
    }

    private static <T> void collect(String kind, List<T> records, Function<T, String> key,
                                    ToIntFunction<T> recordId, Function<T, ValidityWindow> window,
                                    List<WindowOverlap> overlaps) {
        Map<String, List<T>> groups = new LinkedHashMap<>();
        for (T record : records) {
            groups.computeIfAbsent(key.apply(record), k -> new ArrayList<>()).add(record);
        }
        for (Map.Entry<String, List<T>> group : groups.entrySet()) {
            List<T> members = group.getValue();
            for (int i = 0; i < members.size(); i++) {
                for (int j = i + 1; j < members.size(); j++) {
                    if (window.apply(members.get(i)).overlaps(window.apply(members.get(j)))) {
                        overlaps.add(new WindowOverlap(kind, group.getKey(),
                                recordId.applyAsInt(members.get(i)), recordId.applyAsInt(members.get(j))));
                    }
                }
            }
        }
    }
}
