package com.callsign.resolution.core.model;

import java.time.Instant;

/**
 * A reference record looked up by a string key and valid only within its window.
 */
public interface TimeBounded {

    /**
     * Identifier of the record in the source table.
     */
    int record();

    /**
     * The lookup key: a prefix or an exact callsign.
     */
    String key();

    ValidityWindow validity();

    default boolean isActiveAt(Instant timestamp) {
        return validity().contains(timestamp);
    }
}
