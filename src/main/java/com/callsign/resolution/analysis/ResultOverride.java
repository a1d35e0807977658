package com.callsign.resolution.analysis;

import com.callsign.resolution.core.model.Callsign;

import java.time.Instant;

/**
 * Adjusts an already resolved callsign. Overrides are applied in order after the
 * callsign has been derived from the prefix list.
 */
@FunctionalInterface
public interface ResultOverride {

    /**
     * Returns the adjusted callsign, or the same instance if the override does not apply.
     */
    Callsign apply(Callsign callsign, Instant timestamp);
}
