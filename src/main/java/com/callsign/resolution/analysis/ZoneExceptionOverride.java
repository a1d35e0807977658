package com.callsign.resolution.analysis;

import com.callsign.resolution.core.model.Callsign;
import com.callsign.resolution.table.ReferenceData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.OptionalInt;

/**
 * Replaces the CQ zone of a callsign that has an active zone exception.
 */
public class ZoneExceptionOverride implements ResultOverride {
    private static final Logger log = LoggerFactory.getLogger(ZoneExceptionOverride.class);

    private final ReferenceData referenceData;

    public ZoneExceptionOverride(ReferenceData referenceData) {
        this.referenceData = referenceData;
    }

    @Override
    public Callsign apply(Callsign callsign, Instant timestamp) {
        OptionalInt zone = referenceData.getZoneOverride(callsign.getCall(), timestamp);
        if (zone.isEmpty()) {
            return callsign;
        }
        log.debug("analysis.zone_override call={} zone={}", callsign.getCall(), zone.getAsInt());
        return callsign.withCqZone(zone.getAsInt());
    }
}
