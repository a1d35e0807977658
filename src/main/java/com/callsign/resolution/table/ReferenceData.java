package com.callsign.resolution.table;

import com.callsign.resolution.core.model.CallsignException;
import com.callsign.resolution.core.model.Entity;
import com.callsign.resolution.core.model.Prefix;
import com.callsign.resolution.core.model.ZoneException;

import java.time.Instant;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Time-windowed access to the reference table.
 *
 * <p>Each query returns the record for the key that is active at the given instant.
 * When several records of a key are active, the first one in table order is returned.
 * Absence is the normal answer for most keys and is never signalled by an exception.</p>
 *
 * <p>Implementations only read the immutable table and are safe for concurrent use.</p>
 */
public interface ReferenceData {

    /**
     * Gets entity information by ADIF identifier.
     *
     * @param adif      ADIF identifier
     * @param timestamp instant to check the validity against
     * @return the active entity, or empty
     */
    Optional<Entity> getEntity(int adif, Instant timestamp);

    /**
     * Gets prefix information by an exact prefix string like {@code DL} or {@code SV/A}.
     *
     * @param prefix    prefix string
     * @param timestamp instant to check the validity against
     * @return the active prefix, or empty
     */
    Optional<Prefix> getPrefix(String prefix, Instant timestamp);

    /**
     * Gets the callsign exception for a complete callsign.
     *
     * @param callsign  complete callsign including prefix and appendices
     * @param timestamp instant to check the validity against
     * @return the active exception, or empty
     */
    Optional<CallsignException> getCallsignException(String callsign, Instant timestamp);

    /**
     * Gets the CQ zone exception for a complete callsign.
     *
     * @param callsign  complete callsign including prefix and appendices
     * @param timestamp instant to check the validity against
     * @return the active zone exception, or empty
     */
    Optional<ZoneException> getZoneException(String callsign, Instant timestamp);

    /**
     * Checks whether the callsign was used in an invalid operation at that instant.
     */
    boolean isInvalidOperation(String callsign, Instant timestamp);

    /**
     * Gets only the overriding CQ zone for a complete callsign.
     */
    default OptionalInt getZoneOverride(String callsign, Instant timestamp) {
        return getZoneException(callsign, timestamp)
                .map(exception -> OptionalInt.of(exception.zone()))
                .orElseGet(OptionalInt::empty);
    }
}
