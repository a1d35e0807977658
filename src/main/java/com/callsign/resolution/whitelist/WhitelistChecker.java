package com.callsign.resolution.whitelist;

import com.callsign.resolution.core.model.CallsignException;
import com.callsign.resolution.core.model.Entity;
import com.callsign.resolution.table.ReferenceData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Checks whether a call may count for a whitelisted entity.
 *
 * <p>Rare or disputed entities only accept approved calls while their whitelist is in
 * force. The approved calls are the callsign exceptions naming the entity. This check does
 * not validate the call itself; analyze it first and pass the resolved ADIF identifier.</p>
 */
public class WhitelistChecker {
    private static final Logger log = LoggerFactory.getLogger(WhitelistChecker.class);

    private final ReferenceData referenceData;

    public WhitelistChecker(ReferenceData referenceData) {
        this.referenceData = Objects.requireNonNull(referenceData, "referenceData is required");
    }

    /**
     * Returns false only if the entity is whitelisted at that instant and the call is not
     * approved for it.
     *
     * @param adif      ADIF identifier the call was resolved to
     * @param call      complete callsign
     * @param timestamp instant of the contact
     */
    public boolean isAllowed(int adif, String call, Instant timestamp) {
        Objects.requireNonNull(call, "call is required");
        Objects.requireNonNull(timestamp, "timestamp is required");

        // Not every ADIF identifier has an entity, e.g. the no-DXCC one
        Optional<Entity> entity = referenceData.getEntity(adif, timestamp);
        if (entity.isEmpty() || !entity.get().isWhitelisted()) {
            return true;
        }

        // An exception may exist for the call but name a different entity
        Optional<CallsignException> exception = referenceData.getCallsignException(call, timestamp);
        if (exception.isPresent()) {
            return exception.get().adif() == adif;
        }

        Optional<Instant> start = entity.get().getWhitelistStart();
        if (start.isPresent() && timestamp.isBefore(start.get())) {
            return true;
        }
        Optional<Instant> end = entity.get().getWhitelistEnd();
        if (end.isPresent() && timestamp.isAfter(end.get())) {
            return true;
        }

        log.debug("whitelist.rejected call={} adif={} timestamp={}", call, adif, timestamp);
        return false;
    }
}
