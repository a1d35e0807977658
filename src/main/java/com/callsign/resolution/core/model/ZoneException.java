package com.callsign.resolution.core.model;

import java.util.Objects;

/**
 * Replaces only the CQ zone of an otherwise resolved callsign.
 *
 * @param record   record identifier in the source table
 * @param call     the exact callsign
 * @param zone     the CQ zone to use
 * @param validity validity window
 */
public record ZoneException(int record, String call, int zone, ValidityWindow validity) implements TimeBounded {

    public ZoneException {
        Objects.requireNonNull(call, "call is required");
        validity = validity != null ? validity : ValidityWindow.always();
    }

    @Override
    public String key() {
        return call;
    }
}
