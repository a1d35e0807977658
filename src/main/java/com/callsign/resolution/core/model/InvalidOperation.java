package com.callsign.resolution.core.model;

import java.util.Objects;

/**
 * Marks an exact callsign as never valid within the window.
 *
 * @param record   record identifier in the source table
 * @param call     the exact callsign
 * @param validity period of the invalid operation
 */
public record InvalidOperation(int record, String call, ValidityWindow validity) implements TimeBounded {

    public InvalidOperation {
        Objects.requireNonNull(call, "call is required");
        validity = validity != null ? validity : ValidityWindow.always();
    }

    @Override
    public String key() {
        return call;
    }
}
