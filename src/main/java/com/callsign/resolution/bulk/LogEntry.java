package com.callsign.resolution.bulk;

import java.time.Instant;
import java.util.Objects;

/**
 * One logged contact: the worked call, the ADIF identifier the log claims for it and the
 * instant of the contact.
 *
 * @param lineNumber position in the input (1-based), line for CSV and array index for JSON
 */
public record LogEntry(long lineNumber, String call, int adif, Instant timestamp) {
    public LogEntry {
        Objects.requireNonNull(call, "call is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
    }
}
