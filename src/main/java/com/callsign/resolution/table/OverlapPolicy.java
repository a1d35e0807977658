package com.callsign.resolution.table;

/**
 * What to do with overlapping validity windows found when a resolver is built.
 */
public enum OverlapPolicy {
    /**
     * Skip validation.
     */
    IGNORE,

    /**
     * Log every overlap and continue; the first record of a key wins.
     */
    WARN,

    /**
     * Reject the table with a {@link ReferenceTableException}.
     */
    FAIL
}
