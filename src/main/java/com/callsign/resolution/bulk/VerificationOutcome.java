package com.callsign.resolution.bulk;

/**
 * Classification of one verified log entry.
 */
public enum VerificationOutcome {
    /** Analyzed ADIF equals the logged one and the whitelist allows the call. */
    CONFIRMED,
    /** The call resolves to another entity than the logged one. */
    MISMATCHED,
    /** Entity matches but the call is not approved while the whitelist is in force. */
    NOT_WHITELISTED,
    /** The call could not be analyzed. */
    INVALID
}
