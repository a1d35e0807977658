package com.callsign.resolution.core.model;

/**
 * Which rule produced a resolved {@link Callsign}.
 */
public enum ResolutionSource {
    /**
     * Matched against the prefix list.
     */
    PREFIX,

    /**
     * Taken from a callsign exception for the exact call.
     */
    CALLSIGN_EXCEPTION,

    /**
     * An /AM, /MM or /SAT appendix made the entity irrelevant.
     */
    SPECIAL_APPENDIX,

    /**
     * The matching prefix designates maritime mobile operation.
     */
    MARITIME_PREFIX
}
