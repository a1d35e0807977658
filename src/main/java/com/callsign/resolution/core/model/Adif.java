package com.callsign.resolution.core.model;

/**
 * Reserved ADIF identifiers and the sentinel entity names used by the reference table.
 * None of the sentinels appear in the entity list itself.
 */
public final class Adif {

    /**
     * ADIF identifier for callsigns that count for no DXCC entity (/MM, /AM, /SAT).
     */
    public static final int NO_DXCC = 0;

    /**
     * Entity name of records marking an invalid operation.
     */
    public static final String ENTITY_INVALID = "INVALID";

    /**
     * Entity name of records marking maritime mobile operation.
     */
    public static final String ENTITY_MARITIME_MOBILE = "MARITIME MOBILE";

    public static final String ENTITY_AERONAUTICAL_MOBILE = "AERONAUTICAL MOBILE";

    public static final String ENTITY_SATELLITE = "SATELLITE, INTERNET OR REPEATER";

    private Adif() {
    }
}
