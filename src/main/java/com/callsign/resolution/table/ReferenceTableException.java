package com.callsign.resolution.table;

import java.util.List;

/**
 * Runtime exception thrown when a reference table is rejected because lookups
 * would be ambiguous.
 */
public class ReferenceTableException extends RuntimeException {

    private final List<WindowOverlap> overlaps;

    public ReferenceTableException(String message, List<WindowOverlap> overlaps) {
        super(message);
        this.overlaps = List.copyOf(overlaps);
    }

    public List<WindowOverlap> getOverlaps() {
        return overlaps;
    }
}
