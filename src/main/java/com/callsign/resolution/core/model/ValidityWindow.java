package com.callsign.resolution.core.model;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Optional start and end instants bounding the validity of a reference record.
 * A missing bound is unbounded on that side. Both bounds are inclusive.
 *
 * @param start first instant the record is valid, or null
 * @param end   last instant the record is valid, or null
 */
public record ValidityWindow(Instant start, Instant end) {

    private static final ValidityWindow ALWAYS = new ValidityWindow(null, null);

    public ValidityWindow {
        if (start != null && end != null && end.isBefore(start)) {
            throw new IllegalArgumentException("end must not be before start: " + start + " > " + end);
        }
    }

    /**
     * A window without any bounds.
     */
    public static ValidityWindow always() {
        return ALWAYS;
    }

    public static ValidityWindow between(Instant start, Instant end) {
        return new ValidityWindow(start, end);
    }

    public static ValidityWindow from(Instant start) {
        return new ValidityWindow(Objects.requireNonNull(start, "start is required"), null);
    }

    public static ValidityWindow until(Instant end) {
        return new ValidityWindow(null, Objects.requireNonNull(end, "end is required"));
    }

    /**
     * Returns true if the timestamp lies within this window.
     */
    public boolean contains(Instant timestamp) {
        Objects.requireNonNull(timestamp, "timestamp is required");
        if (start != null && timestamp.isBefore(start)) {
            return false;
        }
        return end == null || !timestamp.isAfter(end);
    }

    /**
     * Returns true if some instant is contained in both windows.
     */
    public boolean overlaps(ValidityWindow other) {
        boolean startsBeforeOtherEnds = start == null || other.end == null || !start.isAfter(other.end);
        boolean otherStartsBeforeThisEnds = other.start == null || end == null || !other.start.isAfter(end);
        return startsBeforeOtherEnds && otherStartsBeforeThisEnds;
    }

    public Optional<Instant> getStart() {
        return Optional.ofNullable(start);
    }

    public Optional<Instant> getEnd() {
        return Optional.ofNullable(end);
    }

    public boolean isUnbounded() {
        return start == null && end == null;
    }
}
