package com.callsign.resolution.prefix;

import com.callsign.resolution.core.model.Prefix;

import java.util.Objects;

/**
 * A prefix found for a candidate string together with the number of trailing characters
 * that had to be removed from the candidate before it matched.
 * Fewer removed characters means a more specific match.
 *
 * @param prefix       the matching prefix record
 * @param charsRemoved characters removed from the end of the candidate
 */
public record PrefixMatch(Prefix prefix, int charsRemoved) {

    public PrefixMatch {
        Objects.requireNonNull(prefix, "prefix is required");
        if (charsRemoved < 0) {
            throw new IllegalArgumentException("charsRemoved must be >= 0");
        }
    }

    /**
     * Returns true if this match is at least as specific as the other one.
     */
    public boolean isAtLeastAsSpecificAs(PrefixMatch other) {
        return charsRemoved <= other.charsRemoved;
    }
}
