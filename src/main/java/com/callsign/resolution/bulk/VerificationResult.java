package com.callsign.resolution.bulk;

import java.util.List;

/**
 * Result of verifying a whole log.
 *
 * @param totalEntries   number of readable entries
 * @param confirmed      entries whose logged entity was confirmed
 * @param mismatched     entries resolving to another entity
 * @param notWhitelisted entries rejected by the whitelist of their entity
 * @param invalid        entries whose call could not be analyzed
 * @param errors         unreadable entries and entries that were not confirmed
 */
public record VerificationResult(
        long totalEntries,
        long confirmed,
        long mismatched,
        long notWhitelisted,
        long invalid,
        List<VerificationError> errors
) {
    public VerificationResult {
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public static VerificationResult empty() {
        return new VerificationResult(0, 0, 0, 0, 0, List.of());
    }

    public long errorCount() {
        return errors.size();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * Returns true if every readable entry was confirmed and nothing was unreadable.
     */
    public boolean isClean() {
        return confirmed == totalEntries && errors.isEmpty();
    }

    /**
     * An entry that could not be read or was not confirmed.
     *
     * @param lineNumber the line number or array index in the input (1-based, 0 for the whole input)
     * @param input      the raw input, or the call if it was readable
     * @param message    what went wrong
     */
    public record VerificationError(long lineNumber, String input, String message) {}

    @Override
    public String toString() {
        return "VerificationResult{total=" + totalEntries +
                ", confirmed=" + confirmed +
                ", mismatched=" + mismatched +
                ", notWhitelisted=" + notWhitelisted +
                ", invalid=" + invalid +
                ", errors=" + errors.size() + '}';
    }
}
