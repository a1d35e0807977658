package com.callsign.resolution.table;

/**
 * Two records sharing a key whose validity windows overlap. Lookups at an instant covered
 * by both return the first record.
 *
 * @param kind         record kind, e.g. {@code prefix}
 * @param key          the shared key
 * @param firstRecord  identifier of the record that wins lookups
 * @param secondRecord identifier of the record that is shadowed
 */
public record WindowOverlap(String kind, String key, int firstRecord, int secondRecord) {

    @Override
    public String toString() {
        return kind + " '" + key + "' records " + firstRecord + " and " + secondRecord;
    }
}
