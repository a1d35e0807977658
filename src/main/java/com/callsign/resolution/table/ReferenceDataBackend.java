package com.callsign.resolution.table;

/**
 * Available {@link ReferenceData} implementations. Both give identical answers.
 */
public enum ReferenceDataBackend {
    /**
     * Linear scan over the record lists. Suitable for small tables or few lookups.
     */
    SCAN,

    /**
     * Hash index from key to candidate records. Suitable for full-size tables and
     * high call volume.
     */
    INDEXED;

    public ReferenceData create(ReferenceTable table) {
        return switch (this) {
            case SCAN -> new ScanningReferenceData(table);
            case INDEXED -> new IndexedReferenceData(table);
        };
    }
}
