package com.callsign.resolution.core.model;

import java.util.Optional;

/**
 * Operations that count for no DXCC entity.
 * The appendix is only meaningful after the first part of a callsign.
 */
public enum SpecialEntity {
    MARITIME_MOBILE("MM", Adif.ENTITY_MARITIME_MOBILE),
    AERONAUTICAL_MOBILE("AM", Adif.ENTITY_AERONAUTICAL_MOBILE),
    SATELLITE("SAT", Adif.ENTITY_SATELLITE);

    private final String appendix;
    private final String entityName;

    SpecialEntity(String appendix, String entityName) {
        this.appendix = appendix;
        this.entityName = entityName;
    }

    public String getAppendix() {
        return appendix;
    }

    public String getEntityName() {
        return entityName;
    }

    /**
     * Returns the special entity signalled by an appendix like {@code MM}, if any.
     */
    public static Optional<SpecialEntity> fromAppendix(String appendix) {
        for (SpecialEntity special : values()) {
            if (special.appendix.equals(appendix)) {
                return Optional.of(special);
            }
        }
        return Optional.empty();
    }
}
