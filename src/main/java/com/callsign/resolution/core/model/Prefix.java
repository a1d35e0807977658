package com.callsign.resolution.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A callsign prefix and the entity, zone and location it designates.
 *
 * <p>Besides plain prefixes like {@code DL}, the table lists compound ones like
 * {@code SV/A} whose second half is a one-letter appendix of the callsign. The entity name
 * may be one of the sentinels in {@link Adif} instead of a real entity.</p>
 *
 * @param record    record identifier in the source table
 * @param call      the prefix string
 * @param entity    name of the entity
 * @param adif      ADIF identifier of the entity
 * @param cqZone    CQ zone, or null
 * @param continent continent, or null
 * @param longitude longitude, or null
 * @param latitude  latitude, or null
 * @param validity  validity window
 */
public record Prefix(
        int record,
        String call,
        String entity,
        int adif,
        Integer cqZone,
        String continent,
        Double longitude,
        Double latitude,
        ValidityWindow validity
) implements TimeBounded {

    public Prefix {
        Objects.requireNonNull(call, "call is required");
        Objects.requireNonNull(entity, "entity is required");
        if (call.isEmpty()) {
            throw new IllegalArgumentException("call must not be empty");
        }
        validity = validity != null ? validity : ValidityWindow.always();
    }

    @Override
    public String key() {
        return call;
    }

    /**
     * Returns true if this prefix designates maritime mobile operation rather than an entity.
     */
    public boolean isMaritimeMobile() {
        return Adif.ENTITY_MARITIME_MOBILE.equals(entity);
    }

    /**
     * Returns true for compound prefixes like {@code SV/A}.
     */
    public boolean isCompound() {
        return call.indexOf('/') >= 0;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int record;
        private String call;
        private String entity;
        private int adif;
        private Integer cqZone;
        private String continent;
        private Double longitude;
        private Double latitude;
        private Instant start;
        private Instant end;

        public Builder record(int record) {
            this.record = record;
            return this;
        }

        public Builder call(String call) {
            this.call = call;
            return this;
        }

        public Builder entity(String entity) {
            this.entity = entity;
            return this;
        }

        public Builder adif(int adif) {
            this.adif = adif;
            return this;
        }

        public Builder cqZone(Integer cqZone) {
            this.cqZone = cqZone;
            return this;
        }

        public Builder continent(String continent) {
            this.continent = continent;
            return this;
        }

        public Builder longitude(Double longitude) {
            this.longitude = longitude;
            return this;
        }

        public Builder latitude(Double latitude) {
            this.latitude = latitude;
            return this;
        }

        public Builder start(Instant start) {
            this.start = start;
            return this;
        }

        public Builder end(Instant end) {
            this.end = end;
            return this;
        }

        public Prefix build() {
            return new Prefix(record, call, entity, adif, cqZone, continent, longitude, latitude,
                    new ValidityWindow(start, end));
        }
    }
}
