package com.callsign.resolution.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Override of the prefix-derived information for one exact callsign, including any
 * prefix and appendices.
 *
 * <p>Approved calls of whitelisted entities are listed as callsign exceptions too.
 * Some exceptions name a sentinel entity from {@link Adif} with ADIF {@link Adif#NO_DXCC}.</p>
 *
 * @param record    record identifier in the source table
 * @param call      the exact callsign
 * @param entity    name of the entity
 * @param adif      ADIF identifier
 * @param cqZone    CQ zone, or null
 * @param continent continent, or null
 * @param longitude longitude, or null
 * @param latitude  latitude, or null
 * @param validity  validity window
 */
public record CallsignException(
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

    public CallsignException {
        Objects.requireNonNull(call, "call is required");
        Objects.requireNonNull(entity, "entity is required");
        validity = validity != null ? validity : ValidityWindow.always();
    }

    @Override
    public String key() {
        return call;
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

        public CallsignException build() {
            return new CallsignException(record, call, entity, adif, cqZone, continent, longitude, latitude,
                    new ValidityWindow(start, end));
        }
    }
}
