package com.callsign.resolution.core.model;

import java.util.Objects;
import java.util.Optional;

/**
 * A resolved callsign with the entity, zone and location it is associated with.
 *
 * <p>Value type owned by the caller: all fields are copied out of the reference table,
 * nothing refers back into it.</p>
 */
public final class Callsign {

    private final String call;
    private final int adif;
    private final String entityName;
    private final Integer cqZone;
    private final String continent;
    private final Double longitude;
    private final Double latitude;
    private final ResolutionSource source;
    private final SpecialEntity specialEntity;
    private final boolean zoneOverridden;

    private Callsign(Builder builder) {
        this.call = Objects.requireNonNull(builder.call, "call is required");
        this.adif = builder.adif;
        this.entityName = builder.entityName;
        this.cqZone = builder.cqZone;
        this.continent = builder.continent;
        this.longitude = builder.longitude;
        this.latitude = builder.latitude;
        this.source = Objects.requireNonNull(builder.source, "source is required");
        this.specialEntity = builder.specialEntity;
        this.zoneOverridden = builder.zoneOverridden;
    }

    /**
     * Creates a callsign from the matching prefix record.
     */
    public static Callsign fromPrefix(String call, Prefix prefix) {
        return builder()
                .call(call)
                .adif(prefix.adif())
                .entityName(prefix.entity())
                .cqZone(prefix.cqZone())
                .continent(prefix.continent())
                .longitude(prefix.longitude())
                .latitude(prefix.latitude())
                .source(ResolutionSource.PREFIX)
                .build();
    }

    /**
     * Creates a callsign from a callsign exception for the exact call.
     */
    public static Callsign fromException(String call, CallsignException exception) {
        return builder()
                .call(call)
                .adif(exception.adif())
                .entityName(exception.entity())
                .cqZone(exception.cqZone())
                .continent(exception.continent())
                .longitude(exception.longitude())
                .latitude(exception.latitude())
                .source(ResolutionSource.CALLSIGN_EXCEPTION)
                .build();
    }

    /**
     * Creates a callsign that counts for no DXCC entity. All geographic fields are empty.
     */
    public static Callsign special(String call, SpecialEntity specialEntity, ResolutionSource source) {
        return builder()
                .call(call)
                .adif(Adif.NO_DXCC)
                .specialEntity(specialEntity)
                .source(source)
                .build();
    }

    public static Callsign maritimeMobile(String call, ResolutionSource source) {
        return special(call, SpecialEntity.MARITIME_MOBILE, source);
    }

    /**
     * Returns a copy with the CQ zone replaced. All other fields are kept.
     */
    public Callsign withCqZone(int zone) {
        return toBuilder().cqZone(zone).zoneOverridden(true).build();
    }

    public String getCall() {
        return call;
    }

    public int getAdif() {
        return adif;
    }

    /**
     * Name of the DXCC entity, empty for special entities.
     */
    public Optional<String> getEntityName() {
        return Optional.ofNullable(entityName);
    }

    public Optional<Integer> getCqZone() {
        return Optional.ofNullable(cqZone);
    }

    public Optional<String> getContinent() {
        return Optional.ofNullable(continent);
    }

    public Optional<Double> getLongitude() {
        return Optional.ofNullable(longitude);
    }

    public Optional<Double> getLatitude() {
        return Optional.ofNullable(latitude);
    }

    public ResolutionSource getSource() {
        return source;
    }

    /**
     * The /MM, /AM or /SAT operation that made the entity irrelevant, if any.
     */
    public Optional<SpecialEntity> getSpecialEntity() {
        return Optional.ofNullable(specialEntity);
    }

    /**
     * Returns true if the call is assigned to no DXCC entity.
     */
    public boolean isSpecialEntity() {
        return adif == Adif.NO_DXCC;
    }

    public boolean isZoneOverridden() {
        return zoneOverridden;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Callsign that = (Callsign) o;
        return adif == that.adif
                && zoneOverridden == that.zoneOverridden
                && call.equals(that.call)
                && Objects.equals(entityName, that.entityName)
                && Objects.equals(cqZone, that.cqZone)
                && Objects.equals(continent, that.continent)
                && Objects.equals(longitude, that.longitude)
                && Objects.equals(latitude, that.latitude)
                && source == that.source
                && specialEntity == that.specialEntity;
    }

    @Override
    public int hashCode() {
        return Objects.hash(call, adif, entityName, cqZone, continent, longitude, latitude, source, specialEntity);
    }

    @Override
    public String toString() {
        return "Callsign{" +
                "call='" + call + '\'' +
                ", adif=" + adif +
                ", entity='" + entityName + '\'' +
                ", cqZone=" + cqZone +
                ", continent='" + continent + '\'' +
                ", longitude=" + longitude +
                ", latitude=" + latitude +
                ", source=" + source +
                (specialEntity != null ? ", special=" + specialEntity : "") +
                '}';
    }

    public Builder toBuilder() {
        return new Builder()
                .call(call)
                .adif(adif)
                .entityName(entityName)
                .cqZone(cqZone)
                .continent(continent)
                .longitude(longitude)
                .latitude(latitude)
                .source(source)
                .specialEntity(specialEntity)
                .zoneOverridden(zoneOverridden);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String call;
        private int adif;
        private String entityName;
        private Integer cqZone;
        private String continent;
        private Double longitude;
        private Double latitude;
        private ResolutionSource source;
        private SpecialEntity specialEntity;
        private boolean zoneOverridden;

        public Builder call(String call) {
            this.call = call;
            return this;
        }

        public Builder adif(int adif) {
            this.adif = adif;
            return this;
        }

        public Builder entityName(String entityName) {
            this.entityName = entityName;
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

        public Builder source(ResolutionSource source) {
            this.source = source;
            return this;
        }

        public Builder specialEntity(SpecialEntity specialEntity) {
            this.specialEntity = specialEntity;
            return this;
        }

        public Builder zoneOverridden(boolean zoneOverridden) {
            this.zoneOverridden = zoneOverridden;
            return this;
        }

        public Callsign build() {
            return new Callsign(this);
        }
    }
}
