package com.callsign.resolution.core.model;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * A DXCC entity, roughly a country or territory for award purposes.
 *
 * <p>An entity may be whitelisted: only approved callsigns (listed as callsign exceptions)
 * count for it while the whitelist is in force. The whitelist bounds are independent of
 * the entity's own validity window and either may be absent.</p>
 */
public final class Entity {
    private final int adif;
    private final String name;
    private final String prefix;
    private final boolean deleted;
    private final Integer cqZone;
    private final String continent;
    private final Double longitude;
    private final Double latitude;
    private final ValidityWindow validity;
    private final Boolean whitelist;
    private final Instant whitelistStart;
    private final Instant whitelistEnd;

    private Entity(Builder builder) {
        this.adif = builder.adif;
        this.name = builder.name;
        this.prefix = builder.prefix;
        this.deleted = builder.deleted;
        this.cqZone = builder.cqZone;
        this.continent = builder.continent;
        this.longitude = builder.longitude;
        this.latitude = builder.latitude;
        this.validity = builder.validity != null ? builder.validity : ValidityWindow.always();
        this.whitelist = builder.whitelist;
        this.whitelistStart = builder.whitelistStart;
        this.whitelistEnd = builder.whitelistEnd;
    }

    public int getAdif() {
        return adif;
    }

    public String getName() {
        return name;
    }

    public String getPrefix() {
        return prefix;
    }

    public boolean isDeleted() {
        return deleted;
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

    public ValidityWindow getValidity() {
        return validity;
    }

    /**
     * Returns the whitelist flag, empty if the table does not state one.
     */
    public Optional<Boolean> getWhitelist() {
        return Optional.ofNullable(whitelist);
    }

    public boolean isWhitelisted() {
        return Boolean.TRUE.equals(whitelist);
    }

    public Optional<Instant> getWhitelistStart() {
        return Optional.ofNullable(whitelistStart);
    }

    public Optional<Instant> getWhitelistEnd() {
        return Optional.ofNullable(whitelistEnd);
    }

    public boolean isActiveAt(Instant timestamp) {
        return validity.contains(timestamp);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Entity entity = (Entity) o;
        return adif == entity.adif
                && deleted == entity.deleted
                && Objects.equals(name, entity.name)
                && Objects.equals(prefix, entity.prefix)
                && Objects.equals(cqZone, entity.cqZone)
                && Objects.equals(continent, entity.continent)
                && Objects.equals(longitude, entity.longitude)
                && Objects.equals(latitude, entity.latitude)
                && Objects.equals(validity, entity.validity)
                && Objects.equals(whitelist, entity.whitelist)
                && Objects.equals(whitelistStart, entity.whitelistStart)
                && Objects.equals(whitelistEnd, entity.whitelistEnd);
    }

    @Override
    public int hashCode() {
        return Objects.hash(adif, name, validity);
    }

    @Override
    public String toString() {
        return "Entity{" +
                "adif=" + adif +
                ", name='" + name + '\'' +
                ", prefix='" + prefix + '\'' +
                ", deleted=" + deleted +
                ", whitelist=" + whitelist +
                ", validity=" + validity +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Integer adifValue;
        private int adif;
        private String name;
        private String prefix;
        private boolean deleted;
        private Integer cqZone;
        private String continent;
        private Double longitude;
        private Double latitude;
        private ValidityWindow validity;
        private Boolean whitelist;
        private Instant whitelistStart;
        private Instant whitelistEnd;

        public Builder adif(int adif) {
            this.adif = adif;
            this.adifValue = adif;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder prefix(String prefix) {
            this.prefix = prefix;
            return this;
        }

        public Builder deleted(boolean deleted) {
            this.deleted = deleted;
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

        public Builder validity(ValidityWindow validity) {
            this.validity = validity;
            return this;
        }

        public Builder whitelist(Boolean whitelist) {
            this.whitelist = whitelist;
            return this;
        }

        public Builder whitelistStart(Instant whitelistStart) {
            this.whitelistStart = whitelistStart;
            return this;
        }

        public Builder whitelistEnd(Instant whitelistEnd) {
            this.whitelistEnd = whitelistEnd;
            return this;
        }

        public Entity build() {
            Objects.requireNonNull(adifValue, "adif is required");
            Objects.requireNonNull(name, "name is required");
            return new Entity(this);
        }
    }
}
