package com.callsign.resolution.table;

import com.callsign.resolution.core.model.CallsignException;
import com.callsign.resolution.core.model.Entity;
import com.callsign.resolution.core.model.InvalidOperation;
import com.callsign.resolution.core.model.Prefix;
import com.callsign.resolution.core.model.ZoneException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable in-memory copy of the callsign reference data: entities, prefixes,
 * callsign exceptions, invalid operations and CQ zone exceptions.
 *
 * <p>The table is filled once from an already parsed document and never changes
 * afterwards. Every list keeps the insertion order, which decides the winner when several
 * records of a key are active at the same instant.</p>
 */
public final class ReferenceTable {

    private final Instant date;
    private final List<Entity> entities;
    private final List<Prefix> prefixes;
    private final List<CallsignException> callsignExceptions;
    private final List<InvalidOperation> invalidOperations;
    private final List<ZoneException> zoneExceptions;

    private ReferenceTable(Builder builder) {
        this.date = builder.date;
        this.entities = List.copyOf(builder.entities);
        this.prefixes = List.copyOf(builder.prefixes);
        this.callsignExceptions = List.copyOf(builder.callsignExceptions);
        this.invalidOperations = List.copyOf(builder.invalidOperations);
        this.zoneExceptions = List.copyOf(builder.zoneExceptions);
    }

    /**
     * Date the source data was published, if known.
     */
    public Optional<Instant> getDate() {
        return Optional.ofNullable(date);
    }

    public List<Entity> getEntities() {
        return entities;
    }

    public List<Prefix> getPrefixes() {
        return prefixes;
    }

    public List<CallsignException> getCallsignExceptions() {
        return callsignExceptions;
    }

    public List<InvalidOperation> getInvalidOperations() {
        return invalidOperations;
    }

    public List<ZoneException> getZoneExceptions() {
        return zoneExceptions;
    }

    public int size() {
        return entities.size() + prefixes.size() + callsignExceptions.size()
                + invalidOperations.size() + zoneExceptions.size();
    }

    @Override
    public String toString() {
        return "ReferenceTable{" +
                "date=" + date +
                ", entities=" + entities.size() +
                ", prefixes=" + prefixes.size() +
                ", callsignExceptions=" + callsignExceptions.size() +
                ", invalidOperations=" + invalidOperations.size() +
                ", zoneExceptions=" + zoneExceptions.size() +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Instant date;
        private final List<Entity> entities = new ArrayList<>();
        private final List<Prefix> prefixes = new ArrayList<>();
        private final List<CallsignException> callsignExceptions = new ArrayList<>();
        private final List<InvalidOperation> invalidOperations = new ArrayList<>();
        private final List<ZoneException> zoneExceptions = new ArrayList<>();

        public Builder date(Instant date) {
            this.date = date;
            return this;
        }

        public Builder entity(Entity entity) {
            entities.add(Objects.requireNonNull(entity, "entity is required"));
            return this;
        }

        public Builder entities(Collection<Entity> entities) {
            entities.forEach(this::entity);
            return this;
        }

        public Builder prefix(Prefix prefix) {
            prefixes.add(Objects.requireNonNull(prefix, "prefix is required"));
            return this;
        }

        public Builder prefixes(Collection<Prefix> prefixes) {
            prefixes.forEach(this::prefix);
            return this;
        }

        public Builder callsignException(CallsignException exception) {
            callsignExceptions.add(Objects.requireNonNull(exception, "exception is required"));
            return this;
        }

        public Builder callsignExceptions(Collection<CallsignException> exceptions) {
            exceptions.forEach(this::callsignException);
            return this;
        }

        public Builder invalidOperation(InvalidOperation invalidOperation) {
            invalidOperations.add(Objects.requireNonNull(invalidOperation, "invalidOperation is required"));
            return this;
        }

        public Builder invalidOperations(Collection<InvalidOperation> invalidOperations) {
            invalidOperations.forEach(this::invalidOperation);
            return this;
        }

        public Builder zoneException(ZoneException zoneException) {
            zoneExceptions.add(Objects.requireNonNull(zoneException, "zoneException is required"));
            return this;
        }

        public Builder zoneExceptions(Collection<ZoneException> zoneExceptions) {
            zoneExceptions.forEach(this::zoneException);
            return this;
        }

        public ReferenceTable build() {
            return new ReferenceTable(this);
        }
    }
}
