package com.callsign.resolution.api;

import com.callsign.resolution.cache.CacheConfig;
import com.callsign.resolution.table.OverlapPolicy;
import com.callsign.resolution.table.ReferenceDataBackend;

import java.util.Objects;

/**
 * Options for building a {@link CallsignResolver}: the reference data backend, how to
 * treat overlapping validity windows and the analysis cache.
 */
public class ResolverOptions {

    private final ReferenceDataBackend backend;
    private final OverlapPolicy overlapPolicy;
    private final CacheConfig cacheConfig;

    private ResolverOptions(Builder builder) {
        this.backend = builder.backend;
        this.overlapPolicy = builder.overlapPolicy;
        this.cacheConfig = builder.cacheConfig;
    }

    public ReferenceDataBackend getBackend() {
        return backend;
    }

    public OverlapPolicy getOverlapPolicy() {
        return overlapPolicy;
    }

    public CacheConfig getCacheConfig() {
        return cacheConfig;
    }

    /**
     * Creates default options: indexed backend, overlaps logged, no cache.
     */
    public static ResolverOptions defaults() {
        return builder().build();
    }

    /**
     * Creates options for verifying large logs: indexed backend and cached results.
     */
    public static ResolverOptions highVolume() {
        return builder()
                .backend(ReferenceDataBackend.INDEXED)
                .cacheConfig(CacheConfig.defaults())
                .build();
    }

    /**
     * Creates strict options rejecting tables with ambiguous lookups.
     */
    public static ResolverOptions strict() {
        return builder().overlapPolicy(OverlapPolicy.FAIL).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "ResolverOptions{" +
                "backend=" + backend +
                ", overlapPolicy=" + overlapPolicy +
                ", cacheConfig=" + cacheConfig +
                '}';
    }

    public static class Builder {
        private ReferenceDataBackend backend = ReferenceDataBackend.INDEXED;
        private OverlapPolicy overlapPolicy = OverlapPolicy.WARN;
        private CacheConfig cacheConfig = CacheConfig.disabled();

        public Builder backend(ReferenceDataBackend backend) {
            this.backend = Objects.requireNonNull(backend, "backend is required");
            return this;
        }

        public Builder overlapPolicy(OverlapPolicy overlapPolicy) {
            this.overlapPolicy = Objects.requireNonNull(overlapPolicy, "overlapPolicy is required");
            return this;
        }

        public Builder cacheConfig(CacheConfig cacheConfig) {
            this.cacheConfig = Objects.requireNonNull(cacheConfig, "cacheConfig is required");
            return this;
        }

        public ResolverOptions build() {
            return new ResolverOptions(this);
        }
    }
}
