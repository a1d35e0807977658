package com.callsign.resolution.cache;

import com.callsign.resolution.analysis.AnalysisResult;

import java.time.Instant;
import java.util.Optional;

/**
 * No-op cache implementation. Used as the default when caching is disabled.
 */
public class NoOpAnalysisCache implements AnalysisCache {

    @Override
    public Optional<AnalysisResult> get(String call, Instant timestamp) {
        return Optional.empty();
    }

    @Override
    public void put(String call, Instant timestamp, AnalysisResult result) {
        // no-op
    }

    @Override
    public void invalidateAll() {
        // no-op
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.empty();
    }
}
