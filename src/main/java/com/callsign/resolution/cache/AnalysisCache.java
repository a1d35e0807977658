package com.callsign.resolution.cache;

import com.callsign.resolution.analysis.AnalysisResult;

import java.time.Instant;
import java.util.Optional;

/**
 * Cache for analysis results, keyed by the exact call and instant.
 * Analysis is a pure function of both for a fixed reference table, so a cached result
 * never goes stale while the table stays the same.
 */
public interface AnalysisCache {

    /**
     * Gets a cached analysis result.
     *
     * @param call      the analyzed call
     * @param timestamp the instant of the analysis
     * @return the cached result, or empty if not cached
     */
    Optional<AnalysisResult> get(String call, Instant timestamp);

    /**
     * Caches an analysis result.
     */
    void put(String call, Instant timestamp, AnalysisResult result);

    /**
     * Invalidates all cache entries, e.g. after switching to a new reference table.
     */
    void invalidateAll();

    CacheStats getStats();
}
