package com.callsign.resolution.cache;

import com.callsign.resolution.analysis.AnalysisResult;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Optional;

/**
 * Caffeine-backed analysis cache. Log checking analyzes the same calls at the same
 * contact times over and over, e.g. when a log is verified repeatedly.
 */
public class CaffeineAnalysisCache implements AnalysisCache {
    private static final Logger log = LoggerFactory.getLogger(CaffeineAnalysisCache.class);

    private final Cache<CacheKey, AnalysisResult> cache;

    public CaffeineAnalysisCache(CacheConfig config) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxEntries())
                .expireAfterAccess(config.expireAfterAccess())
                .recordStats()
                .build();
        log.info("CaffeineAnalysisCache initialized: maxEntries={}, expireAfterAccess={}",
                config.maxEntries(), config.expireAfterAccess());
    }

    @Override
    public Optional<AnalysisResult> get(String call, Instant timestamp) {
        return Optional.ofNullable(cache.getIfPresent(new CacheKey(call, timestamp)));
    }

    @Override
    public void put(String call, Instant timestamp, AnalysisResult result) {
        cache.put(new CacheKey(call, timestamp), result);
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
        log.debug("Invalidated all cache entries");
    }

    @Override
    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats caffeineStats = cache.stats();
        return new CacheStats(
                caffeineStats.hitCount(),
                caffeineStats.missCount(),
                caffeineStats.evictionCount(),
                cache.estimatedSize()
        );
    }

    record CacheKey(String call, Instant timestamp) {}
}
