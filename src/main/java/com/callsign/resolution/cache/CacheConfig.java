package com.callsign.resolution.cache;

import java.time.Duration;
import java.util.Objects;

/**
 * Sizing of the analysis cache. Results depend only on the call, the instant and the
 * reference table a resolver was built with, so entries never go stale; they are only
 * dropped to bound memory, by count and by time since the last lookup.
 *
 * @param maxEntries        maximum number of cached (call, instant) results
 * @param expireAfterAccess idle time after which an entry is dropped
 * @param enabled           whether results are cached at all
 */
public record CacheConfig(long maxEntries, Duration expireAfterAccess, boolean enabled) {

    public CacheConfig {
        Objects.requireNonNull(expireAfterAccess, "expireAfterAccess is required");
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be > 0");
        }
        if (expireAfterAccess.isNegative() || expireAfterAccess.isZero()) {
            throw new IllegalArgumentException("expireAfterAccess must be positive");
        }
    }

    /**
     * Enough for a few large contest logs checked repeatedly: 50,000 results, idle for an hour.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(50_000, Duration.ofHours(1), true);
    }

    /**
     * Holds every contact of one log of the given size for the duration of a checking
     * session, so a second verification pass is answered from the cache.
     */
    public static CacheConfig forLog(long contacts) {
        return new CacheConfig(contacts, Duration.ofMinutes(15), true);
    }

    public static CacheConfig disabled() {
        return new CacheConfig(1, Duration.ofSeconds(1), false);
    }
}
