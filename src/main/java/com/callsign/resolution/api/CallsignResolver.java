package com.callsign.resolution.api;

import com.callsign.resolution.analysis.AnalysisResult;
import com.callsign.resolution.analysis.CallsignAnalyzer;
import com.callsign.resolution.analysis.InvalidCallsignException;
import com.callsign.resolution.cache.AnalysisCache;
import com.callsign.resolution.cache.CacheStats;
import com.callsign.resolution.cache.CaffeineAnalysisCache;
import com.callsign.resolution.cache.NoOpAnalysisCache;
import com.callsign.resolution.core.model.Callsign;
import com.callsign.resolution.logging.LogContext;
import com.callsign.resolution.metrics.MetricsService;
import com.callsign.resolution.metrics.NoOpMetricsService;
import com.callsign.resolution.table.OverlapPolicy;
import com.callsign.resolution.table.ReferenceData;
import com.callsign.resolution.table.ReferenceTable;
import com.callsign.resolution.table.ReferenceTableException;
import com.callsign.resolution.table.WindowOverlap;
import com.callsign.resolution.table.WindowOverlapValidator;
import com.callsign.resolution.whitelist.WhitelistChecker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Main entry point of the callsign resolution library.
 *
 * <h2>Example usage:</h2>
 * <pre>
 * CallsignResolver resolver = CallsignResolver.builder()
 *     .referenceTable(table)
 *     .options(ResolverOptions.highVolume())
 *     .build();
 *
 * AnalysisResult result = resolver.analyze("SV0ABC/9", qsoTime);
 * result.getCallsign().ifPresent(call -&gt; {
 *     boolean counts = resolver.isAllowed(call.getCall(), call.getAdif(), qsoTime);
 * });
 * </pre>
 *
 * <p>The whitelist is never consulted by {@link #analyze}; callers check it afterwards
 * with {@link #isAllowed}.</p>
 */
public class CallsignResolver {
    private static final Logger log = LoggerFactory.getLogger(CallsignResolver.class);

    private final ReferenceData referenceData;
    private final CallsignAnalyzer analyzer;
    private final WhitelistChecker whitelistChecker;
    private final AnalysisCache cache;
    private final MetricsService metricsService;
    private final ResolverOptions options;

    private CallsignResolver(Builder builder) {
        this.options = builder.options;
        validate(builder.table, options.getOverlapPolicy());

        this.referenceData = options.getBackend().create(builder.table);
        this.analyzer = new CallsignAnalyzer(referenceData);
        this.whitelistChecker = new WhitelistChecker(referenceData);
        this.metricsService = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();

        if (builder.cache != null) {
            this.cache = builder.cache;
        } else if (options.getCacheConfig().enabled()) {
            this.cache = new CaffeineAnalysisCache(options.getCacheConfig());
        } else {
            this.cache = new NoOpAnalysisCache();
        }

        log.info("CallsignResolver initialized: table={} options={}", builder.table, options);
    }

    /**
     * Analyzes a callsign at the given instant.
     *
     * @param call      complete callsign, upper case
     * @param timestamp instant of the contact, UTC
     * @return the resolved callsign or the reason it could not be resolved
     */
    public AnalysisResult analyze(String call, Instant timestamp) {
        Objects.requireNonNull(call, "call is required");
        Objects.requireNonNull(timestamp, "timestamp is required");

        Optional<AnalysisResult> cached = cache.get(call, timestamp);
        if (cached.isPresent()) {
            metricsService.recordCacheHit();
            return cached.get();
        }
        metricsService.recordCacheMiss();

        AnalysisResult result;
        try (LogContext ctx = LogContext.forAnalysis(call, timestamp.toString())) {
            long start = System.nanoTime();
            result = analyzer.analyze(call, timestamp);
            metricsService.recordAnalysisDuration(result.outcome(), Duration.ofNanos(System.nanoTime() - start));
            result.getError().ifPresent(metricsService::incrementAnalysisError);
        }

        cache.put(call, timestamp, result);
        return result;
    }

    /**
     * Analyzes a callsign and returns the resolved callsign.
     *
     * @throws InvalidCallsignException if the call cannot be resolved
     */
    public Callsign resolve(String call, Instant timestamp) {
        return analyze(call, timestamp).orElseThrow();
    }

    /**
     * Checks the whitelist of the entity the call was resolved to.
     *
     * @param call      complete callsign
     * @param adif      ADIF identifier the call was resolved to
     * @param timestamp instant of the contact, UTC
     * @return false only if the entity is whitelisted and the call is not approved
     */
    public boolean isAllowed(String call, int adif, Instant timestamp) {
        boolean allowed = whitelistChecker.isAllowed(adif, call, timestamp);
        if (!allowed) {
            metricsService.incrementWhitelistRejected();
        }
        return allowed;
    }

    public ReferenceData getReferenceData() {
        return referenceData;
    }

    public ResolverOptions getOptions() {
        return options;
    }

    public MetricsService getMetricsService() {
        return metricsService;
    }

    public CacheStats getCacheStats() {
        return cache.getStats();
    }

    private static void validate(ReferenceTable table, OverlapPolicy policy) {
        if (policy == OverlapPolicy.IGNORE) {
            return;
        }
        List<WindowOverlap> overlaps = new WindowOverlapValidator().validate(table);
        if (overlaps.isEmpty()) {
            return;
        }
        if (policy == OverlapPolicy.FAIL) {
            throw new ReferenceTableException(
                    overlaps.size() + " key groups with overlapping validity windows: " + overlaps, overlaps);
        }
        for (WindowOverlap overlap : overlaps) {
            log.warn("reference.overlap {} - lookups return record {}", overlap, overlap.firstRecord());
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private ReferenceTable table;
        private ResolverOptions options = ResolverOptions.defaults();
        private MetricsService metricsService;
        private AnalysisCache cache;

        public Builder referenceTable(ReferenceTable table) {
            this.table = table;
            return this;
        }

        public Builder options(ResolverOptions options) {
            this.options = Objects.requireNonNull(options, "options is required");
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        /**
         * Uses the given cache instead of one created from the options.
         */
        public Builder analysisCache(AnalysisCache cache) {
            this.cache = cache;
            return this;
        }

        public CallsignResolver build() {
            Objects.requireNonNull(table, "referenceTable is required");
            return new CallsignResolver(this);
        }
    }
}
