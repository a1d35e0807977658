package com.callsign.resolution.metrics;

import com.callsign.resolution.core.model.CallsignError;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code callsign.analysis.duration} - Timer (tag: outcome)</li>
 *   <li>{@code callsign.analysis.error} - Counter (tag: error)</li>
 *   <li>{@code callsign.whitelist.rejected} - Counter</li>
 *   <li>{@code callsign.verification.batch.size} - DistributionSummary</li>
 *   <li>{@code callsign.cache.hit} - Counter</li>
 *   <li>{@code callsign.cache.miss} - Counter</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<CallsignError, Counter> errorCounters = new ConcurrentHashMap<>();
    private final Counter whitelistRejectedCounter;
    private final DistributionSummary batchSizeSummary;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.whitelistRejectedCounter = Counter.builder("callsign.whitelist.rejected")
                .description("Number of calls rejected by an entity whitelist")
                .register(registry);
        this.batchSizeSummary = DistributionSummary.builder("callsign.verification.batch.size")
                .description("Distribution of verified log sizes")
                .register(registry);
        this.cacheHitCounter = Counter.builder("callsign.cache.hit")
                .description("Number of analysis cache hits")
                .register(registry);
        this.cacheMissCounter = Counter.builder("callsign.cache.miss")
                .description("Number of analysis cache misses")
                .register(registry);
    }

    @Override
    public void recordAnalysisDuration(String outcome, Duration duration) {
        Timer timer = timerCache.computeIfAbsent(outcome, k ->
                Timer.builder("callsign.analysis.duration")
                        .description("Duration of callsign analyses")
                        .tag("outcome", outcome)
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void incrementAnalysisError(CallsignError error) {
        Counter counter = errorCounters.computeIfAbsent(error, k ->
                Counter.builder("callsign.analysis.error")
                        .description("Number of calls that could not be resolved")
                        .tag("error", error.name())
                        .register(registry));
        counter.increment();
    }

    @Override
    public void incrementWhitelistRejected() {
        whitelistRejectedCounter.increment();
    }

    @Override
    public void recordVerificationBatchSize(long size) {
        batchSizeSummary.record(size);
    }

    @Override
    public void recordCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMissCounter.increment();
    }
}
