package com.callsign.resolution.metrics;

import com.callsign.resolution.core.model.CallsignError;

import java.time.Duration;

/**
 * Interface for recording callsign analysis metrics.
 * The default {@link NoOpMetricsService} does nothing, so the library works without any
 * metrics backend.
 */
public interface MetricsService {

    /**
     * Records the duration of one analysis.
     *
     * @param outcome  {@code resolved} or the lower case error name
     * @param duration time spent
     */
    void recordAnalysisDuration(String outcome, Duration duration);

    void incrementAnalysisError(CallsignError error);

    void incrementWhitelistRejected();

    void recordVerificationBatchSize(long size);

    void recordCacheHit();

    void recordCacheMiss();
}
