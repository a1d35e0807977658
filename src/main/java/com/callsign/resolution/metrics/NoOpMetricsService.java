package com.callsign.resolution.metrics;

import com.callsign.resolution.core.model.CallsignError;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordAnalysisDuration(String outcome, Duration duration) {
    }

    @Override
    public void incrementAnalysisError(CallsignError error) {
    }

    @Override
    public void incrementWhitelistRejected() {
    }

    @Override
    public void recordVerificationBatchSize(long size) {
    }

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }
}
