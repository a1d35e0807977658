package com.callsign.resolution.analysis;

import com.callsign.resolution.prefix.PrefixMatch;
import com.callsign.resolution.segment.Segmentation;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Inputs available to an {@link AnalysisStage}.
 *
 * @param call          the complete callsign
 * @param timestamp     instant of the analysis
 * @param segmentation  classified parts, null before segmentation
 * @param homecallMatch prefix of the first part with the remaining parts as appendices,
 *                      null before segmentation
 */
public record AnalysisContext(String call, Instant timestamp, Segmentation segmentation,
                              PrefixMatch homecallMatch) {

    public AnalysisContext {
        Objects.requireNonNull(call, "call is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
    }

    public static AnalysisContext of(String call, Instant timestamp) {
        return new AnalysisContext(call, timestamp, null, null);
    }

    public AnalysisContext withHomecall(Segmentation segmentation, PrefixMatch homecallMatch) {
        return new AnalysisContext(call, timestamp, segmentation, homecallMatch);
    }

    /**
     * The first part of the call.
     */
    public String homecall() {
        return segmentation.part(0);
    }

    /**
     * All parts after the first one.
     */
    public List<String> appendices() {
        return segmentation.partsFrom(1);
    }
}
