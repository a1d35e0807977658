package com.callsign.resolution.analysis;

import java.util.Optional;

/**
 * One step of the ordered override pipeline of the {@link CallsignAnalyzer}.
 * The first stage returning a result decides the outcome; later stages are skipped.
 */
@FunctionalInterface
public interface AnalysisStage {

    /**
     * Evaluates the stage.
     *
     * @return the final result, or empty to pass on to the next stage
     */
    Optional<AnalysisResult> apply(AnalysisContext context);
}
