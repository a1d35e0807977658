package com.callsign.resolution.analysis;

import com.callsign.resolution.core.model.CallsignError;
import com.callsign.resolution.table.ReferenceData;

import java.util.Optional;

/**
 * Rejects calls listed as invalid operations at the instant of the analysis.
 */
public class InvalidOperationStage implements AnalysisStage {

    private final ReferenceData referenceData;

    public InvalidOperationStage(ReferenceData referenceData) {
        this.referenceData = referenceData;
    }

    @Override
    public Optional<AnalysisResult> apply(AnalysisContext context) {
        if (referenceData.isInvalidOperation(context.call(), context.timestamp())) {
            return Optional.of(AnalysisResult.failure(context.call(), CallsignError.INVALID_OPERATION));
        }
        return Optional.empty();
    }
}
