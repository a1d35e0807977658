package com.callsign.resolution.analysis;

import com.callsign.resolution.core.model.Callsign;
import com.callsign.resolution.table.ReferenceData;

import java.util.Optional;

/**
 * Resolves calls with a callsign exception directly from the exception, without
 * looking at the prefix list.
 */
public class CallsignExceptionStage implements AnalysisStage {

    private final ReferenceData referenceData;

    public CallsignExceptionStage(ReferenceData referenceData) {
        this.referenceData = referenceData;
    }

    @Override
    public Optional<AnalysisResult> apply(AnalysisContext context) {
        return referenceData.getCallsignException(context.call(), context.timestamp())
                .map(exception -> AnalysisResult.success(Callsign.fromException(context.call(), exception)));
    }
}
