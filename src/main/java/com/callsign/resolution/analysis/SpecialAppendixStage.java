package com.callsign.resolution.analysis;

import com.callsign.resolution.core.model.Callsign;
import com.callsign.resolution.core.model.CallsignError;
import com.callsign.resolution.core.model.ResolutionSource;
import com.callsign.resolution.core.model.SpecialEntity;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * An /AM, /MM or /SAT appendix means the call counts for no entity, whatever its prefix.
 * More than one such appendix is ambiguous and rejected.
 */
public class SpecialAppendixStage implements AnalysisStage {

    @Override
    public Optional<AnalysisResult> apply(AnalysisContext context) {
        List<SpecialEntity> found = new ArrayList<>();
        for (String appendix : context.appendices()) {
            SpecialEntity.fromAppendix(appendix).ifPresent(found::add);
        }

        if (found.isEmpty()) {
            return Optional.empty();
        }
        if (found.size() > 1) {
            return Optional.of(AnalysisResult.failure(context.call(), CallsignError.MULTIPLE_SPECIAL_APPENDICES));
        }
        return Optional.of(AnalysisResult.success(
                Callsign.special(context.call(), found.get(0), ResolutionSource.SPECIAL_APPENDIX)));
    }
}
