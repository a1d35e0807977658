package com.callsign.resolution.analysis;

import com.callsign.resolution.core.model.Callsign;
import com.callsign.resolution.core.model.ResolutionSource;

import java.util.Optional;

/**
 * Some prefix records name maritime mobile instead of an entity.
 */
public class MaritimePrefixStage implements AnalysisStage {

    @Override
    public Optional<AnalysisResult> apply(AnalysisContext context) {
        if (context.homecallMatch().prefix().isMaritimeMobile()) {
            return Optional.of(AnalysisResult.success(
                    Callsign.maritimeMobile(context.call(), ResolutionSource.MARITIME_PREFIX)));
        }
        return Optional.empty();
    }
}
