package com.callsign.resolution.analysis;

import com.callsign.resolution.core.model.Callsign;
import com.callsign.resolution.core.model.CallsignError;
import com.callsign.resolution.core.model.ResolutionSource;
import com.callsign.resolution.prefix.PrefixMatch;
import com.callsign.resolution.prefix.PrefixResolver;
import com.callsign.resolution.segment.CallsignSegmenter;
import com.callsign.resolution.segment.CallsignShape;
import com.callsign.resolution.segment.Segmentation;
import com.callsign.resolution.table.ReferenceData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Analyzes a callsign to find its DXCC entity, CQ zone, continent and location at a
 * given instant.
 *
 * <p>The analysis is an ordered pipeline:</p>
 * <ol>
 *   <li>format check</li>
 *   <li>invalid operation, then callsign exception, both on the exact call</li>
 *   <li>segmentation into prefixes and appendices</li>
 *   <li>for a single prefix with appendices: special appendix, maritime mobile prefix,
 *       single digit substitution, plain homecall prefix</li>
 *   <li>for two prefixes: the more specific one</li>
 *   <li>CQ zone exception on every result derived from the prefix list</li>
 * </ol>
 *
 * <p>The analyzer holds no mutable state; the same call and instant always give the same
 * result and instances may be shared between threads.</p>
 */
public class CallsignAnalyzer {
    private static final Logger log = LoggerFactory.getLogger(CallsignAnalyzer.class);

    // Upper case letters and digits, at least two characters, no empty part between slashes
    private static final Pattern COMPLETE_CALL = Pattern.compile("^(?=.{2,}$)[A-Z0-9]+(?:/[A-Z0-9]+)*$");

    private final PrefixResolver prefixResolver;
    private final CallsignSegmenter segmenter;
    private final List<AnalysisStage> callStages;
    private final List<AnalysisStage> homecallStages;
    private final List<ResultOverride> overrides;

    public CallsignAnalyzer(ReferenceData referenceData) {
        Objects.requireNonNull(referenceData, "referenceData is required");
        this.prefixResolver = new PrefixResolver(referenceData);
        this.segmenter = new CallsignSegmenter(prefixResolver);
        this.callStages = List.of(
                new InvalidOperationStage(referenceData),
                new CallsignExceptionStage(referenceData));
        this.homecallStages = List.of(
                new SpecialAppendixStage(),
                new MaritimePrefixStage(),
                new DigitSubstitutionStage(prefixResolver));
        this.overrides = List.of(new ZoneExceptionOverride(referenceData));
    }

    public AnalysisResult analyze(String call, Instant timestamp) {
        Objects.requireNonNull(call, "call is required");
        Objects.requireNonNull(timestamp, "timestamp is required");

        if (!COMPLETE_CALL.matcher(call).matches()) {
            log.debug("analysis.failed call={} error={}", call, CallsignError.BASIC_FORMAT);
            return AnalysisResult.failure(call, CallsignError.BASIC_FORMAT);
        }

        AnalysisContext context = AnalysisContext.of(call, timestamp);
        Optional<AnalysisResult> decided = evaluate(callStages, context);
        if (decided.isPresent()) {
            return decided.get();
        }

        Segmentation segmentation = segmenter.segment(call, timestamp);
        if (!segmentation.isValid()) {
            return AnalysisResult.failure(call, segmentation.getError().orElseThrow());
        }

        CallsignShape shape = segmentation.getShape().orElseThrow();
        AnalysisResult result = switch (shape) {
            case SINGLE_PREFIX -> analyzeSinglePrefix(context);
            case ONE_PREFIX_WITH_APPENDICES -> analyzeHomecall(context, segmentation);
            case TWO_PREFIXES -> analyzeTwoPrefixes(context, segmentation);
        };
        result = applyOverrides(result, timestamp);
        log.debug("analysis.completed call={} shape={} result={}", call, shape, result);
        return result;
    }

    private AnalysisResult analyzeSinglePrefix(AnalysisContext context) {
        PrefixMatch match = resolveSegmented(context.call(), context, List.of());
        if (match.prefix().isMaritimeMobile()) {
            return AnalysisResult.success(Callsign.maritimeMobile(context.call(), ResolutionSource.MARITIME_PREFIX));
        }
        return AnalysisResult.success(Callsign.fromPrefix(context.call(), match.prefix()));
    }

    private AnalysisResult analyzeHomecall(AnalysisContext context, Segmentation segmentation) {
        List<String> appendices = segmentation.partsFrom(1);
        PrefixMatch homecallMatch = resolveSegmented(segmentation.part(0), context, appendices);

        AnalysisContext homecallContext = context.withHomecall(segmentation, homecallMatch);
        return evaluate(homecallStages, homecallContext)
                .orElseGet(() -> AnalysisResult.success(Callsign.fromPrefix(context.call(), homecallMatch.prefix())));
    }

    /**
     * Picks one of two leading prefixes, as in {@code F/W1AW} or {@code W1ABC/CE0Y}.
     * A compound prefix matched by the first part, as in {@code 3D2/R}, consumed the second
     * part and wins outright. Otherwise the match with fewer removed characters wins, the
     * first part on a tie.
     */
    private AnalysisResult analyzeTwoPrefixes(AnalysisContext context, Segmentation segmentation) {
        List<String> appendices = segmentation.partsFrom(1);
        PrefixMatch first = resolveSegmented(segmentation.part(0), context, appendices);
        PrefixMatch second = resolveSegmented(segmentation.part(1), context, appendices);

        PrefixMatch chosen;
        if (first.prefix().isCompound() || first.isAtLeastAsSpecificAs(second)) {
            chosen = first;
        } else {
            chosen = second;
        }
        log.debug("analysis.two_prefixes call={} first={}({}) second={}({}) chosen={}",
                context.call(), first.prefix().call(), first.charsRemoved(),
                second.prefix().call(), second.charsRemoved(), chosen.prefix().call());
        return AnalysisResult.success(Callsign.fromPrefix(context.call(), chosen.prefix()));
    }

    private PrefixMatch resolveSegmented(String candidate, AnalysisContext context, List<String> appendices) {
        // Segmentation already found a prefix for this part, so a match always exists
        return prefixResolver.resolve(candidate, context.timestamp(), appendices)
                .orElseThrow(() -> new IllegalStateException(
                        "No prefix for segmented part '" + candidate + "' of '" + context.call() + "'"));
    }

    private AnalysisResult applyOverrides(AnalysisResult result, Instant timestamp) {
        Optional<Callsign> callsign = result.getCallsign();
        if (callsign.isEmpty() || callsign.get().getSource() != ResolutionSource.PREFIX) {
            return result;
        }
        Callsign adjusted = callsign.get();
        for (ResultOverride override : overrides) {
            adjusted = override.apply(adjusted, timestamp);
        }
        return adjusted == callsign.get() ? result : AnalysisResult.success(adjusted);
    }

    private static Optional<AnalysisResult> evaluate(List<AnalysisStage> stages, AnalysisContext context) {
        for (AnalysisStage stage : stages) {
            Optional<AnalysisResult> result = stage.apply(context);
            if (result.isPresent()) {
                log.debug("analysis.decided call={} stage={} result={}",
                        context.call(), stage.getClass().getSimpleName(), result.get());
                return result;
            }
        }
        return Optional.empty();
    }
}
