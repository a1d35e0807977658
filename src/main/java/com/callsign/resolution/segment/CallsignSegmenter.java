package com.callsign.resolution.segment;

import com.callsign.resolution.core.model.CallsignError;
import com.callsign.resolution.prefix.PrefixResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Splits a callsign on {@code /}, classifies each part as prefix or other and checks the
 * overall shape with a small state machine: the call must begin with a prefix and may
 * have at most two leading prefixes, followed by any number of appendices.
 */
public class CallsignSegmenter {
    private static final Logger log = LoggerFactory.getLogger(CallsignSegmenter.class);

    /**
     * Appendices never taken as prefixes after the first part. {@code MM} as a whole call
     * is Scotland, as a trailing part it signals maritime mobile operation.
     */
    public static final Set<String> RESERVED_APPENDICES = Set.of("AM", "MM", "SAT", "P", "M", "QRP", "LH");

    private final PrefixResolver prefixResolver;

    public CallsignSegmenter(PrefixResolver prefixResolver) {
        this.prefixResolver = Objects.requireNonNull(prefixResolver, "prefixResolver is required");
    }

    public Segmentation segment(String call, Instant timestamp) {
        Objects.requireNonNull(call, "call is required");
        String[] texts = call.split("/", -1);
        for (String text : texts) {
            if (text.isEmpty()) {
                log.debug("segment.failed call={} error={}", call, CallsignError.BASIC_FORMAT);
                return Segmentation.failed(List.of(), CallsignError.BASIC_FORMAT);
            }
        }
        List<CallsignPart> parts = classify(texts, timestamp);

        State state = State.NO_PREFIX;
        for (CallsignPart part : parts) {
            switch (state) {
                case NO_PREFIX -> {
                    if (!part.isPrefix()) {
                        log.debug("segment.failed call={} error={}", call, CallsignError.BEGIN_WITHOUT_PREFIX);
                        return Segmentation.failed(parts, CallsignError.BEGIN_WITHOUT_PREFIX);
                    }
                    state = State.SINGLE_PREFIX;
                }
                case SINGLE_PREFIX -> state = part.isPrefix() ? State.TWO_PREFIXES : State.ONE_PREFIX;
                case ONE_PREFIX, TWO_PREFIXES -> {
                    if (part.isPrefix()) {
                        log.debug("segment.failed call={} error={}", call, CallsignError.THIRD_PREFIX);
                        return Segmentation.failed(parts, CallsignError.THIRD_PREFIX);
                    }
                }
            }
        }

        CallsignShape shape = switch (state) {
            case SINGLE_PREFIX -> CallsignShape.SINGLE_PREFIX;
            case ONE_PREFIX -> CallsignShape.ONE_PREFIX_WITH_APPENDICES;
            case TWO_PREFIXES -> CallsignShape.TWO_PREFIXES;
            case NO_PREFIX -> throw new IllegalStateException("No parts in call '" + call + "'");
        };
        return Segmentation.of(parts, shape);
    }

    private List<CallsignPart> classify(String[] texts, Instant timestamp) {
        List<CallsignPart> parts = new ArrayList<>(texts.length);
        for (int pos = 0; pos < texts.length; pos++) {
            String text = texts[pos];
            boolean prefix = prefixResolver.resolve(text, timestamp).isPresent()
                    && (pos == 0 || !RESERVED_APPENDICES.contains(text));
            parts.add(new CallsignPart(text, prefix ? PartType.PREFIX : PartType.OTHER));
        }
        return parts;
    }

    private enum State {
        NO_PREFIX,
        SINGLE_PREFIX,
        ONE_PREFIX,
        TWO_PREFIXES
    }
}
