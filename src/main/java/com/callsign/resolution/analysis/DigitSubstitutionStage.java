package com.callsign.resolution.analysis;

import com.callsign.resolution.core.model.Callsign;
import com.callsign.resolution.core.model.CallsignError;
import com.callsign.resolution.prefix.PrefixMatch;
import com.callsign.resolution.prefix.PrefixResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A single digit appendix replaces the digit of the homecall and may select a different
 * prefix: {@code SV0ABC/9} is Crete ({@code SV9}), not Greece ({@code SV}).
 * The substituted match is used only when it names another prefix record and is at least
 * as specific as the homecall match; {@code AB9CD/1} keeps {@code AB9}.
 * More than one single digit appendix is ambiguous and rejected.
 */
public class DigitSubstitutionStage implements AnalysisStage {
    private static final Logger log = LoggerFactory.getLogger(DigitSubstitutionStage.class);

    // Greedy first group, so the last digit followed by at least one character is replaced
    private static final Pattern HOMECALL = Pattern.compile("^([A-Z0-9]+)(\\d)([A-Z0-9]+)$");

    private final PrefixResolver prefixResolver;

    public DigitSubstitutionStage(PrefixResolver prefixResolver) {
        this.prefixResolver = prefixResolver;
    }

    @Override
    public Optional<AnalysisResult> apply(AnalysisContext context) {
        List<String> digits = new ArrayList<>();
        for (String appendix : context.appendices()) {
            if (appendix.length() == 1 && Character.isDigit(appendix.charAt(0))) {
                digits.add(appendix);
            }
        }

        if (digits.isEmpty()) {
            return Optional.empty();
        }
        if (digits.size() > 1) {
            return Optional.of(AnalysisResult.failure(context.call(), CallsignError.MULTIPLE_SINGLE_DIGIT_APPENDICES));
        }

        String substituted = substitute(context.homecall(), digits.get(0));
        Optional<PrefixMatch> match = prefixResolver.resolve(substituted, context.timestamp(), context.appendices());
        PrefixMatch homecallMatch = context.homecallMatch();
        if (match.isEmpty()
                || match.get().prefix().equals(homecallMatch.prefix())
                || !match.get().isAtLeastAsSpecificAs(homecallMatch)) {
            return Optional.empty();
        }
        log.debug("analysis.digit_substitution call={} homecall={} substituted={} prefix={}",
                context.call(), context.homecall(), substituted, match.get().prefix().call());
        return Optional.of(AnalysisResult.success(Callsign.fromPrefix(context.call(), match.get().prefix())));
    }

    /**
     * Replaces the last inner digit of the homecall, leaving it unchanged if it has no
     * digit between other characters.
     */
    static String substitute(String homecall, String digit) {
        Matcher matcher = HOMECALL.matcher(homecall);
        if (!matcher.matches()) {
            return homecall;
        }
        return matcher.group(1) + digit + matcher.group(3);
    }
}
