package com.callsign.resolution.prefix;

import com.callsign.resolution.core.model.Prefix;
import com.callsign.resolution.table.ReferenceData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Finds the most specific prefix for a candidate string by trying every length from the
 * full candidate down to its first character.
 *
 * <p>Shortening from the right is what ties {@code UA9ABC} to the prefix {@code UA9}
 * instead of {@code U}. At each length, compound prefixes formed with the single-letter
 * appendices of the call are tried before the plain string, so {@code SV1ABC/A} matches
 * {@code SV/A} rather than {@code SV}.</p>
 */
public class PrefixResolver {
    private static final Logger log = LoggerFactory.getLogger(PrefixResolver.class);

    private final ReferenceData referenceData;

    public PrefixResolver(ReferenceData referenceData) {
        this.referenceData = Objects.requireNonNull(referenceData, "referenceData is required");
    }

    /**
     * Resolves a candidate without considering any appendices.
     */
    public Optional<PrefixMatch> resolve(String candidate, Instant timestamp) {
        return resolve(candidate, timestamp, List.of());
    }

    /**
     * Resolves a candidate to its most specific prefix.
     *
     * @param candidate  the potential prefix, usually a whole callsign part
     * @param timestamp  instant the prefix must be valid at
     * @param appendices the other parts of the call; only single letters are used
     * @return the match and the number of characters removed, or empty if not even the
     *         first character is a prefix
     */
    public Optional<PrefixMatch> resolve(String candidate, Instant timestamp, Collection<String> appendices) {
        Objects.requireNonNull(candidate, "candidate is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
        if (candidate.isEmpty()) {
            throw new IllegalArgumentException("candidate must not be empty");
        }

        List<String> letters = singleLetterAppendices(appendices);
        int length = candidate.length();

        for (int cnt = length; cnt >= 1; cnt--) {
            String slice = candidate.substring(0, cnt);

            for (String letter : letters) {
                Optional<Prefix> compound = referenceData.getPrefix(slice + "/" + letter, timestamp);
                if (compound.isPresent()) {
                    log.debug("prefix.matched candidate={} prefix={} removed={}",
                            candidate, compound.get().call(), length - cnt);
                    return Optional.of(new PrefixMatch(compound.get(), length - cnt));
                }
            }

            Optional<Prefix> plain = referenceData.getPrefix(slice, timestamp);
            if (plain.isPresent()) {
                log.debug("prefix.matched candidate={} prefix={} removed={}",
                        candidate, plain.get().call(), length - cnt);
                return Optional.of(new PrefixMatch(plain.get(), length - cnt));
            }
        }
        return Optional.empty();
    }

    private static List<String> singleLetterAppendices(Collection<String> appendices) {
        if (appendices == null || appendices.isEmpty()) {
            return List.of();
        }
        List<String> letters = new ArrayList<>();
        for (String appendix : appendices) {
            if (isSingleLetter(appendix)) {
                letters.add(appendix);
            }
        }
        return letters;
    }

    static boolean isSingleLetter(String part) {
        return part != null && part.length() == 1 && Character.isLetter(part.charAt(0));
    }
}
