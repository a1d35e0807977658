package com.callsign.resolution.bulk;

import com.callsign.resolution.analysis.AnalysisResult;
import com.callsign.resolution.api.CallsignResolver;
import com.callsign.resolution.core.model.Callsign;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Classifies log entries one at a time and tallies the outcomes of one run.
 * Not thread-safe; each verification run creates its own instance.
 */
class EntryVerifier {
    private static final Logger log = LoggerFactory.getLogger(EntryVerifier.class);

    private final CallsignResolver resolver;
    private final List<VerificationResult.VerificationError> errors = new ArrayList<>();

    private long total;
    private long confirmed;
    private long mismatched;
    private long notWhitelisted;
    private long invalid;

    EntryVerifier(CallsignResolver resolver) {
        this.resolver = resolver;
    }

    VerificationOutcome verify(LogEntry entry) {
        total++;
        AnalysisResult result = resolver.analyze(entry.call(), entry.timestamp());
        if (!result.isSuccess()) {
            invalid++;
            String message = result.getError().map(Object::toString).orElse("invalid");
            errors.add(new VerificationResult.VerificationError(entry.lineNumber(), entry.call(), message));
            return VerificationOutcome.INVALID;
        }

        Callsign callsign = result.getCallsign().orElseThrow();
        if (callsign.getAdif() != entry.adif()) {
            mismatched++;
            errors.add(new VerificationResult.VerificationError(entry.lineNumber(), entry.call(),
                    "logged ADIF " + entry.adif() + " but call resolves to " + callsign.getAdif()));
            log.debug("verification.mismatch line={} call={} logged={} analyzed={}",
                    entry.lineNumber(), entry.call(), entry.adif(), callsign.getAdif());
            return VerificationOutcome.MISMATCHED;
        }

        if (!resolver.isAllowed(entry.call(), entry.adif(), entry.timestamp())) {
            notWhitelisted++;
            errors.add(new VerificationResult.VerificationError(entry.lineNumber(), entry.call(),
                    "call not on the whitelist of ADIF " + entry.adif()));
            return VerificationOutcome.NOT_WHITELISTED;
        }

        confirmed++;
        return VerificationOutcome.CONFIRMED;
    }

    void unreadable(long lineNumber, String input, String message) {
        errors.add(new VerificationResult.VerificationError(lineNumber, input, message));
        log.warn("verification.unreadable line={} input='{}' error={}", lineNumber, input, message);
    }

    long total() {
        return total;
    }

    VerificationResult result() {
        resolver.getMetricsService().recordVerificationBatchSize(total);
        return new VerificationResult(total, confirmed, mismatched, notWhitelisted, invalid, errors);
    }
}
