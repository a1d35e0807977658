package com.callsign.resolution.bulk;

import com.callsign.resolution.api.CallsignResolver;
import com.callsign.resolution.logging.LogContext;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Objects;

/**
 * JSON log verifier.
 *
 * <p>Expected format: a JSON array of contacts with an ISO-8601 UTC timestamp.</p>
 * <pre>
 * [
 *   {"call": "SV9ABC", "adif": 40, "timestamp": "2019-04-12T15:32:00Z"},
 *   {"call": "AB1CD/MM", "adif": 0, "timestamp": "2019-04-12T15:33:00Z"}
 * ]
 * </pre>
 *
 * <p>Unknown properties are ignored. Elements are numbered from 1 in error reports.</p>
 */
public class JsonLogVerifier implements LogVerifier {
    private static final Logger log = LoggerFactory.getLogger(JsonLogVerifier.class);
    private static final int PROGRESS_INTERVAL = 100;

    private final CallsignResolver resolver;
    private final ObjectMapper objectMapper;

    public JsonLogVerifier(CallsignResolver resolver) {
        this(resolver, new ObjectMapper());
    }

    public JsonLogVerifier(CallsignResolver resolver, ObjectMapper objectMapper) {
        this.resolver = Objects.requireNonNull(resolver, "resolver is required");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper is required");
    }

    @Override
    public VerificationResult verify(InputStream input, ProgressCallback callback) {
        return verify(new InputStreamReader(input, StandardCharsets.UTF_8), callback);
    }

    @Override
    public VerificationResult verify(Reader reader, ProgressCallback callback) {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        EntryVerifier verifier = new EntryVerifier(resolver);

        try (LogContext ctx = LogContext.forVerification(LogContext.generateBatchId(), getFormat());
             Reader r = reader) {
            JsonNode root = objectMapper.readTree(r);
            if (root == null || root.isMissingNode()) {
                return verifier.result();
            }
            if (!root.isArray()) {
                verifier.unreadable(0, root.getNodeType().toString(), "expected a JSON array of contacts");
                return verifier.result();
            }

            long index = 0;
            for (JsonNode node : root) {
                index++;
                LogEntry entry;
                try {
                    entry = parseEntry(index, node);
                } catch (IllegalArgumentException | DateTimeParseException e) {
                    verifier.unreadable(index, node.toString(), e.getMessage());
                    continue;
                }
                verifier.verify(entry);

                if (verifier.total() % PROGRESS_INTERVAL == 0) {
                    cb.onProgress(verifier.total(), root.size(), "Verified " + verifier.total() + " entries");
                }
            }

            VerificationResult result = verifier.result();
            cb.onProgress(result.totalEntries(), result.totalEntries(), "Verification completed");
            log.info("verification.completed result={}", result);
            return result;
        } catch (JsonProcessingException e) {
            log.error("verification.failed error={}", e.getOriginalMessage());
            verifier.unreadable(0, "", "malformed JSON: " + e.getOriginalMessage());
            return verifier.result();
        } catch (IOException e) {
            log.error("verification.failed error={}", e.getMessage());
            verifier.unreadable(0, "", "IO error: " + e.getMessage());
            return verifier.result();
        }
    }

    @Override
    public String getFormat() {
        return "json";
    }

    static LogEntry parseEntry(long index, JsonNode node) {
        if (!node.isObject()) {
            throw new IllegalArgumentException("expected a JSON object");
        }
        JsonNode call = node.get("call");
        if (call == null || !call.isTextual() || call.asText().isBlank()) {
            throw new IllegalArgumentException("missing call");
        }
        JsonNode adif = node.get("adif");
        if (adif == null || !adif.canConvertToInt() || !adif.isIntegralNumber()) {
            throw new IllegalArgumentException("missing or invalid adif");
        }
        JsonNode timestamp = node.get("timestamp");
        if (timestamp == null || !timestamp.isTextual()) {
            throw new IllegalArgumentException("missing timestamp");
        }
        return new LogEntry(index, call.asText().trim().toUpperCase(Locale.ROOT), adif.asInt(),
                Instant.parse(timestamp.asText()));
    }
}
