package com.callsign.resolution.bulk;

import com.callsign.resolution.api.CallsignResolver;
import com.callsign.resolution.logging.LogContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Objects;

/**
 * CSV log verifier.
 *
 * <p>Expected CSV format, one contact per line with the ADIF fields
 * {@code CALL,ADIF,QSO_DATE,TIME_ON}:</p>
 * <pre>
 * CALL,ADIF,QSO_DATE,TIME_ON
 * SV9ABC,40,20190412,1532
 * AB1CD/MM,0,20190412,1533
 * </pre>
 *
 * <p>The header row is optional; a first line starting with {@code CALL,} is skipped.
 * Dates are {@code yyyyMMdd} and times {@code HHmm}, both UTC.</p>
 */
public class CsvLogVerifier implements LogVerifier {
    private static final Logger log = LoggerFactory.getLogger(CsvLogVerifier.class);
    private static final int PROGRESS_INTERVAL = 100;
    private static final DateTimeFormatter QSO_DATE = DateTimeFormatter.ofPattern("yyyyMMdd");
    private static final DateTimeFormatter TIME_ON = DateTimeFormatter.ofPattern("HHmm");

    private final CallsignResolver resolver;

    public CsvLogVerifier(CallsignResolver resolver) {
        this.resolver = Objects.requireNonNull(resolver, "resolver is required");
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
             BufferedReader br = reader instanceof BufferedReader b ? b : new BufferedReader(reader)) {
            String line;
            long lineNumber = 0;
            while ((line = br.readLine()) != null) {
                lineNumber++;
                line = line.trim();
                if (line.isEmpty() || (lineNumber == 1 && isHeader(line))) {
                    continue;
                }

                LogEntry entry;
                try {
                    entry = parseLine(lineNumber, line);
                } catch (IllegalArgumentException | DateTimeParseException e) {
                    verifier.unreadable(lineNumber, line, e.getMessage());
                    continue;
                }
                verifier.verify(entry);

                if (verifier.total() % PROGRESS_INTERVAL == 0) {
                    cb.onProgress(verifier.total(), -1, "Verified " + verifier.total() + " entries");
                }
            }

            VerificationResult result = verifier.result();
            cb.onProgress(result.totalEntries(), result.totalEntries(), "Verification completed");
            log.info("verification.completed result={}", result);
            return result;
        } catch (IOException e) {
            log.error("verification.failed error={}", e.getMessage());
            verifier.unreadable(0, "", "IO error: " + e.getMessage());
            return verifier.result();
        }
    }

    @Override
    public String getFormat() {
        return "csv";
    }

    static LogEntry parseLine(long lineNumber, String line) {
        String[] fields = line.split(",", -1);
        if (fields.length != 4) {
            throw new IllegalArgumentException("expected 4 fields but found " + fields.length);
        }
        String call = fields[0].trim().toUpperCase(Locale.ROOT);
        if (call.isEmpty()) {
            throw new IllegalArgumentException("empty call");
        }
        int adif;
        try {
            adif = Integer.parseInt(fields[1].trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid ADIF identifier '" + fields[1].trim() + "'", e);
        }
        LocalDate date = LocalDate.parse(fields[2].trim(), QSO_DATE);
        LocalTime time = LocalTime.parse(fields[3].trim(), TIME_ON);
        Instant timestamp = date.atTime(time).toInstant(ZoneOffset.UTC);
        return new LogEntry(lineNumber, call, adif, timestamp);
    }

    private static boolean isHeader(String line) {
        return line.toUpperCase(Locale.ROOT).startsWith("CALL,");
    }
}
