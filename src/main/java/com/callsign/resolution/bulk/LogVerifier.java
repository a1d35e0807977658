package com.callsign.resolution.bulk;

import java.io.InputStream;
import java.io.Reader;

/**
 * Interface for verifying logged contacts.
 * Implementations read entries from a specific format (CSV, JSON) and check each logged
 * entity against the analysis of its call.
 */
public interface LogVerifier {

    /**
     * Verifies a log read from an input stream, decoded as UTF-8.
     *
     * @param input    the input stream to read from
     * @param callback optional progress callback
     * @return the verification result
     */
    VerificationResult verify(InputStream input, ProgressCallback callback);

    /**
     * Verifies a log read from a reader.
     *
     * @param reader   the reader to read from
     * @param callback optional progress callback
     * @return the verification result
     */
    VerificationResult verify(Reader reader, ProgressCallback callback);

    /**
     * Returns the format supported by this verifier (e.g., "csv", "json").
     */
    String getFormat();
}
