package com.callsign.resolution.bulk;

/**
 * Receives progress while a log is verified, every 100 contacts and once at the end.
 */
@FunctionalInterface
public interface ProgressCallback {

    /**
     * @param verified contacts verified so far, including unreadable ones
     * @param total    contacts in the log, or -1 while a CSV log is still being read
     * @param message  short status line
     */
    void onProgress(long verified, long total, String message);

    ProgressCallback NOOP = (verified, total, message) -> {};
}
