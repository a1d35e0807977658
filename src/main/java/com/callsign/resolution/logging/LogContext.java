package com.callsign.resolution.logging;

import org.slf4j.MDC;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * AutoCloseable MDC wrapper for structured logging.
 * Adds key-value pairs to the SLF4J MDC and restores the previous values on close, so
 * contexts may be nested (an analysis within a verification run).
 *
 * <pre>
 * try (LogContext ctx = LogContext.forVerification(batchId, "csv")) {
 *     log.info("verification.completed result={}", result);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final Map<String, String> previous = new LinkedHashMap<>();

    private LogContext() {
    }

    /**
     * Creates a log context for the analysis of one call.
     */
    public static LogContext forAnalysis(String call, String timestamp) {
        LogContext ctx = new LogContext();
        ctx.put("call", call);
        ctx.put("timestamp", timestamp);
        ctx.put("operation", "analyze");
        return ctx;
    }

    /**
     * Creates a log context for the verification of a whole log.
     */
    public static LogContext forVerification(String batchId, String format) {
        LogContext ctx = new LogContext();
        ctx.put("batchId", batchId);
        ctx.put("format", format);
        ctx.put("operation", "verify");
        return ctx;
    }

    public static String generateBatchId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Adds an additional key-value pair to this log context.
     */
    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        if (!previous.containsKey(key)) {
            previous.put(key, MDC.get(key));
        }
        MDC.put(key, value);
    }

    @Override
    public void close() {
        for (Map.Entry<String, String> entry : previous.entrySet()) {
            if (entry.getValue() == null) {
                MDC.remove(entry.getKey());
            } else {
                MDC.put(entry.getKey(), entry.getValue());
            }
        }
        previous.clear();
    }
}
