package com.callsign.resolution.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LogContext Tests")
class LogContextTest {

    @AfterEach
    void cleanupMDC() {
        MDC.clear();
    }

    @Test
    @DisplayName("forAnalysis should set call, timestamp and operation in MDC")
    void forAnalysisSetsMDC() {
        try (LogContext ctx = LogContext.forAnalysis("SV1CD/9", "2005-06-01T12:00:00Z")) {
            assertEquals("SV1CD/9", MDC.get("call"));
            assertEquals("2005-06-01T12:00:00Z", MDC.get("timestamp"));
            assertEquals("analyze", MDC.get("operation"));
        }
        assertNull(MDC.get("call"));
        assertNull(MDC.get("operation"));
    }

    @Test
    @DisplayName("forVerification should set batchId, format and operation in MDC")
    void forVerificationSetsMDC() {
        try (LogContext ctx = LogContext.forVerification("batch-1", "csv")) {
            assertEquals("batch-1", MDC.get("batchId"));
            assertEquals("csv", MDC.get("format"));
            assertEquals("verify", MDC.get("operation"));
        }
        assertNull(MDC.get("batchId"));
    }

    @Test
    @DisplayName("Nested context should restore the outer values on close")
    void nestedContexts() {
        try (LogContext outer = LogContext.forVerification("batch-1", "json")) {
            try (LogContext inner = LogContext.forAnalysis("AB1CD", "2005-06-01T12:00:00Z")) {
                assertEquals("analyze", MDC.get("operation"));
                assertEquals("batch-1", MDC.get("batchId"));
            }
            assertEquals("verify", MDC.get("operation"));
            assertNull(MDC.get("call"));
        }
        assertNull(MDC.get("operation"));
    }

    @Test
    @DisplayName("with should add extra keys")
    void withAddsKeys() {
        try (LogContext ctx = LogContext.forVerification("batch-1", "csv").with("line", "42")) {
            assertEquals("42", MDC.get("line"));
        }
        assertNull(MDC.get("line"));
    }

    @Test
    @DisplayName("Batch ids should be unique")
    void uniqueBatchIds() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 100; i++) {
            ids.add(LogContext.generateBatchId());
        }
        assertEquals(100, ids.size());
    }
}
