package com.record.merge.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LogContext Tests")
class LogContextTest {

    @AfterEach
    void cleanupMDC() {
        MDC.clear();
    }

    @Test
    @DisplayName("forMerge should set ids, type and operation in MDC")
    void forMergeSetsMDC() {
        try (LogContext ctx = LogContext.forMerge("corr-1", "ACCOUNT", "a2", "a1")) {
            assertEquals("corr-1", MDC.get("correlationId"));
            assertEquals("ACCOUNT", MDC.get("recordType"));
            assertEquals("a2", MDC.get("duplicateId"));
            assertEquals("a1", MDC.get("masterId"));
            assertEquals("merge", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("forPreview should mark the preview operation")
    void forPreviewSetsOperation() {
        try (LogContext ctx = LogContext.forPreview("corr-2", "CONTACT", "c2", "c1")) {
            assertEquals("preview", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("MDC should be cleared on close, including extra keys")
    void mdcClearedOnClose() {
        LogContext ctx = LogContext.forMerge("corr-1", "ACCOUNT", "a2", "a1").with("actor", "alice");
        assertEquals("alice", MDC.get("actor"));

        ctx.close();

        assertNull(MDC.get("correlationId"));
        assertNull(MDC.get("actor"));
    }

    @Test
    @DisplayName("Correlation ids are unique")
    void correlationIdsUnique() {
        assertNotEquals(LogContext.generateCorrelationId(), LogContext.generateCorrelationId());
    }
}
