package com.publicdomain.matching.logging;

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
    @DisplayName("forRun should set runId and operation in MDC")
    void forRunSetsMDC() {
        try (LogContext ctx = LogContext.forRun("run-123")) {
            assertEquals("run-123", MDC.get("runId"));
            assertEquals("run", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("forBatch should set runId, batchId and operation in MDC")
    void forBatchSetsMDC() {
        try (LogContext ctx = LogContext.forBatch("run-123", 7)) {
            assertEquals("run-123", MDC.get("runId"));
            assertEquals("7", MDC.get("batchId"));
            assertEquals("batch", MDC.get("operation"));
        }
        assertNull(MDC.get("batchId"));
    }

    @Test
    @DisplayName("with() should add keys and skip null values")
    void withAddsKeys() {
        try (LogContext ctx = LogContext.forWorker("matcher-worker-1")
                .with("mode", "SHARED")
                .with("ignored", null)) {
            assertEquals("matcher-worker-1", MDC.get("workerId"));
            assertEquals("SHARED", MDC.get("mode"));
            assertNull(MDC.get("ignored"));
        }
        assertNull(MDC.get("workerId"));
        assertNull(MDC.get("mode"));
    }

    @Test
    @DisplayName("Nested contexts should not interfere with each other")
    void nestedContexts() {
        try (LogContext worker = LogContext.forWorker("matcher-worker-2")) {
            try (LogContext batch = LogContext.forBatch("run-1", 3)) {
                assertEquals("3", MDC.get("batchId"));
                assertEquals("matcher-worker-2", MDC.get("workerId"));
            }
            assertNull(MDC.get("batchId"));
            assertEquals("matcher-worker-2", MDC.get("workerId"));
        }
        assertNull(MDC.get("workerId"));
    }

    @Test
    @DisplayName("generateRunId should return unique UUIDs")
    void generateRunIdReturnsUniqueIds() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 100; i++) {
            ids.add(LogContext.generateRunId());
        }
        assertEquals(100, ids.size());
        assertTrue(LogContext.generateRunId().matches(
                "[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}"));
    }
}
