package com.memory.graph.logging;

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
    @DisplayName("forExtraction should set entryId, provider and operation in MDC")
    void forExtractionSetsMDC() {
        try (LogContext ctx = LogContext.forExtraction("entry-1", "ollama/gpt-oss:20b")) {
            assertEquals("entry-1", MDC.get("entryId"));
            assertEquals("ollama/gpt-oss:20b", MDC.get("provider"));
            assertEquals("extract", MDC.get("operation"));
        }
        assertNull(MDC.get("entryId"));
        assertNull(MDC.get("provider"));
        assertNull(MDC.get("operation"));
    }

    @Test
    @DisplayName("forIngestion should generate a correlation id")
    void forIngestionSetsCorrelationId() {
        try (LogContext ctx = LogContext.forIngestion("entry-2")) {
            assertNotNull(MDC.get("correlationId"));
            assertEquals("entry-2", MDC.get("entryId"));
            assertEquals("ingest", MDC.get("operation"));
        }
        assertNull(MDC.get("correlationId"));
    }

    @Test
    @DisplayName("Nested contexts restore the enclosing values on close")
    void nestedContextsRestore() {
        try (LogContext outer = LogContext.forExtraction("entry-1", "local-heuristic")) {
            try (LogContext inner = LogContext.forCommit("entry-1")) {
                assertEquals("commit", MDC.get("operation"));
            }
            assertEquals("extract", MDC.get("operation"));
            assertEquals("local-heuristic", MDC.get("provider"));
        }
        assertNull(MDC.get("operation"));
    }

    @Test
    @DisplayName("with() should add custom keys")
    void withAddsCustomKeys() {
        try (LogContext ctx = LogContext.forCommit("entry-3").with("attempt", "2")) {
            assertEquals("2", MDC.get("attempt"));
        }
        assertNull(MDC.get("attempt"));
    }

    @Test
    @DisplayName("Closing twice is harmless")
    void doubleClose() {
        LogContext ctx = LogContext.forCommit("entry-4");
        ctx.close();
        assertDoesNotThrow(ctx::close);
        assertNull(MDC.get("entryId"));
    }
}
