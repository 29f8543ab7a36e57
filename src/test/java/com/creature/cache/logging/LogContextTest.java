package com.creature.cache.logging;

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
    @DisplayName("forLookup should set correlationId, creatureId and operation in MDC")
    void forLookupSetsMDC() {
        try (LogContext ctx = LogContext.forLookup("corr-123", 25)) {
            assertEquals("corr-123", MDC.get("correlationId"));
            assertEquals("25", MDC.get("creatureId"));
            assertEquals("lookup", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("MDC should be cleared on close")
    void mdcClearedOnClose() {
        LogContext ctx = LogContext.forLookup("corr-123", 25).with("source", "cache");
        assertEquals("cache", MDC.get("source"));

        ctx.close();

        assertNull(MDC.get("correlationId"));
        assertNull(MDC.get("creatureId"));
        assertNull(MDC.get("source"));
    }

    @Test
    @DisplayName("Closing should leave unrelated MDC keys alone")
    void unrelatedKeysKept() {
        MDC.put("requestId", "r-1");
        try (LogContext ctx = LogContext.forLookup("corr-1", 1)) {
            assertEquals("r-1", MDC.get("requestId"));
        }
        assertEquals("r-1", MDC.get("requestId"));
    }

    @Test
    @DisplayName("generateCorrelationId should produce unique ids")
    void uniqueCorrelationIds() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 100; i++) {
            ids.add(LogContext.generateCorrelationId());
        }
        assertEquals(100, ids.size());
    }
}
