package com.catalog.browser.logging;

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
    @DisplayName("forQuery should set correlationId, operation and entityType in MDC")
    void forQuerySetsMDC() {
        try (LogContext ctx = LogContext.forQuery("corr-123", "search", "track")) {
            assertEquals("corr-123", MDC.get("correlationId"));
            assertEquals("search", MDC.get("operation"));
            assertEquals("track", MDC.get("entityType"));
        }
    }

    @Test
    @DisplayName("forToken should set correlationId and operation in MDC")
    void forTokenSetsMDC() {
        try (LogContext ctx = LogContext.forToken("corr-456")) {
            assertEquals("corr-456", MDC.get("correlationId"));
            assertEquals("token", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("close should remove all keys it added")
    void closeRemovesKeys() {
        LogContext ctx = LogContext.forQuery("corr-1", "detail", "artist").with("catalogId", "abc");
        assertEquals("abc", MDC.get("catalogId"));

        ctx.close();

        assertNull(MDC.get("correlationId"));
        assertNull(MDC.get("operation"));
        assertNull(MDC.get("entityType"));
        assertNull(MDC.get("catalogId"));
    }

    @Test
    @DisplayName("close should leave unrelated MDC keys untouched")
    void closeKeepsOtherKeys() {
        MDC.put("requestPath", "/search");
        try (LogContext ctx = LogContext.forToken("corr-2")) {
            assertEquals("/search", MDC.get("requestPath"));
        }
        assertEquals("/search", MDC.get("requestPath"));
    }

    @Test
    @DisplayName("generateCorrelationId should produce unique IDs")
    void generateCorrelationIdUnique() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 100; i++) {
            ids.add(LogContext.generateCorrelationId());
        }
        assertEquals(100, ids.size());
    }
}
