package com.kiisha.ai.gateway.audit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class CorrelationContextTest {

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    void testBind_setsAndRestores() {
        assertTrue(CorrelationContext.current().isEmpty());

        try (CorrelationContext.Scope outer = CorrelationContext.bind("outer")) {
            assertEquals("outer", CorrelationContext.current().orElseThrow());
            assertEquals("outer", MDC.get(CorrelationContext.MDC_KEY));

            try (CorrelationContext.Scope inner = CorrelationContext.bind("inner")) {
                assertEquals("inner", CorrelationContext.current().orElseThrow());
            }
            assertEquals("outer", CorrelationContext.current().orElseThrow());
        }

        assertTrue(CorrelationContext.current().isEmpty());
        assertNull(MDC.get(CorrelationContext.MDC_KEY));
    }

    @Test
    void testNewCorrelationId_unique() {
        assertNotEquals(CorrelationContext.newCorrelationId(), CorrelationContext.newCorrelationId());
    }
}
