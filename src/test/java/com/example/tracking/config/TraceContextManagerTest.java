package com.example.tracking.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class TraceContextManagerTest {

    @AfterEach
    void tearDown() {
        TraceContextManager.clear();
    }

    @Test
    void startBackground_populatesMdc() {
        String traceId = TraceContextManager.startBackground();

        assertEquals(traceId, MDC.get(TraceContextManager.TRACE_ID));
        assertEquals(16, MDC.get(TraceContextManager.SPAN_ID).length());
    }

    @Test
    void clear_removesIds() {
        TraceContextManager.startBackground();
        TraceContextManager.clear();

        assertNull(MDC.get(TraceContextManager.TRACE_ID));
        assertNull(MDC.get(TraceContextManager.SPAN_ID));
    }

    @Test
    void generatedIds_areUnique() {
        assertNotEquals(TraceContextManager.generateTraceId(), TraceContextManager.generateTraceId());
    }
}
