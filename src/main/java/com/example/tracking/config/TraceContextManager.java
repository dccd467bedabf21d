package com.example.tracking.config;

import org.slf4j.MDC;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.UUID;

/**
 * Trace context helper for the HTTP filter and the scheduled sync job.
 * Generates ids, populates MDC, echoes the trace header and cleans up.
 */
public final class TraceContextManager {

    public static final String TRACE_ID = "traceId";
    public static final String SPAN_ID = "spanId";
    public static final String TRACE_HEADER = "X-Trace-Id";

    private TraceContextManager() {}

    public static String ensureForHttp(HttpServletRequest request, HttpServletResponse response) {
        String traceId = request.getHeader(TRACE_HEADER);
        if (traceId == null || traceId.isEmpty()) {
            traceId = MDC.get(TRACE_ID);
        }
        if (traceId == null || traceId.isEmpty()) {
            traceId = generateTraceId();
        }
        String spanId = MDC.get(SPAN_ID);
        if (spanId == null || spanId.isEmpty()) {
            spanId = generateSpanId();
        }

        MDC.put(TRACE_ID, traceId);
        MDC.put(SPAN_ID, spanId);

        if (response != null) {
            response.setHeader(TRACE_HEADER, traceId);
        }

        return traceId;
    }

    /**
     * Start a fresh trace for work that does not arrive over HTTP.
     */
    public static String startBackground() {
        String traceId = generateTraceId();
        MDC.put(TRACE_ID, traceId);
        MDC.put(SPAN_ID, generateSpanId());
        return traceId;
    }

    public static String generateTraceId() {
        return UUID.randomUUID().toString().replace("-", "");
    }

    public static String generateSpanId() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, 16);
    }

    public static void clear() {
        MDC.remove(TRACE_ID);
        MDC.remove(SPAN_ID);
    }
}
