package com.shetka.config;

import org.slf4j.MDC;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Trace context helper used by the HTTP filter.
 * Handles id generation, MDC population, response header propagation and cleanup.
 */
public final class TraceContextManager {

    public static final String TRACE_ID = "traceId";
    public static final String SPAN_ID = "spanId";
    public static final String TRACE_HEADER = "X-Trace-Id";

    private static final Pattern TRACE_ID_PATTERN = Pattern.compile("[0-9a-fA-F-]{8,64}");

    private TraceContextManager() {}

    public static String ensureForHttp(HttpServletRequest request, HttpServletResponse response) {
        String traceId = request.getHeader(TRACE_HEADER);
        if (!isUsableTraceId(traceId)) {
            traceId = MDC.get(TRACE_ID);
        }
        if (!isUsableTraceId(traceId)) {
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
     * Caller-supplied ids end up in log lines, so only short hex/dash tokens are accepted.
     */
    static boolean isUsableTraceId(String traceId) {
        return traceId != null && TRACE_ID_PATTERN.matcher(traceId).matches();
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
