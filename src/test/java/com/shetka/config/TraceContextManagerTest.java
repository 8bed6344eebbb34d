package com.shetka.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class TraceContextManagerTest {

    @BeforeEach
    void before() {
        TraceContextManager.clear();
    }

    @AfterEach
    void after() {
        TraceContextManager.clear();
    }

    @Test
    void ensureForHttp_populatesMdcAndResponseHeader() {
        HttpServletRequest req = mock(HttpServletRequest.class);
        HttpServletResponse resp = mock(HttpServletResponse.class);

        when(req.getHeader(TraceContextManager.TRACE_HEADER)).thenReturn(null);

        String traceId = TraceContextManager.ensureForHttp(req, resp);

        assertNotNull(traceId);
        assertEquals(32, traceId.length());
        assertEquals(traceId, MDC.get(TraceContextManager.TRACE_ID));
        assertEquals(16, MDC.get(TraceContextManager.SPAN_ID).length());

        verify(resp).setHeader(TraceContextManager.TRACE_HEADER, traceId);
    }

    @Test
    void ensureForHttp_reusesCallerTraceId() {
        HttpServletRequest req = mock(HttpServletRequest.class);
        HttpServletResponse resp = mock(HttpServletResponse.class);
        when(req.getHeader(TraceContextManager.TRACE_HEADER)).thenReturn("4bf92f3577b34da6a3ce929d0e0e4736");

        String traceId = TraceContextManager.ensureForHttp(req, resp);

        assertEquals("4bf92f3577b34da6a3ce929d0e0e4736", traceId);
        verify(resp).setHeader(TraceContextManager.TRACE_HEADER, "4bf92f3577b34da6a3ce929d0e0e4736");
    }

    @Test
    void ensureForHttp_replacesUnsafeCallerTraceId() {
        HttpServletRequest req = mock(HttpServletRequest.class);
        when(req.getHeader(TraceContextManager.TRACE_HEADER)).thenReturn("abc\nFORGED LOG LINE");

        String traceId = TraceContextManager.ensureForHttp(req, null);

        assertEquals(32, traceId.length());
        assertFalse(traceId.contains("\n"));
    }

    @Test
    void clear_removesTraceKeys() {
        MDC.put(TraceContextManager.TRACE_ID, "t");
        MDC.put(TraceContextManager.SPAN_ID, "s");

        TraceContextManager.clear();

        assertNull(MDC.get(TraceContextManager.TRACE_ID));
        assertNull(MDC.get(TraceContextManager.SPAN_ID));
    }
}
