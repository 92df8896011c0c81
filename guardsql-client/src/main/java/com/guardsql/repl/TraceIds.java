package com.guardsql.repl;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Tags every log line written while one submission is processed with a {@code trace_id}.
 */
public final class TraceIds {
    public static final String MDC_TRACE_ID = "trace_id";

    private TraceIds() {
    }

    public static String begin() {
        String traceId = UUID.randomUUID().toString().substring(0, 8);
        MDC.put(MDC_TRACE_ID, traceId);
        return traceId;
    }

    public static String current() {
        return MDC.get(MDC_TRACE_ID);
    }

    public static void end() {
        MDC.remove(MDC_TRACE_ID);
    }
}
