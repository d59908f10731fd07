package com.stratus.observability;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable correlation identity of one function invocation.
 * <p>
 * The correlation ID is the runtime-assigned request ID. It is stamped on every span, log record
 * and metric point the invocation produces, and is published to the SLF4J MDC while the
 * invocation runs so that local console logs carry it too.
 *
 * @param correlationId   runtime request ID, unique per invocation
 * @param functionName    name of the invoked function (nullable outside a runtime)
 * @param functionVersion version of the invoked function (nullable)
 * @param traceId         trace ID shared by every span of the invocation
 */
public record CorrelationContext(
        String correlationId,
        String functionName,
        String functionVersion,
        String traceId
) {

    public static final String MDC_CORRELATION_ID = "correlationId";
    public static final String MDC_FUNCTION_NAME = "functionName";
    public static final String MDC_FUNCTION_VERSION = "functionVersion";
    public static final String MDC_TRACE_ID = "traceId";

    /** Every MDC key a context may publish. */
    public static final List<String> MDC_KEYS =
            List.of(MDC_CORRELATION_ID, MDC_FUNCTION_NAME, MDC_FUNCTION_VERSION, MDC_TRACE_ID);

    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /**
     * MDC key to value, in {@link #MDC_KEYS} order. Absent fields map to null.
     */
    public Map<String, String> mdcEntries() {
        Map<String, String> entries = new LinkedHashMap<>();
        entries.put(MDC_CORRELATION_ID, correlationId);
        entries.put(MDC_FUNCTION_NAME, functionName);
        entries.put(MDC_FUNCTION_VERSION, functionVersion);
        entries.put(MDC_TRACE_ID, traceId);
        return entries;
    }
}
