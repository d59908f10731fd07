package com.stratus.observability;

import org.slf4j.MDC;

/**
 * Mirrors the running invocation's {@link CorrelationContext} into the SLF4J MDC of the current
 * thread.
 * <p>
 * {@link TelemetryContext} installs the context in {@code beginInvocation} and removes it in
 * {@code complete}. Nothing here is consulted for span parentage.
 */
public final class CorrelationContextHolder {

    private CorrelationContextHolder() {
        // utility class
    }

    /**
     * Installs {@code context} on this thread. MDC keys whose field is null are removed.
     *
     * @throws IllegalArgumentException if context is null
     */
    public static void set(CorrelationContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        context.mdcEntries().forEach((key, value) -> {
            if (value == null) {
                MDC.remove(key);
            } else {
                MDC.put(key, value);
            }
        });
    }

    /** Removes the correlation MDC keys from this thread. Other MDC keys are untouched. */
    public static void clear() {
        CorrelationContext.MDC_KEYS.forEach(MDC::remove);
    }
}
