package com.stratus.observability;

/**
 * Work executed inside a span by {@link TelemetryContext#inSpan(SpanHandle, String, SpanWork)}.
 *
 * @param <T> result type
 */
@FunctionalInterface
public interface SpanWork<T> {

    /**
     * Runs the work.
     *
     * @param span the span opened for this work, for attributes and nested spans
     * @return the work's result
     * @throws Exception any failure; it is recorded on the span and rethrown unchanged
     */
    T run(SpanHandle span) throws Exception;
}
