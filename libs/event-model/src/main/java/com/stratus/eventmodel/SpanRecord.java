package com.stratus.eventmodel;

import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.StatusCode;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Finalized representation of an ended span, handed to the event buffer at end time.
 *
 * @param name          operation name
 * @param correlationId correlation ID of the owning invocation
 * @param traceId       trace ID shared by every span of the invocation
 * @param spanId        this span's ID
 * @param parentSpanId  parent span ID, null only for the invocation's root span
 * @param startTime     when the span was opened
 * @param endTime       when the span was ended (never before {@code startTime})
 * @param attributes    scalar attributes set while the span was open
 * @param status        terminal status, {@link StatusCode#OK} or {@link StatusCode#ERROR}
 * @param statusMessage optional description accompanying the status
 * @param exceptions    exceptions recorded while the span was open, in call order
 */
public record SpanRecord(
        String name,
        String correlationId,
        String traceId,
        String spanId,
        String parentSpanId,
        Instant startTime,
        Instant endTime,
        Attributes attributes,
        StatusCode status,
        String statusMessage,
        List<RecordedException> exceptions
) implements TelemetryEvent {

    public SpanRecord {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
        if (startTime == null || endTime == null) {
            throw new IllegalArgumentException("startTime and endTime must not be null");
        }
        if (endTime.isBefore(startTime)) {
            throw new IllegalArgumentException("endTime must not be before startTime");
        }
        if (status == null || status == StatusCode.UNSET) {
            throw new IllegalArgumentException("status must be OK or ERROR for an ended span");
        }
        attributes = attributes == null ? Attributes.empty() : attributes;
        exceptions = exceptions == null ? List.of() : List.copyOf(exceptions);
    }

    /** True for the invocation's root span. */
    public boolean isRoot() {
        return parentSpanId == null;
    }

    /** Elapsed time between start and end. */
    public Duration duration() {
        return Duration.between(startTime, endTime);
    }

    @Override
    public Instant timestamp() {
        return endTime;
    }

    @Override
    public RecordType recordType() {
        return RecordType.SPAN;
    }
}
