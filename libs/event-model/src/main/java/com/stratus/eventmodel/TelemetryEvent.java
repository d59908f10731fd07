package com.stratus.eventmodel;

import java.time.Instant;

/**
 * Common view of every telemetry artifact produced during an invocation.
 *
 * <p>Log records, finalized spans and metric points all carry the invocation's correlation ID and
 * a timestamp. The sink serializer uses {@link #recordType()} to decide which extra fields to
 * emit for each event.
 */
public interface TelemetryEvent {

    /** Correlation ID of the invocation that produced this event. */
    String correlationId();

    /** When the event happened (for spans: the end time). */
    Instant timestamp();

    /** Kind of record, written to the sink as {@code record_type}. */
    RecordType recordType();
}
