package com.stratus.eventmodel;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A structured log record emitted by business code during an invocation.
 *
 * <p>Immutable once created. The metadata map keeps insertion order and is merged into the top
 * level of the sink record, where its keys win over the standard fields.
 *
 * @param level         severity
 * @param message       human-readable message
 * @param correlationId correlation ID of the owning invocation
 * @param metadata      free-form key/value metadata (never null; values may be null)
 * @param timestamp     creation time
 */
public record LogRecord(
        LogLevel level,
        String message,
        String correlationId,
        Map<String, Object> metadata,
        Instant timestamp
) implements TelemetryEvent {

    public LogRecord {
        if (level == null) {
            throw new IllegalArgumentException("level must not be null");
        }
        if (message == null) {
            throw new IllegalArgumentException("message must not be null");
        }
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp must not be null");
        }
        // keeps insertion order; null values allowed
        metadata = metadata == null || metadata.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /**
     * Creates a record stamped with the current time.
     */
    public static LogRecord of(LogLevel level, String message, String correlationId,
                               Map<String, Object> metadata) {
        return new LogRecord(level, message, correlationId, metadata, Instant.now());
    }

    @Override
    public RecordType recordType() {
        return RecordType.LOG;
    }
}
