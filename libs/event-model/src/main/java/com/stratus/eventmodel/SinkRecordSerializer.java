package com.stratus.eventmodel;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.opentelemetry.api.trace.StatusCode;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Converts an {@link ExportBatch} into the sink's JSON array body.
 * <p>
 * Every event becomes one flat JSON object carrying the standard fields ({@code timestamp},
 * {@code level}, {@code message}, {@code service}, {@code function_name}, {@code request_id},
 * {@code correlation_id}, {@code record_type}) followed by type-specific fields. For log records
 * the caller's metadata is merged last, so caller keys replace standard fields on collision.
 */
public final class SinkRecordSerializer {

    public static final String FIELD_TIMESTAMP = "timestamp";
    public static final String FIELD_LEVEL = "level";
    public static final String FIELD_MESSAGE = "message";
    public static final String FIELD_SERVICE = "service";
    public static final String FIELD_FUNCTION_NAME = "function_name";
    public static final String FIELD_REQUEST_ID = "request_id";
    public static final String FIELD_CORRELATION_ID = "correlation_id";
    public static final String FIELD_RECORD_TYPE = "record_type";

    /** RFC 3339, UTC, millisecond precision. */
    public static final DateTimeFormatter TIMESTAMP_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

    private static final ObjectMapper MAPPER = createMapper();

    private SinkRecordSerializer() {
        // utility class
    }

    private static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
    }

    /**
     * Serializes the whole batch to a JSON array string.
     *
     * @throws SinkSerializationException if a metadata value cannot be written as JSON
     */
    public static String serialize(ExportBatch batch) {
        try {
            return MAPPER.writeValueAsString(toRecords(batch));
        } catch (JsonProcessingException e) {
            throw new SinkSerializationException(
                    "Failed to serialize batch of " + batch.size() + " events", e);
        }
    }

    /**
     * Builds the flat sink records for a batch, preserving event order.
     */
    public static List<Map<String, Object>> toRecords(ExportBatch batch) {
        List<Map<String, Object>> records = new ArrayList<>(batch.size());
        for (TelemetryEvent event : batch.events()) {
            records.add(toRecord(event, batch.serviceName(), batch.functionName()));
        }
        return records;
    }

    /**
     * Builds the flat sink record for a single event.
     */
    public static Map<String, Object> toRecord(TelemetryEvent event, String serviceName,
                                               String functionName) {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put(FIELD_TIMESTAMP, formatTimestamp(event.timestamp()));
        record.put(FIELD_LEVEL, levelOf(event).value());
        record.put(FIELD_MESSAGE, messageOf(event));
        record.put(FIELD_SERVICE, serviceName);
        record.put(FIELD_FUNCTION_NAME, functionName);
        record.put(FIELD_REQUEST_ID, event.correlationId());
        record.put(FIELD_CORRELATION_ID, event.correlationId());
        record.put(FIELD_RECORD_TYPE, event.recordType().value());

        if (event instanceof SpanRecord span) {
            putSpanFields(record, span);
        } else if (event instanceof MetricPoint point) {
            putMetricFields(record, point);
        } else if (event instanceof LogRecord log) {
            record.putAll(log.metadata());
        }
        return record;
    }

    /** Formats an instant the way the sink expects it. */
    public static String formatTimestamp(Instant instant) {
        return TIMESTAMP_FORMAT.format(instant);
    }

    /** Returns the shared ObjectMapper (for tests and advanced use). */
    public static ObjectMapper objectMapper() {
        return MAPPER;
    }

    private static LogLevel levelOf(TelemetryEvent event) {
        if (event instanceof LogRecord log) {
            return log.level();
        }
        if (event instanceof SpanRecord span && span.status() == StatusCode.ERROR) {
            return LogLevel.ERROR;
        }
        return LogLevel.INFO;
    }

    private static String messageOf(TelemetryEvent event) {
        if (event instanceof LogRecord log) {
            return log.message();
        }
        if (event instanceof SpanRecord span) {
            return "span " + span.name() + " ended";
        }
        if (event instanceof MetricPoint point) {
            return "metric " + point.name();
        }
        return event.recordType().value();
    }

    private static void putSpanFields(Map<String, Object> record, SpanRecord span) {
        record.put("trace_id", span.traceId());
        record.put("span_id", span.spanId());
        record.put("parent_span_id", span.parentSpanId());
        record.put("span_name", span.name());
        record.put("start_time", formatTimestamp(span.startTime()));
        record.put("end_time", formatTimestamp(span.endTime()));
        record.put("duration_ms", span.duration().toMillis());
        record.put("status", span.status().name().toLowerCase(Locale.ROOT));
        record.put("status_message", span.statusMessage());

        Map<String, Object> attributes = new LinkedHashMap<>();
        span.attributes().forEach((key, value) -> attributes.put(key.getKey(), value));
        record.put("attributes", attributes);

        List<Map<String, Object>> exceptions = new ArrayList<>();
        for (RecordedException exception : span.exceptions()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("type", exception.type());
            entry.put("message", exception.message());
            entry.put("stacktrace", exception.stackTrace());
            entry.put("timestamp", formatTimestamp(exception.timestamp()));
            exceptions.add(entry);
        }
        record.put("exceptions", exceptions);
    }

    private static void putMetricFields(Map<String, Object> record, MetricPoint point) {
        record.put("metric_name", point.name());
        record.put("metric_kind", point.kind().value());
        record.put("labels", point.labels());
        if (point.kind() == MetricKind.COUNTER) {
            record.put("value", point.value());
        } else {
            record.put("count", point.count());
            record.put("sum", point.sum());
            record.put("max", point.max());
            record.put("mean", point.value());
        }
    }

    /**
     * Thrown when a batch cannot be rendered as JSON.
     */
    public static class SinkSerializationException extends RuntimeException {
        public SinkSerializationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
