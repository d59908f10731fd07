package com.stratus.observability;

import com.stratus.eventmodel.RecordedException;
import com.stratus.eventmodel.SpanRecord;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.trace.StatusCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A timed, named unit of work inside one invocation.
 * <p>
 * Handles are created by {@link TelemetryContext#beginInvocation(String)} and
 * {@link TelemetryContext#startSpan(SpanHandle, String)}. While {@link SpanState#OPEN} a span
 * accepts attributes, recorded exceptions and a pending status. Ending it freezes all of that
 * into a {@link SpanRecord} and hands the record to the owning context's event buffer. There
 * are no transitions out of {@link SpanState#ENDED}; later mutations and repeated ends are
 * ignored with a WARN.
 * <p>
 * All mutators are synchronized, so a child span may be ended from another thread.
 */
public final class SpanHandle {

    private static final Logger log = LoggerFactory.getLogger(SpanHandle.class);

    private final TelemetryContext owner;
    private final Clock clock;
    private final String name;
    private final String correlationId;
    private final String traceId;
    private final String spanId;
    private final String parentSpanId;
    private final Instant startTime;

    private final AttributesBuilder attributes = Attributes.builder();
    private final List<RecordedException> exceptions = new ArrayList<>();
    private StatusCode pendingStatus = StatusCode.UNSET;
    private String pendingMessage;
    private SpanRecord record;

    SpanHandle(TelemetryContext owner, Clock clock, String name, String correlationId,
               String traceId, String spanId, String parentSpanId) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("span name must not be null or blank");
        }
        this.owner = owner;
        this.clock = clock;
        this.name = name;
        this.correlationId = correlationId;
        this.traceId = traceId;
        this.spanId = spanId;
        this.parentSpanId = parentSpanId;
        this.startTime = clock.instant();
    }

    public SpanHandle setAttribute(String key, String value) {
        synchronized (this) {
            if (acceptsMutation(key)) {
                attributes.put(key, value == null ? "null" : value);
            }
        }
        return this;
    }

    public SpanHandle setAttribute(String key, long value) {
        synchronized (this) {
            if (acceptsMutation(key)) {
                attributes.put(key, value);
            }
        }
        return this;
    }

    public SpanHandle setAttribute(String key, double value) {
        synchronized (this) {
            if (acceptsMutation(key)) {
                attributes.put(key, value);
            }
        }
        return this;
    }

    public SpanHandle setAttribute(String key, boolean value) {
        synchronized (this) {
            if (acceptsMutation(key)) {
                attributes.put(key, value);
            }
        }
        return this;
    }

    /**
     * Sets several attributes at once. Integral numbers are stored as longs, floating point
     * numbers as doubles, booleans as booleans, and anything else via {@link String#valueOf}.
     * Null values are skipped.
     */
    public SpanHandle setAttributes(Map<String, ?> values) {
        if (values == null) {
            return this;
        }
        values.forEach((key, value) -> {
            if (value == null) {
                return;
            }
            if (value instanceof Boolean b) {
                setAttribute(key, b.booleanValue());
            } else if (value instanceof Double || value instanceof Float) {
                setAttribute(key, ((Number) value).doubleValue());
            } else if (value instanceof Number n) {
                setAttribute(key, n.longValue());
            } else {
                setAttribute(key, String.valueOf(value));
            }
        });
        return this;
    }

    /**
     * Appends an exception to the span without changing its status.
     */
    public SpanHandle recordException(Throwable error) {
        if (error == null) {
            throw new IllegalArgumentException("error must not be null");
        }
        synchronized (this) {
            if (acceptsMutation("exception")) {
                exceptions.add(new RecordedException(error.getClass().getName(), error.getMessage(),
                        RecordedException.stackTraceOf(error), clock.instant()));
            }
        }
        return this;
    }

    /**
     * Records the status this span should end with. It becomes terminal only when the span
     * ends via {@link #end()}.
     */
    public SpanHandle setStatus(StatusCode status, String message) {
        if (status == null) {
            throw new IllegalArgumentException("status must not be null");
        }
        synchronized (this) {
            if (acceptsMutation("status")) {
                pendingStatus = status;
                pendingMessage = message;
            }
        }
        return this;
    }

    /**
     * Ends the span with its pending status, or {@code OK} if none was set.
     *
     * @return true if this call ended the span
     */
    public boolean end() {
        SpanRecord ended;
        synchronized (this) {
            ended = finish(pendingStatus, pendingMessage);
        }
        return publish(ended);
    }

    /**
     * Ends the span with the given status; {@code UNSET} is treated as {@code OK}.
     *
     * @return true if this call ended the span
     */
    public boolean end(StatusCode status, String message) {
        if (status == null) {
            throw new IllegalArgumentException("status must not be null");
        }
        SpanRecord ended;
        synchronized (this) {
            ended = finish(status, message);
        }
        return publish(ended);
    }

    /**
     * Records the error and ends the span {@code ERROR} with the error's message.
     *
     * @return true if this call ended the span
     */
    public boolean endWithError(Throwable error) {
        if (error == null) {
            throw new IllegalArgumentException("error must not be null");
        }
        SpanRecord ended;
        synchronized (this) {
            if (record == null) {
                exceptions.add(new RecordedException(error.getClass().getName(), error.getMessage(),
                        RecordedException.stackTraceOf(error), clock.instant()));
            }
            String message = error.getMessage() != null ? error.getMessage() : error.getClass().getName();
            ended = finish(StatusCode.ERROR, message);
        }
        return publish(ended);
    }

    public String name() {
        return name;
    }

    public String correlationId() {
        return correlationId;
    }

    public String traceId() {
        return traceId;
    }

    public String spanId() {
        return spanId;
    }

    /** Parent span ID, or null for the root span. */
    public String parentSpanId() {
        return parentSpanId;
    }

    public Instant startTime() {
        return startTime;
    }

    public boolean isRoot() {
        return parentSpanId == null;
    }

    public synchronized SpanState state() {
        return record == null ? SpanState.OPEN : SpanState.ENDED;
    }

    public synchronized boolean isEnded() {
        return record != null;
    }

    /**
     * Terminal status once ended, otherwise the pending status.
     */
    public synchronized StatusCode status() {
        return record != null ? record.status() : pendingStatus;
    }

    /**
     * The finalized record, present once the span has ended.
     */
    public synchronized Optional<SpanRecord> toRecord() {
        return Optional.ofNullable(record);
    }

    TelemetryContext owner() {
        return owner;
    }

    private boolean acceptsMutation(String what) {
        if (record != null) {
            log.warn("Ignoring {} on ended span '{}' ({})", what, name, spanId);
            return false;
        }
        return true;
    }

    private SpanRecord finish(StatusCode status, String message) {
        if (record != null) {
            log.warn("Span '{}' ({}) already ended with {}; ignoring end", name, spanId, record.status());
            return null;
        }
        StatusCode terminal = status == StatusCode.UNSET ? StatusCode.OK : status;
        Instant endTime = clock.instant();
        if (endTime.isBefore(startTime)) {
            endTime = startTime;
        }
        record = new SpanRecord(name, correlationId, traceId, spanId, parentSpanId, startTime,
                endTime, attributes.build(), terminal, message, exceptions);
        return record;
    }

    private boolean publish(SpanRecord ended) {
        if (ended == null) {
            return false;
        }
        log.debug("Span '{}' ended {} after {} ms", name, ended.status(), ended.duration().toMillis());
        owner.onSpanEnded(this, ended);
        return true;
    }
}
