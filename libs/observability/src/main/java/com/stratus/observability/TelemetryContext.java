package com.stratus.observability;

import com.stratus.eventmodel.ExportBatch;
import com.stratus.eventmodel.LogLevel;
import com.stratus.eventmodel.LogRecord;
import com.stratus.eventmodel.RecordedException;
import com.stratus.eventmodel.SpanRecord;
import com.stratus.eventmodel.TelemetryEvent;
import com.stratus.sink.DeliveryResult;
import com.stratus.sink.TelemetryExporter;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.sdk.trace.IdGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Telemetry state of exactly one function invocation.
 * <p>
 * A context is created per invocation, threaded explicitly through the handler, and discarded
 * after {@link #complete(Duration)}. It owns the correlation identity, the span tree, the event
 * buffer and the metrics aggregator:
 * <pre>{@code
 * TelemetryContext telemetry = TelemetryContext.builder(exporter).functionName(name).build();
 * SpanHandle root = telemetry.beginInvocation(requestId);
 * telemetry.info("Lambda function invocation started", Map.of("event", event));
 * Result result = telemetry.inSpan(root, "s3_operation", span -> s3.put(...));
 * root.end();
 * telemetry.complete(Duration.ofMillis(context.remainingTimeMillis()));
 * }</pre>
 * Span parentage is never looked up implicitly; every child names its parent.
 * Telemetry failures never escape: {@link #flush(Duration)} and {@link #complete(Duration)}
 * report export problems through their {@link DeliveryResult}.
 */
public final class TelemetryContext {

    private static final Logger log = LoggerFactory.getLogger(TelemetryContext.class);

    /** Root span name used by {@link #beginInvocation(String)}. */
    public static final String DEFAULT_ROOT_SPAN_NAME = "lambda_handler";

    /** Status message given to spans still open when the invocation completes. */
    public static final String UNENDED_SPAN_MESSAGE = "span not ended before invocation completed";

    /** Span recorded around each non-empty mid-invocation {@link #flush(Duration)}. */
    public static final String EXPORT_SPAN_NAME = "send_logs_to_openobserve";

    public static final String FIELD_ERROR_MESSAGE = "error_message";
    public static final String FIELD_ERROR_TYPE = "error_type";
    public static final String FIELD_ERROR_STACK = "error_stack";

    private final TelemetryExporter exporter;
    private final String serviceName;
    private final String functionName;
    private final String functionVersion;
    private final EventBuffer buffer;
    private final MetricsAggregator metrics;
    private final SensitiveDataRedactor redactor;
    private final IdGenerator idGenerator;
    private final Clock clock;

    private final List<SpanHandle> openSpans = new ArrayList<>();
    private volatile CorrelationContext correlation;
    private volatile SpanHandle root;
    private volatile boolean completed;

    private TelemetryContext(Builder builder) {
        this.exporter = builder.exporter;
        this.serviceName = builder.serviceName != null
                ? builder.serviceName
                : builder.exporter.config().serviceName();
        this.functionName = builder.functionName;
        this.functionVersion = builder.functionVersion;
        this.buffer = new EventBuffer();
        this.metrics = builder.metrics != null ? builder.metrics : new MetricsAggregator();
        this.redactor = builder.redactor != null ? builder.redactor : new SensitiveDataRedactor();
        this.idGenerator = builder.idGenerator != null ? builder.idGenerator : IdGenerator.random();
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    }

    public static Builder builder(TelemetryExporter exporter) {
        return new Builder(exporter);
    }

    // ---- spans ---------------------------------------------------------------------------

    /**
     * Starts the invocation: creates its correlation context, publishes it to the MDC and
     * opens the root span {@value #DEFAULT_ROOT_SPAN_NAME}.
     *
     * @param correlationId the runtime request ID
     * @return the root span
     * @throws IllegalStateException if the invocation was already begun
     */
    public SpanHandle beginInvocation(String correlationId) {
        return beginInvocation(correlationId, DEFAULT_ROOT_SPAN_NAME);
    }

    /**
     * Same as {@link #beginInvocation(String)} with a custom root span name.
     */
    public synchronized SpanHandle beginInvocation(String correlationId, String rootSpanName) {
        if (correlation != null) {
            throw new IllegalStateException(
                    "invocation already begun with correlation ID " + correlation.correlationId());
        }
        CorrelationContext ctx = new CorrelationContext(correlationId, functionName, functionVersion,
                idGenerator.generateTraceId());
        correlation = ctx;
        CorrelationContextHolder.set(ctx);
        root = openSpan(null, rootSpanName);
        root.setAttribute("correlation.id", correlationId);
        log.debug("Invocation {} begun, trace {}", correlationId, ctx.traceId());
        return root;
    }

    /**
     * Opens a span under {@code parent}.
     *
     * @param parent parent span, or null to request a new root
     * @param name   span name
     * @throws IllegalStateException        before {@link #beginInvocation} or after {@link #complete}
     * @throws InvalidSpanNestingException  if a root is requested while one exists, or the parent
     *                                      belongs to another invocation
     */
    public synchronized SpanHandle startSpan(SpanHandle parent, String name) {
        requireActive("start span '" + name + "'");
        if (parent == null) {
            if (root != null) {
                throw new InvalidSpanNestingException("invocation " + correlation.correlationId()
                        + " already has root span '" + root.name() + "'");
            }
            root = openSpan(null, name);
            return root;
        }
        if (parent.owner() != this) {
            throw new InvalidSpanNestingException("parent span '" + parent.name()
                    + "' belongs to invocation " + parent.correlationId()
                    + ", not " + correlation.correlationId());
        }
        return openSpan(parent, name);
    }

    /**
     * Ends a span with the given status. Ending an already ended span only logs a WARN.
     */
    public void endSpan(SpanHandle span, StatusCode status, String errorMessage) {
        if (span == null) {
            throw new IllegalArgumentException("span must not be null");
        }
        span.end(status, errorMessage);
    }

    /**
     * Runs {@code work} inside a child span of {@code parent}. The span ends {@code OK} (or with
     * the status the work set) on success; on failure the exception is recorded, the span ends
     * {@code ERROR} and the same exception is rethrown.
     */
    public <T> T inSpan(SpanHandle parent, String name, SpanWork<T> work) throws Exception {
        SpanHandle span = startSpan(parent, name);
        try {
            T result = work.run(span);
            span.end();
            return result;
        } catch (Exception | Error e) {
            span.endWithError(e);
            throw e;
        }
    }

    // ---- logs ----------------------------------------------------------------------------

    public void info(String message, Map<String, ?> metadata) {
        log(LogLevel.INFO, message, metadata);
    }

    public void warn(String message, Map<String, ?> metadata) {
        log(LogLevel.WARN, message, metadata);
    }

    public void error(String message, Map<String, ?> metadata) {
        log(LogLevel.ERROR, message, metadata);
    }

    /**
     * Buffers an error record describing {@code failure}: the metadata gains {@code error_message},
     * {@code error_type} and {@code error_stack} ahead of the caller's own keys.
     */
    public void error(String message, Throwable failure, Map<String, ?> metadata) {
        Map<String, Object> merged = new LinkedHashMap<>();
        if (failure != null) {
            merged.put(FIELD_ERROR_MESSAGE, failure.getMessage());
            merged.put(FIELD_ERROR_TYPE, failure.getClass().getName());
            merged.put(FIELD_ERROR_STACK, RecordedException.stackTraceOf(failure));
        }
        if (metadata != null) {
            merged.putAll(metadata);
        }
        log(LogLevel.ERROR, message, merged);
    }

    /**
     * Buffers a structured log record stamped with this invocation's correlation ID. Metadata is
     * redacted before buffering.
     *
     * @throws IllegalStateException before {@link #beginInvocation}
     */
    public void log(LogLevel level, String message, Map<String, ?> metadata) {
        requireBegun();
        if (completed) {
            log.warn("Dropping {} log record after invocation completed: {}", level.value(), message);
            return;
        }
        buffer.append(new LogRecord(level, message, correlation.correlationId(),
                redactor.redact(metadata), clock.instant()));
        log.debug("[{}] {}", level.value(), message);
    }

    // ---- metrics -------------------------------------------------------------------------

    /**
     * Adds to a counter. A name already used for a histogram is dropped with a WARN.
     */
    public void increment(String name, double delta, Map<String, String> labels) {
        if (completed) {
            log.warn("Dropping counter {} after invocation completed", name);
            return;
        }
        metrics.increment(name, delta, labels);
    }

    /**
     * Records a histogram observation. A name already used for a counter is dropped with a WARN.
     */
    public void observe(String name, double value, Map<String, String> labels) {
        if (completed) {
            log.warn("Dropping histogram {} after invocation completed", name);
            return;
        }
        metrics.observe(name, value, labels);
    }

    // ---- export --------------------------------------------------------------------------

    /**
     * Exports the buffered logs and ended spans. Metrics are exported once, by
     * {@link #complete(Duration)}. Never throws.
     * <p>
     * While the invocation is active, a non-empty flush is itself traced by a
     * {@value #EXPORT_SPAN_NAME} child of the root span. That span lands in the buffer and
     * travels with the next batch.
     *
     * @param remainingBudget time the invocation has left, or null if unknown
     */
    public DeliveryResult flush(Duration remainingBudget) {
        requireBegun();
        List<TelemetryEvent> events = new ArrayList<>(buffer.drain());
        if (events.isEmpty() || completed || root == null) {
            return export(events, remainingBudget);
        }
        SpanHandle span = startSpan(root, EXPORT_SPAN_NAME);
        span.setAttribute("export.event_count", (long) events.size());
        DeliveryResult result = export(events, remainingBudget);
        span.setAttribute("export.outcome", result.outcome().name().toLowerCase(Locale.ROOT))
                .setAttribute("export.attempts", (long) result.attempts());
        if (result.statusCode() > 0) {
            span.setAttribute("http.status_code", (long) result.statusCode());
        }
        if (result.isFailed()) {
            span.end(StatusCode.ERROR, result.error().message());
        } else {
            span.end();
        }
        return result;
    }

    /**
     * Finishes the invocation: ends spans left open (deepest first) with {@code ERROR}, exports
     * everything buffered together with the metric snapshot, and clears the MDC. A second call
     * only logs a WARN.
     *
     * @param remainingBudget time the invocation has left, or null if unknown
     */
    public DeliveryResult complete(Duration remainingBudget) {
        requireBegun();
        if (completed) {
            log.warn("Invocation {} already completed", correlation.correlationId());
            return DeliveryResult.skipped(0, "invocation already completed");
        }
        endOpenSpans();
        try {
            List<TelemetryEvent> events = new ArrayList<>(buffer.drain());
            events.addAll(metrics.snapshot(correlation.correlationId(), clock.instant()));
            return export(events, remainingBudget);
        } finally {
            completed = true;
            CorrelationContextHolder.clear();
        }
    }

    // ---- accessors -----------------------------------------------------------------------

    public Optional<CorrelationContext> correlation() {
        return Optional.ofNullable(correlation);
    }

    /**
     * Correlation ID of the invocation.
     *
     * @throws IllegalStateException before {@link #beginInvocation}
     */
    public String correlationId() {
        requireBegun();
        return correlation.correlationId();
    }

    public Optional<SpanHandle> rootSpan() {
        return Optional.ofNullable(root);
    }

    public String serviceName() {
        return serviceName;
    }

    public EventBuffer buffer() {
        return buffer;
    }

    public MetricsAggregator metrics() {
        return metrics;
    }

    public boolean isCompleted() {
        return completed;
    }

    synchronized void onSpanEnded(SpanHandle span, SpanRecord record) {
        openSpans.remove(span);
        buffer.append(record);
    }

    private SpanHandle openSpan(SpanHandle parent, String name) {
        SpanHandle span = new SpanHandle(this, clock, name, correlation.correlationId(),
                correlation.traceId(), idGenerator.generateSpanId(),
                parent == null ? null : parent.spanId());
        openSpans.add(span);
        return span;
    }

    private void endOpenSpans() {
        List<SpanHandle> remaining;
        synchronized (this) {
            remaining = new ArrayList<>(openSpans);
        }
        // children are always opened after their parents
        for (int i = remaining.size() - 1; i >= 0; i--) {
            SpanHandle span = remaining.get(i);
            log.warn("Span '{}' was not ended before invocation {} completed", span.name(),
                    correlation.correlationId());
            span.end(StatusCode.ERROR, UNENDED_SPAN_MESSAGE);
        }
    }

    private DeliveryResult export(List<TelemetryEvent> events, Duration remainingBudget) {
        ExportBatch batch = new ExportBatch(serviceName, functionName, events);
        DeliveryResult result = exporter.flush(batch, remainingBudget);
        log.debug("Flush of {} events for {}: {}", batch.size(), correlation.correlationId(),
                result.outcome());
        return result;
    }

    private void requireBegun() {
        if (correlation == null) {
            throw new IllegalStateException("beginInvocation must be called first");
        }
    }

    private void requireActive(String action) {
        requireBegun();
        if (completed) {
            throw new IllegalStateException("cannot " + action + ": invocation "
                    + correlation.correlationId() + " already completed");
        }
    }

    /**
     * Builder for {@link TelemetryContext}. Only the exporter is required.
     */
    public static final class Builder {

        private final TelemetryExporter exporter;
        private String serviceName;
        private String functionName;
        private String functionVersion;
        private MetricsAggregator metrics;
        private SensitiveDataRedactor redactor;
        private IdGenerator idGenerator;
        private Clock clock;

        private Builder(TelemetryExporter exporter) {
            if (exporter == null) {
                throw new IllegalArgumentException("exporter must not be null");
            }
            this.exporter = exporter;
        }

        /** Overrides the service name from the exporter's configuration. */
        public Builder serviceName(String serviceName) {
            this.serviceName = serviceName;
            return this;
        }

        public Builder functionName(String functionName) {
            this.functionName = functionName;
            return this;
        }

        public Builder functionVersion(String functionVersion) {
            this.functionVersion = functionVersion;
            return this;
        }

        /** Shares an aggregator across invocations instead of creating one per context. */
        public Builder metrics(MetricsAggregator metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder redactor(SensitiveDataRedactor redactor) {
            this.redactor = redactor;
            return this;
        }

        public Builder idGenerator(IdGenerator idGenerator) {
            this.idGenerator = idGenerator;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public TelemetryContext build() {
            return new TelemetryContext(this);
        }
    }
}
