package com.stratus.demofunction.domain;

import com.stratus.observability.SpanHandle;
import com.stratus.observability.TelemetryContext;

import java.time.Clock;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * The business logic behind both demo handlers, instrumented with child spans, structured logs and
 * metrics. Every failure is recorded on the failing span and rethrown.
 */
public final class BusinessLogic {

    public static final String EXTERNAL_API_URL = "https://api.example.com/data";

    public static final String REQUESTS_TOTAL = "demo_requests_total";
    public static final String PROCESSING_DURATION = "demo_processing_duration_ms";

    static final List<String> EVENT_OPERATIONS = List.of("dynamodb", "s3", "processing");

    private final DemoOperations operations;
    private final Clock clock;

    public BusinessLogic(DemoOperations operations) {
        this(operations, Clock.systemUTC());
    }

    public BusinessLogic(DemoOperations operations, Clock clock) {
        if (operations == null) {
            throw new IllegalArgumentException("operations must not be null");
        }
        this.operations = operations;
        this.clock = clock;
    }

    /**
     * Runs the event handler's logic under a {@code process_business_logic} span: a table write,
     * an object upload and a processing step.
     *
     * @param inputSize    size of the triggering event's JSON form
     * @param functionName reported in the request counter's {@code function} label
     */
    public ProcessingResult processEvent(TelemetryContext telemetry, SpanHandle parent, String requestId,
                                         int inputSize, String functionName) throws Exception {
        long started = System.nanoTime();
        String function = functionName == null ? "" : functionName;
        try {
            return telemetry.inSpan(parent, "process_business_logic", span -> {
                span.setAttribute("request.id", requestId)
                        .setAttribute("input.type", "object")
                        .setAttribute("input.size", (long) inputSize);

                DbWriteResult dbResult = telemetry.inSpan(span, "dynamodb_operation", db -> {
                    db.setAttribute("db.system", "dynamodb")
                            .setAttribute("db.operation", "put_item")
                            .setAttribute("db.table", SimulatedOperations.TABLE)
                            .setAttribute("request.id", requestId);
                    DbWriteResult result = operations.putItem(requestId);
                    db.setAttribute("db.item_id", result.itemId())
                            .setAttribute("db.operation.status", "success");
                    return result;
                });

                S3PutResult s3Result = telemetry.inSpan(span, "s3_operation", s3 -> {
                    s3.setAttribute("aws.service", "s3")
                            .setAttribute("aws.operation", "put_object")
                            .setAttribute("aws.bucket", SimulatedOperations.BUCKET)
                            .setAttribute("request.id", requestId);
                    S3PutResult result = operations.putObject(requestId);
                    s3.setAttribute("aws.s3.object_key", result.objectKey())
                            .setAttribute("aws.s3.object_size", result.size());
                    return result;
                });

                operations.process(Operation.PROCESSING, requestId);
                long processingMs = elapsedMillis(started);

                telemetry.increment(REQUESTS_TOTAL, 1, Map.of("status", "success", "function", function));
                telemetry.observe(PROCESSING_DURATION, processingMs, Map.of("operation", "business_logic"));

                Map<String, Object> metadata = new LinkedHashMap<>();
                metadata.put("processing_time_ms", processingMs);
                metadata.put("input_size", inputSize);
                metadata.put("operations_completed", EVENT_OPERATIONS);
                metadata.put("db_result", dbResult);
                metadata.put("s3_result", s3Result);
                telemetry.info("Business logic processing completed successfully", metadata);

                span.setAttribute("processing.duration_ms", processingMs)
                        .setAttribute("processing.status", "success")
                        .setAttribute("operations.count", (long) EVENT_OPERATIONS.size());

                return new ProcessingResult(requestId, processingMs, "Business logic completed successfully",
                        EVENT_OPERATIONS, dbResult, s3Result);
            });
        } catch (Exception e) {
            telemetry.increment(REQUESTS_TOTAL, 1, Map.of("status", "error", "function", function));
            telemetry.error("Business logic processing failed", e,
                    Map.of("processing_time_ms", elapsedMillis(started)));
            throw e;
        }
    }

    /**
     * Runs the API handler's logic under a {@code process_api_request} span: an external API call
     * followed by a processing step.
     */
    public ApiProcessingResult processApiRequest(TelemetryContext telemetry, SpanHandle parent,
                                                 String requestId) throws Exception {
        return telemetry.inSpan(parent, "process_api_request", span -> {
            span.setAttribute("processing.type", "api_business_logic")
                    .setAttribute("request.id", requestId);

            ExternalData externalData = telemetry.inSpan(span, "external_api_call", call -> {
                call.setAttribute("http.method", "GET")
                        .setAttribute("http.url", EXTERNAL_API_URL)
                        .setAttribute("external.service", "example-api")
                        .setAttribute("request.id", requestId);
                ExternalData data = operations.fetchExternalData(requestId);
                call.setAttribute("http.status_code", 200L)
                        .setAttribute("external.response.id", (long) data.id())
                        .setAttribute("external.response.status", data.status());
                return data;
            });

            operations.process(Operation.API_PROCESSING, requestId);

            span.setAttribute("processing.success", true)
                    .setAttribute("external.data.id", (long) externalData.id());
            return new ApiProcessingResult(DateTimeFormatter.ISO_INSTANT.format(clock.instant()),
                    externalData, true);
        });
    }

    private static long elapsedMillis(long startedNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
    }
}
