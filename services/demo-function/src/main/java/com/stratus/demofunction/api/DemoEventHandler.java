package com.stratus.demofunction.api;

import com.stratus.demofunction.config.FunctionProperties;
import com.stratus.demofunction.config.TelemetryContextFactory;
import com.stratus.demofunction.domain.BusinessLogic;
import com.stratus.demofunction.domain.ProcessingResult;
import com.stratus.demofunction.domain.SimulatedOperations;
import com.stratus.demofunction.infrastructure.InvocationErrorMapper;
import com.stratus.demofunction.infrastructure.JsonBodies;
import com.stratus.demofunction.runtime.FunctionResponse;
import com.stratus.demofunction.runtime.InvocationContext;
import com.stratus.eventmodel.SinkRecordSerializer;
import com.stratus.observability.SpanHandle;
import com.stratus.observability.TelemetryContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Handler for generic event triggers.
 *
 * <p>Logs the invocation start, runs the simulated table write and object upload, logs the
 * completion and answers {@code 200} with the processing result.
 */
public class DemoEventHandler extends TelemetryHandler {

    private static final Logger log = LoggerFactory.getLogger(DemoEventHandler.class);

    public static final String ROOT_SPAN = "lambda_handler";

    /** Nominal invocation timeout the execution duration is derived from. */
    static final long NOMINAL_TIMEOUT_MS = 30_000;

    private final FunctionProperties properties;
    private final BusinessLogic businessLogic;

    /**
     * Runtime entry point: configuration comes from the environment.
     */
    public DemoEventHandler() {
        this(TelemetryContextFactory.fromEnvironment(), FunctionProperties.fromEnvironment());
    }

    public DemoEventHandler(TelemetryContextFactory telemetryFactory, FunctionProperties properties) {
        this(telemetryFactory, properties, new BusinessLogic(
                new SimulatedOperations(properties.simulatedDelay(), properties.failOperation())),
                new InvocationErrorMapper());
    }

    public DemoEventHandler(TelemetryContextFactory telemetryFactory, FunctionProperties properties,
                            BusinessLogic businessLogic, InvocationErrorMapper errorMapper) {
        super(telemetryFactory, errorMapper);
        this.properties = properties;
        this.businessLogic = businessLogic;
    }

    @Override
    protected String rootSpanName() {
        return ROOT_SPAN;
    }

    @Override
    protected FunctionResponse handle(Map<String, Object> event, InvocationContext context,
                                      TelemetryContext telemetry, SpanHandle root) throws Exception {
        String requestId = context.awsRequestId();
        int eventSize = JsonBodies.sizeOf(event);
        log.info("Lambda function invoked with event of {} bytes", eventSize);

        root.setAttribute("faas.execution", requestId)
                .setAttribute("faas.id", nullToEmpty(context.functionName()))
                .setAttribute("faas.version", nullToEmpty(context.functionVersion()))
                .setAttribute("cloud.account.id", context.accountId())
                .setAttribute("cloud.region", properties.region());

        Map<String, Object> started = new LinkedHashMap<>();
        started.put("function_name", context.functionName());
        started.put("function_version", context.functionVersion());
        started.put("remaining_time_ms", context.remainingTimeMillis());
        started.put("event_source", event.getOrDefault("source", "unknown"));
        started.put("event_size", eventSize);
        telemetry.info("Lambda function invocation started", started);

        ProcessingResult result = businessLogic.processEvent(telemetry, root, requestId, eventSize,
                context.functionName());

        Map<String, Object> completed = new LinkedHashMap<>();
        completed.put("result", result);
        completed.put("execution_duration_ms", NOMINAL_TIMEOUT_MS - context.remainingTimeMillis());
        telemetry.info("Lambda function execution completed successfully", completed);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", "Function executed successfully");
        body.put("requestId", requestId);
        body.put("result", result);
        body.put("timestamp", SinkRecordSerializer.formatTimestamp(Instant.now()));

        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(FunctionResponse.HEADER_CONTENT_TYPE, FunctionResponse.APPLICATION_JSON);
        headers.put(FunctionResponse.HEADER_REQUEST_ID, requestId);

        root.setAttribute("lambda.execution.success", true);
        return new FunctionResponse(200, headers, JsonBodies.write(body));
    }

    @Override
    protected void recordFailure(Map<String, Object> event, InvocationContext context,
                                 TelemetryContext telemetry, Exception failure, long elapsedMs) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("function_name", context.functionName());
        metadata.put("execution_duration_ms", elapsedMs);
        telemetry.error("Lambda function execution failed", failure, metadata);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
