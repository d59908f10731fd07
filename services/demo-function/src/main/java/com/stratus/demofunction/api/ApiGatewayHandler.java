package com.stratus.demofunction.api;

import com.stratus.demofunction.config.FunctionProperties;
import com.stratus.demofunction.config.TelemetryContextFactory;
import com.stratus.demofunction.domain.ApiProcessingResult;
import com.stratus.demofunction.domain.ApiRequest;
import com.stratus.demofunction.domain.BusinessLogic;
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
import java.util.concurrent.TimeUnit;

/**
 * Handler for HTTP-triggered (API gateway proxy) invocations.
 *
 * <p>Reports method, path, query, user agent and caller IP, runs the simulated external API call and
 * answers {@code 200} with {@code X-Request-ID}, {@code X-Response-Time} and CORS headers.
 */
public class ApiGatewayHandler extends TelemetryHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiGatewayHandler.class);

    public static final String ROOT_SPAN = "api_gateway_handler";
    public static final String REQUESTS_TOTAL = "api_requests_total";
    public static final String RESPONSE_TIME = "api_response_time_ms";

    private static final Map<String, String> CORS_HEADERS = Map.of(FunctionResponse.HEADER_ALLOW_ORIGIN, "*");

    private final FunctionProperties properties;
    private final BusinessLogic businessLogic;

    /**
     * Runtime entry point: configuration comes from the environment.
     */
    public ApiGatewayHandler() {
        this(TelemetryContextFactory.fromEnvironment(), FunctionProperties.fromEnvironment());
    }

    public ApiGatewayHandler(TelemetryContextFactory telemetryFactory, FunctionProperties properties) {
        this(telemetryFactory, properties, new BusinessLogic(
                new SimulatedOperations(properties.simulatedDelay(), properties.failOperation())),
                new InvocationErrorMapper());
    }

    public ApiGatewayHandler(TelemetryContextFactory telemetryFactory, FunctionProperties properties,
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
        long started = System.nanoTime();
        String requestId = context.awsRequestId();
        ApiRequest request = ApiRequest.from(event);
        log.info("API Gateway event: {} {}", request.method(), request.path());

        root.setAttribute("http.method", request.method())
                .setAttribute("http.route", request.path())
                .setAttribute("http.scheme", "https")
                .setAttribute("http.user_agent", request.userAgent())
                .setAttribute("http.client_ip", request.sourceIp())
                .setAttribute("faas.execution", requestId)
                .setAttribute("faas.id", context.functionName() == null ? "" : context.functionName())
                .setAttribute("cloud.region", properties.region());

        Map<String, Object> received = new LinkedHashMap<>();
        received.put("http_method", request.method());
        received.put("http_path", request.path());
        received.put("query_params", request.queryParams());
        received.put("user_agent", request.userAgent());
        received.put("source_ip", request.sourceIp());
        received.put("api_gateway_request_id", request.gatewayRequestId());
        received.put("headers_count", request.headers().size());
        telemetry.info("API request received", received);

        ApiProcessingResult result = businessLogic.processApiRequest(telemetry, root, requestId);
        long responseTime = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

        telemetry.increment(REQUESTS_TOTAL, 1,
                Map.of("method", request.method(), "path", request.path(), "status", "200"));
        telemetry.observe(RESPONSE_TIME, responseTime,
                Map.of("method", request.method(), "path", request.path()));

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", "API request processed successfully");
        body.put("requestId", requestId);
        body.put("method", request.method());
        body.put("path", request.path());
        body.put("queryParams", request.queryParams());
        body.put("processingResult", result);
        body.put("responseTime", responseTime);
        body.put("timestamp", SinkRecordSerializer.formatTimestamp(Instant.now()));
        String json = JsonBodies.write(body);

        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(FunctionResponse.HEADER_CONTENT_TYPE, FunctionResponse.APPLICATION_JSON);
        headers.putAll(CORS_HEADERS);
        headers.put(FunctionResponse.HEADER_REQUEST_ID, requestId);
        headers.put(FunctionResponse.HEADER_RESPONSE_TIME, responseTime + "ms");

        Map<String, Object> processed = new LinkedHashMap<>();
        processed.put("response_time_ms", responseTime);
        processed.put("status_code", 200);
        processed.put("external_data_id", result.externalData().id());
        processed.put("response_size", json.length());
        telemetry.info("API request processed successfully", processed);

        root.setAttribute("http.status_code", 200L)
                .setAttribute("http.response_time_ms", responseTime)
                .setAttribute("api.success", true);
        return new FunctionResponse(200, headers, json);
    }

    @Override
    protected void recordFailure(Map<String, Object> event, InvocationContext context,
                                 TelemetryContext telemetry, Exception failure, long elapsedMs) {
        ApiRequest request = ApiRequest.from(event);
        telemetry.increment(REQUESTS_TOTAL, 1,
                Map.of("method", request.method(), "path", request.path(), "status", "500"));

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("response_time_ms", elapsedMs);
        metadata.put("http_method", request.method());
        metadata.put("http_path", request.path());
        telemetry.error("API request failed", failure, metadata);
    }

    @Override
    protected Map<String, String> errorHeaders() {
        return CORS_HEADERS;
    }
}
