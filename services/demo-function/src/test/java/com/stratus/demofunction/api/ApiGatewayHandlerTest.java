package com.stratus.demofunction.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.stratus.demofunction.EventFixtures;
import com.stratus.demofunction.config.FunctionProperties;
import com.stratus.demofunction.config.TelemetryContextFactory;
import com.stratus.demofunction.domain.Operation;
import com.stratus.demofunction.runtime.FunctionResponse;
import com.stratus.demofunction.testing.FixedInvocationContext;
import com.stratus.observability.CorrelationContextHolder;
import com.stratus.observability.SensitiveDataRedactor;
import com.stratus.observability.testing.TestTelemetryFactory;
import com.stratus.sink.TelemetryExporter;
import com.stratus.sink.testing.RecordingSinkTransport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ApiGatewayHandler}: request extraction, response headers and the exported
 * telemetry of HTTP-triggered invocations.
 */
@DisplayName("ApiGatewayHandler")
class ApiGatewayHandlerTest {

    private static final String REQUEST_ID = "api-req-001";

    private RecordingSinkTransport transport;
    private TelemetryContextFactory telemetryFactory;

    @BeforeEach
    void setUp() {
        transport = new RecordingSinkTransport();
        telemetryFactory = new TelemetryContextFactory(
                new TelemetryExporter(TestTelemetryFactory.sinkConfig(), transport));
    }

    @AfterEach
    void cleanup() {
        CorrelationContextHolder.clear();
    }

    private FunctionResponse invoke(FunctionProperties properties, Map<String, Object> event) {
        return new ApiGatewayHandler(telemetryFactory, properties)
                .handleRequest(event, FixedInvocationContext.of(REQUEST_ID));
    }

    @Nested
    @DisplayName("Successful request")
    class Success {

        @Test
        @DisplayName("should answer 200 with request ID, response time and CORS headers")
        void shouldAnswerWithHeaders() {
            FunctionResponse response = invoke(FunctionProperties.instant(), EventFixtures.apiGatewayEvent());

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(response.header(FunctionResponse.HEADER_REQUEST_ID)).isEqualTo(REQUEST_ID);
            assertThat(response.header(FunctionResponse.HEADER_ALLOW_ORIGIN)).isEqualTo("*");
            assertThat(response.header(FunctionResponse.HEADER_RESPONSE_TIME)).matches("\\d+ms");
        }

        @Test
        @DisplayName("should echo method, path and query in the body")
        void shouldEchoRequest() {
            FunctionResponse response = invoke(FunctionProperties.instant(), EventFixtures.apiGatewayEvent());

            JsonNode body = EventFixtures.json(response.body());
            assertThat(body.get("message").asText()).isEqualTo("API request processed successfully");
            assertThat(body.get("method").asText()).isEqualTo("GET");
            assertThat(body.get("path").asText()).isEqualTo("/demo");
            assertThat(body.get("queryParams").get("name").asText()).isEqualTo("stratus");
            assertThat(body.get("processingResult").get("request_processed").asBoolean()).isTrue();
            assertThat(body.get("processingResult").get("external_data").get("status").asText())
                    .isEqualTo("success");
        }

        @Test
        @DisplayName("should log the received request with redacted query parameters")
        void shouldLogReceivedRequest() {
            invoke(FunctionProperties.instant(), EventFixtures.apiGatewayEvent());

            List<JsonNode> records = EventFixtures.records(transport.lastRequest().body());
            JsonNode received = EventFixtures.find(records, "message", "API request received");
            assertThat(received.get("http_method").asText()).isEqualTo("GET");
            assertThat(received.get("user_agent").asText()).isEqualTo("curl/8.4.0");
            assertThat(received.get("source_ip").asText()).isEqualTo("203.0.113.7");
            assertThat(received.get("api_gateway_request_id").asText()).isEqualTo("gw-req-001");
            assertThat(received.get("headers_count").asInt()).isEqualTo(3);
            assertThat(received.get("query_params").get("api_key").asText())
                    .isEqualTo(SensitiveDataRedactor.REDACTED);
            assertThat(received.get("request_id").asText()).isEqualTo(REQUEST_ID);

            EventFixtures.find(records, "message", "API request processed successfully");
        }

        @Test
        @DisplayName("should export the gateway span tree")
        void shouldExportSpans() {
            invoke(FunctionProperties.instant(), EventFixtures.apiGatewayEvent());

            List<JsonNode> records = EventFixtures.records(transport.lastRequest().body());
            JsonNode root = EventFixtures.find(records, "span_name", "api_gateway_handler");
            JsonNode process = EventFixtures.find(records, "span_name", "process_api_request");
            JsonNode call = EventFixtures.find(records, "span_name", "external_api_call");

            assertThat(root.get("status").asText()).isEqualTo("ok");
            assertThat(root.get("attributes").get("http.client_ip").asText()).isEqualTo("203.0.113.7");
            assertThat(process.get("parent_span_id").asText()).isEqualTo(root.get("span_id").asText());
            assertThat(call.get("parent_span_id").asText()).isEqualTo(process.get("span_id").asText());
            assertThat(call.get("attributes").get("http.url").asText()).isEqualTo("https://api.example.com/data");
        }

        @Test
        @DisplayName("should export request counter and response time histogram")
        void shouldExportMetrics() {
            invoke(FunctionProperties.instant(), EventFixtures.apiGatewayEvent());

            List<JsonNode> records = EventFixtures.records(transport.lastRequest().body());
            JsonNode counter = EventFixtures.find(records, "metric_name", ApiGatewayHandler.REQUESTS_TOTAL);
            JsonNode histogram = EventFixtures.find(records, "metric_name", ApiGatewayHandler.RESPONSE_TIME);

            assertThat(counter.get("labels").get("status").asText()).isEqualTo("200");
            assertThat(counter.get("labels").get("path").asText()).isEqualTo("/demo");
            assertThat(histogram.get("count").asLong()).isEqualTo(1);
        }

        @Test
        @DisplayName("should default missing request fields")
        void shouldDefaultMissingFields() {
            FunctionResponse response = invoke(FunctionProperties.instant(), Map.of());

            JsonNode body = EventFixtures.json(response.body());
            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(body.get("method").asText()).isEqualTo("UNKNOWN");
            assertThat(body.get("path").asText()).isEqualTo("/");
        }
    }

    @Nested
    @DisplayName("Failed request")
    class Failure {

        @Test
        @DisplayName("should answer 500 with CORS and request ID headers")
        void shouldAnswerGenericError() {
            FunctionResponse response = invoke(new FunctionProperties("", Duration.ZERO, Operation.EXTERNAL_API),
                    EventFixtures.apiGatewayEvent());

            assertThat(response.statusCode()).isEqualTo(500);
            assertThat(response.header(FunctionResponse.HEADER_ALLOW_ORIGIN)).isEqualTo("*");
            assertThat(response.header(FunctionResponse.HEADER_REQUEST_ID)).isEqualTo(REQUEST_ID);
            assertThat(EventFixtures.json(response.body()).get("requestId").asText()).isEqualTo(REQUEST_ID);
        }

        @Test
        @DisplayName("should export the error record, failed spans and a 500 counter")
        void shouldExportFailureTelemetry() {
            invoke(new FunctionProperties("", Duration.ZERO, Operation.EXTERNAL_API),
                    EventFixtures.apiGatewayEvent());

            List<JsonNode> records = EventFixtures.records(transport.lastRequest().body());
            JsonNode failed = EventFixtures.find(records, "message", "API request failed");
            assertThat(failed.get("level").asText()).isEqualTo("error");
            assertThat(failed.get("http_path").asText()).isEqualTo("/demo");
            assertThat(failed.get("error_message").asText()).isEqualTo("Simulated external_api failure");
            assertThat(failed.get("request_id").asText()).isEqualTo(REQUEST_ID);

            assertThat(EventFixtures.find(records, "span_name", "api_gateway_handler").get("status").asText())
                    .isEqualTo("error");
            assertThat(EventFixtures.find(records, "span_name", "external_api_call").get("status").asText())
                    .isEqualTo("error");

            JsonNode counter = EventFixtures.find(records, "metric_name", ApiGatewayHandler.REQUESTS_TOTAL);
            assertThat(counter.get("labels").get("status").asText()).isEqualTo("500");
        }
    }
}
