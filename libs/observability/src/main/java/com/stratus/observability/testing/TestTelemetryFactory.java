package com.stratus.observability.testing;

import com.stratus.observability.CorrelationContext;
import com.stratus.observability.TelemetryContext;
import com.stratus.sink.SinkConfig;
import com.stratus.sink.SinkTransport;
import com.stratus.sink.TelemetryExporter;
import io.opentelemetry.sdk.trace.IdGenerator;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Test factory for telemetry contexts wired to a fake sink.
 * <p>
 * Placed in {@code src/main/java} so other modules can import it as a regular dependency
 * in their test scope. All values are deterministic for test reproducibility, but
 * convenience methods generate random UUIDs when needed.
 */
public final class TestTelemetryFactory {

    /** Default correlation ID for tests. */
    public static final String DEFAULT_CORRELATION_ID = "test-corr-001";

    /** Default function name for tests. */
    public static final String DEFAULT_FUNCTION_NAME = "test-function";

    /** Default function version for tests. */
    public static final String DEFAULT_FUNCTION_VERSION = "$LATEST";

    /** Base endpoint of the fake sink. */
    public static final String SINK_ENDPOINT = "http://sink.test:5080";

    public static final String SINK_ORGANIZATION = "acme";

    public static final String SINK_STREAM = "lambda";

    private TestTelemetryFactory() {
        // utility class
    }

    /**
     * An enabled sink configuration pointing at {@link #SINK_ENDPOINT}.
     */
    public static SinkConfig sinkConfig() {
        return SinkConfig.of(SINK_ENDPOINT, SINK_ORGANIZATION, SINK_STREAM, "test@example.com", "secret");
    }

    /**
     * A context exporting through {@code transport} with sequential, predictable IDs.
     */
    public static TelemetryContext.Builder contextBuilder(SinkTransport transport) {
        return TelemetryContext.builder(new TelemetryExporter(sinkConfig(), transport))
                .functionName(DEFAULT_FUNCTION_NAME)
                .functionVersion(DEFAULT_FUNCTION_VERSION)
                .idGenerator(sequentialIds());
    }

    public static TelemetryContext context(SinkTransport transport) {
        return contextBuilder(transport).build();
    }

    /**
     * A correlation context with all default values.
     */
    public static CorrelationContext createDefault() {
        return new CorrelationContext(DEFAULT_CORRELATION_ID, DEFAULT_FUNCTION_NAME,
                DEFAULT_FUNCTION_VERSION, String.format("%032x", 1));
    }

    /**
     * A correlation context with a random correlation ID and all other defaults.
     */
    public static CorrelationContext createRandom() {
        return new CorrelationContext(UUID.randomUUID().toString(), DEFAULT_FUNCTION_NAME,
                DEFAULT_FUNCTION_VERSION, UUID.randomUUID().toString().replace("-", ""));
    }

    /**
     * An ID generator producing {@code 0000...0001}, {@code 0000...0002}, ... for trace and
     * span IDs alike.
     */
    public static IdGenerator sequentialIds() {
        AtomicLong next = new AtomicLong();
        return new IdGenerator() {
            @Override
            public String generateSpanId() {
                return String.format("%016x", next.incrementAndGet());
            }

            @Override
            public String generateTraceId() {
                return String.format("%032x", next.incrementAndGet());
            }
        };
    }
}
