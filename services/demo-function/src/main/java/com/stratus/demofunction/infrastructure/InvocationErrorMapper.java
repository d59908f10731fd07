package com.stratus.demofunction.infrastructure;

import com.stratus.demofunction.runtime.FunctionResponse;
import com.stratus.eventmodel.SinkRecordSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps an invocation failure to the generic {@code 500} response.
 *
 * <p>The body never carries the exception message or stack trace:
 *
 * <pre>
 * {
 *   "error": "Internal server error",
 *   "requestId": "c6af9ac6-7b61-11e6-9a41-93e8deadbeef",
 *   "timestamp": "2024-05-01T10:30:00.123Z"
 * }
 * </pre>
 *
 * <p>The request ID is echoed in {@code X-Request-ID} so callers can find the matching error record
 * in the sink. The full failure goes to the local log only.
 */
public final class InvocationErrorMapper {

    private static final Logger log = LoggerFactory.getLogger(InvocationErrorMapper.class);

    public static final int INTERNAL_ERROR_STATUS = 500;
    public static final String GENERIC_ERROR = "Internal server error";

    private final Clock clock;

    public InvocationErrorMapper() {
        this(Clock.systemUTC());
    }

    public InvocationErrorMapper(Clock clock) {
        this.clock = clock;
    }

    /**
     * Builds the error response for {@code requestId}.
     *
     * @param requestId    correlation ID of the failed invocation
     * @param failure      what went wrong; logged, never returned
     * @param extraHeaders headers added after {@code Content-Type} and {@code X-Request-ID}
     */
    public FunctionResponse toResponse(String requestId, Throwable failure, Map<String, String> extraHeaders) {
        log.error("Invocation {} failed", requestId, failure);

        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(FunctionResponse.HEADER_CONTENT_TYPE, FunctionResponse.APPLICATION_JSON);
        if (extraHeaders != null) {
            headers.putAll(extraHeaders);
        }
        headers.put(FunctionResponse.HEADER_REQUEST_ID, requestId);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", GENERIC_ERROR);
        body.put("requestId", requestId);
        body.put("timestamp", SinkRecordSerializer.formatTimestamp(clock.instant()));
        return new FunctionResponse(INTERNAL_ERROR_STATUS, headers, JsonBodies.write(body));
    }
}
