package com.stratus.demofunction.api;

import com.stratus.demofunction.config.TelemetryContextFactory;
import com.stratus.demofunction.infrastructure.InvocationErrorMapper;
import com.stratus.demofunction.runtime.FunctionResponse;
import com.stratus.demofunction.runtime.InvocationContext;
import com.stratus.observability.SpanHandle;
import com.stratus.observability.TelemetryContext;
import com.stratus.sink.DeliveryResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Invocation boundary shared by the demo handlers.
 *
 * <p>Every invocation follows the same protocol:
 *
 * <ol>
 *   <li>create a {@link TelemetryContext} and open the root span under the runtime request ID
 *   <li>run {@link #handle}
 *   <li>on failure, buffer an error record, end the root span {@code ERROR} and answer with the
 *       generic 500 from {@link InvocationErrorMapper}
 *   <li>complete the context, flushing everything in one batch within the remaining time
 * </ol>
 *
 * <p>The context is completed on every path, including an {@link Error} escaping the handler,
 * which is recorded on the root span and rethrown. An interrupted handler answers 500 and
 * leaves the thread's interrupt flag set.
 *
 * <p>Telemetry delivery problems are logged and never change the response.
 */
public abstract class TelemetryHandler {

    private static final Logger log = LoggerFactory.getLogger(TelemetryHandler.class);

    private final TelemetryContextFactory telemetryFactory;
    private final InvocationErrorMapper errorMapper;

    protected TelemetryHandler(TelemetryContextFactory telemetryFactory, InvocationErrorMapper errorMapper) {
        if (telemetryFactory == null) {
            throw new IllegalArgumentException("telemetryFactory must not be null");
        }
        this.telemetryFactory = telemetryFactory;
        this.errorMapper = errorMapper != null ? errorMapper : new InvocationErrorMapper();
    }

    /**
     * Handles one invocation. Never throws for business failures.
     *
     * @param event   the triggering event, parsed from JSON
     * @param context runtime information about this invocation
     */
    public final FunctionResponse handleRequest(Map<String, Object> event, InvocationContext context) {
        Map<String, Object> input = event == null ? Map.of() : event;
        String requestId = context.awsRequestId();
        long started = System.nanoTime();

        TelemetryContext telemetry = telemetryFactory.create(context);
        SpanHandle root = telemetry.beginInvocation(requestId, rootSpanName());

        FunctionResponse response;
        Exception failure = null;
        try {
            response = handle(input, context, telemetry, root);
            root.setAttribute("response.status_code", (long) response.statusCode());
            root.end();
        } catch (Exception e) {
            failure = e;
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
            recordFailure(input, context, telemetry, e, elapsedMs);
            root.setAttribute("response.status_code", (long) InvocationErrorMapper.INTERNAL_ERROR_STATUS);
            root.endWithError(e);
            response = errorMapper.toResponse(requestId, e, errorHeaders());
        } catch (Error e) {
            telemetry.error("Invocation aborted", e, Map.of());
            root.endWithError(e);
            throw e;
        } finally {
            DeliveryResult delivery = telemetry.complete(Duration.ofMillis(context.remainingTimeMillis()));
            log.debug("Telemetry for {}: {} ({} events, {} attempts)", requestId, delivery.outcome(),
                    delivery.eventCount(), delivery.attempts());
            // set after the final flush: an interrupted thread cannot send
            if (failure instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
        }
        return response;
    }

    /** Name of the invocation's root span. */
    protected abstract String rootSpanName();

    /**
     * Runs the handler's work. Child spans are opened under {@code root}; the root span itself is
     * ended by the caller.
     */
    protected abstract FunctionResponse handle(Map<String, Object> event, InvocationContext context,
                                               TelemetryContext telemetry, SpanHandle root) throws Exception;

    /**
     * Buffers the error record and failure metrics for a failed invocation.
     */
    protected abstract void recordFailure(Map<String, Object> event, InvocationContext context,
                                          TelemetryContext telemetry, Exception failure, long elapsedMs);

    /** Headers added to the generic error response besides Content-Type and X-Request-ID. */
    protected Map<String, String> errorHeaders() {
        return Map.of();
    }
}
