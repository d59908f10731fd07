package com.stratus.sink;

import com.stratus.eventmodel.ExportBatch;
import com.stratus.eventmodel.SinkRecordSerializer;
import com.stratus.eventmodel.SinkRecordSerializer.SinkSerializationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.LongSupplier;

/**
 * Delivers export batches to the sink as one authenticated JSON POST.
 * <p>
 * {@link #flush(ExportBatch, Duration)} never throws: every outcome, including a disabled
 * configuration, is reported as a {@link DeliveryResult} and logged locally. Telemetry failures
 * must never turn into a failure of the invocation that produced the telemetry.
 * <p>
 * Each HTTP attempt is capped at {@code min(flushTimeout, remainingBudget - deadlineReserve)}.
 * When that cap is not positive the attempt is abandoned as a transient failure. With
 * {@code maxAttempts > 1} only transient failures are retried, and only while budget remains.
 */
public final class TelemetryExporter {

    private static final Logger log = LoggerFactory.getLogger(TelemetryExporter.class);

    static final String CONTENT_TYPE = "application/json";

    private final SinkConfig config;
    private final SinkTransport transport;
    private final LongSupplier nanoClock;
    private final AtomicBoolean disabledNoticeLogged = new AtomicBoolean();

    /**
     * Creates an exporter using the JDK HTTP client.
     */
    public TelemetryExporter(SinkConfig config) {
        this(config, new HttpClientSinkTransport());
    }

    public TelemetryExporter(SinkConfig config, SinkTransport transport) {
        this(config, transport, System::nanoTime);
    }

    TelemetryExporter(SinkConfig config, SinkTransport transport, LongSupplier nanoClock) {
        if (config == null) {
            throw new IllegalArgumentException("config must not be null");
        }
        if (transport == null) {
            throw new IllegalArgumentException("transport must not be null");
        }
        this.config = config;
        this.transport = transport;
        this.nanoClock = nanoClock;
    }

    /**
     * Flushes a batch with no invocation deadline other than the configured flush timeout.
     */
    public DeliveryResult flush(ExportBatch batch) {
        return flush(batch, null);
    }

    /**
     * Serializes and delivers a batch.
     *
     * @param batch           the events to send
     * @param remainingBudget time left before the invocation deadline, or null if unknown
     * @return the delivery outcome; never null, never thrown
     */
    public DeliveryResult flush(ExportBatch batch, Duration remainingBudget) {
        if (!config.isExportEnabled()) {
            if (disabledNoticeLogged.compareAndSet(false, true)) {
                log.info("Sink credentials not configured, skipping telemetry export");
            }
            return DeliveryResult.skipped(batch.size(), "export disabled");
        }
        if (batch.isEmpty()) {
            log.debug("Nothing to export");
            return DeliveryResult.skipped(0, "empty batch");
        }

        String body;
        try {
            body = SinkRecordSerializer.serialize(batch);
        } catch (SinkSerializationException e) {
            log.warn("Dropping telemetry batch of {} events: {}", batch.size(), e.getMessage(), e);
            return DeliveryResult.failed(batch.size(), 0,
                    DeliveryError.permanentFailure(e.getMessage()));
        }

        URI uri;
        try {
            uri = config.ingestUri();
        } catch (IllegalArgumentException e) {
            log.warn("Invalid sink URL for {}: {}", config, e.getMessage());
            return DeliveryResult.failed(batch.size(), 0,
                    DeliveryError.permanentFailure("invalid sink URL: " + e.getMessage()));
        }
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Authorization", config.credentials().headerValue());
        headers.put("Content-Type", CONTENT_TYPE);

        long startedAt = nanoClock.getAsLong();
        int attempts = 0;
        DeliveryError lastError = null;
        while (attempts < config.maxAttempts()) {
            Duration cap = attemptTimeout(remainingBudget, startedAt);
            if (cap.isZero() || cap.isNegative()) {
                if (lastError == null) {
                    lastError = DeliveryError.transientFailure("invocation deadline exhausted");
                }
                break;
            }
            attempts++;
            log.debug("Sending {} telemetry events to {} (attempt {}, timeout {} ms)",
                    batch.size(), uri, attempts, cap.toMillis());
            try {
                SinkResponse response = transport.post(uri, headers, body, cap);
                if (response.isSuccess()) {
                    log.debug("Sink accepted {} events with HTTP {}", batch.size(), response.statusCode());
                    return DeliveryResult.delivered(batch.size(), attempts, response.statusCode());
                }
                lastError = DeliveryError.fromResponse(response);
            } catch (HttpTimeoutException e) {
                lastError = DeliveryError.transientFailure("timed out after " + cap.toMillis() + " ms");
            } catch (IOException e) {
                lastError = DeliveryError.transientFailure(e.getClass().getSimpleName() + ": " + e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                lastError = DeliveryError.transientFailure("interrupted while sending");
                break;
            } catch (RuntimeException e) {
                lastError = DeliveryError.permanentFailure(
                        e.getClass().getSimpleName() + ": " + e.getMessage());
            }
            if (!lastError.isTransient()) {
                break;
            }
        }

        log.warn("Failed to export {} telemetry events after {} attempt(s): {} {}",
                batch.size(), attempts, lastError.kind(), lastError.message());
        return DeliveryResult.failed(batch.size(), attempts, lastError);
    }

    /**
     * Returns the configuration this exporter sends with.
     */
    public SinkConfig config() {
        return config;
    }

    private Duration attemptTimeout(Duration remainingBudget, long startedAt) {
        if (remainingBudget == null) {
            return config.flushTimeout();
        }
        Duration elapsed = Duration.ofNanos(nanoClock.getAsLong() - startedAt);
        Duration available = remainingBudget.minus(elapsed).minus(config.deadlineReserve());
        return available.compareTo(config.flushTimeout()) < 0 ? available : config.flushTimeout();
    }
}
