package com.stratus.demofunction.config;

import com.stratus.demofunction.runtime.InvocationContext;
import com.stratus.observability.TelemetryContext;
import com.stratus.sink.SinkConfig;
import com.stratus.sink.TelemetryExporter;

/**
 * Creates one {@link TelemetryContext} per invocation.
 *
 * <p>The exporter, and with it the HTTP client, is built once per function instance and reused by
 * every invocation it serves; everything else is per invocation.
 */
public final class TelemetryContextFactory {

    private final TelemetryExporter exporter;

    public TelemetryContextFactory(TelemetryExporter exporter) {
        if (exporter == null) {
            throw new IllegalArgumentException("exporter must not be null");
        }
        this.exporter = exporter;
    }

    /**
     * Factory backed by the sink configuration in the process environment.
     */
    public static TelemetryContextFactory fromEnvironment() {
        return new TelemetryContextFactory(new TelemetryExporter(SinkConfig.fromEnvironment()));
    }

    public TelemetryContext create(InvocationContext invocation) {
        return TelemetryContext.builder(exporter)
                .functionName(invocation.functionName())
                .functionVersion(invocation.functionVersion())
                .build();
    }

    public TelemetryExporter exporter() {
        return exporter;
    }
}
