package com.stratus.sink;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;
import java.util.Map;

/**
 * Connection and delivery settings for the telemetry sink.
 *
 * <p>Bound from environment variables by {@link #fromEnvironment(Map)}:
 *
 * <pre>
 * OPENOBSERVE_BASE_ENDPOINT=https://api.openobserve.ai
 * OPENOBSERVE_ORGANIZATION=acme
 * OPENOBSERVE_STREAM=lambda
 * OPENOBSERVE_USERNAME=ingest@acme.example
 * OPENOBSERVE_PASSWORD=...
 * TELEMETRY_SERVICE_NAME=lambda-openobserve-demo
 * TELEMETRY_FLUSH_TIMEOUT_MS=3000
 * TELEMETRY_DEADLINE_RESERVE_MS=250
 * TELEMETRY_MAX_ATTEMPTS=1
 * </pre>
 *
 * <p>Export is enabled only when endpoint, organization, username and password are all present.
 * A partial configuration is not an error: the exporter simply skips delivery.
 *
 * @param baseEndpoint    sink root URL (nullable)
 * @param organization    sink organization (nullable)
 * @param stream          target stream, defaults to {@value #DEFAULT_STREAM}
 * @param username        Basic auth username (nullable)
 * @param password        Basic auth password (nullable)
 * @param serviceName     value of the {@code service} field, defaults to {@value #DEFAULT_SERVICE_NAME}
 * @param flushTimeout    upper bound for one HTTP attempt
 * @param deadlineReserve time kept free before the invocation deadline
 * @param maxAttempts     attempts per flush, at least 1
 */
public record SinkConfig(
        String baseEndpoint,
        String organization,
        String stream,
        String username,
        String password,
        String serviceName,
        Duration flushTimeout,
        Duration deadlineReserve,
        int maxAttempts
) {

    public static final String ENV_BASE_ENDPOINT = "OPENOBSERVE_BASE_ENDPOINT";
    public static final String ENV_ORGANIZATION = "OPENOBSERVE_ORGANIZATION";
    public static final String ENV_STREAM = "OPENOBSERVE_STREAM";
    public static final String ENV_USERNAME = "OPENOBSERVE_USERNAME";
    public static final String ENV_PASSWORD = "OPENOBSERVE_PASSWORD";
    public static final String ENV_SERVICE_NAME = "TELEMETRY_SERVICE_NAME";
    public static final String ENV_FLUSH_TIMEOUT_MS = "TELEMETRY_FLUSH_TIMEOUT_MS";
    public static final String ENV_DEADLINE_RESERVE_MS = "TELEMETRY_DEADLINE_RESERVE_MS";
    public static final String ENV_MAX_ATTEMPTS = "TELEMETRY_MAX_ATTEMPTS";

    public static final String DEFAULT_STREAM = "default";
    public static final String DEFAULT_SERVICE_NAME = "lambda-openobserve-demo";
    public static final Duration DEFAULT_FLUSH_TIMEOUT = Duration.ofMillis(3000);
    public static final Duration DEFAULT_DEADLINE_RESERVE = Duration.ofMillis(250);

    private static final Logger log = LoggerFactory.getLogger(SinkConfig.class);

    /**
     * Compact constructor: blank strings become null, optional fields get their defaults.
     */
    public SinkConfig {
        baseEndpoint = blankToNull(baseEndpoint);
        organization = blankToNull(organization);
        username = blankToNull(username);
        password = blankToNull(password);
        stream = blankToNull(stream) == null ? DEFAULT_STREAM : stream.trim();
        serviceName = blankToNull(serviceName) == null ? DEFAULT_SERVICE_NAME : serviceName.trim();
        if (flushTimeout == null || flushTimeout.isNegative() || flushTimeout.isZero()) {
            flushTimeout = DEFAULT_FLUSH_TIMEOUT;
        }
        if (deadlineReserve == null || deadlineReserve.isNegative()) {
            deadlineReserve = DEFAULT_DEADLINE_RESERVE;
        }
        if (maxAttempts < 1) {
            maxAttempts = 1;
        }
    }

    /**
     * A configuration with export disabled and every other field defaulted.
     */
    public static SinkConfig disabled() {
        return new SinkConfig(null, null, null, null, null, null, null, null, 1);
    }

    /**
     * Convenience factory for an enabled configuration with default delivery settings.
     */
    public static SinkConfig of(String baseEndpoint, String organization, String stream,
                                String username, String password) {
        return new SinkConfig(baseEndpoint, organization, stream, username, password,
                null, null, null, 1);
    }

    /**
     * Reads the configuration from the process environment.
     */
    public static SinkConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * Reads the configuration from the given variables. Malformed numbers fall back to their
     * defaults with a warning rather than failing the invocation.
     */
    public static SinkConfig fromEnvironment(Map<String, String> env) {
        return new SinkConfig(
                env.get(ENV_BASE_ENDPOINT),
                env.get(ENV_ORGANIZATION),
                env.get(ENV_STREAM),
                env.get(ENV_USERNAME),
                env.get(ENV_PASSWORD),
                env.get(ENV_SERVICE_NAME),
                millis(env, ENV_FLUSH_TIMEOUT_MS),
                millis(env, ENV_DEADLINE_RESERVE_MS),
                attempts(env));
    }

    /**
     * True when every setting needed for delivery is present.
     */
    public boolean isExportEnabled() {
        return baseEndpoint != null && organization != null && username != null && password != null;
    }

    /**
     * The ingestion URL {@code <base_endpoint>/api/<organization>/<stream>/_json}.
     *
     * @throws IllegalStateException if export is disabled
     */
    public URI ingestUri() {
        if (!isExportEnabled()) {
            throw new IllegalStateException("sink export is not configured");
        }
        String base = baseEndpoint.endsWith("/")
                ? baseEndpoint.substring(0, baseEndpoint.length() - 1)
                : baseEndpoint;
        return URI.create(base + "/api/" + organization + "/" + stream + "/_json");
    }

    /**
     * Credentials for the Authorization header.
     *
     * @throws IllegalStateException if export is disabled
     */
    public BasicCredentials credentials() {
        if (!isExportEnabled()) {
            throw new IllegalStateException("sink export is not configured");
        }
        return new BasicCredentials(username, password);
    }

    @Override
    public String toString() {
        return "SinkConfig[baseEndpoint=" + baseEndpoint
                + ", organization=" + organization
                + ", stream=" + stream
                + ", username=" + username
                + ", password=" + (password == null ? null : "****")
                + ", serviceName=" + serviceName
                + ", flushTimeout=" + flushTimeout
                + ", deadlineReserve=" + deadlineReserve
                + ", maxAttempts=" + maxAttempts + "]";
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    private static Duration millis(Map<String, String> env, String key) {
        long value = number(env, key, -1);
        return value < 0 ? null : Duration.ofMillis(value);
    }

    private static int attempts(Map<String, String> env) {
        long value = number(env, ENV_MAX_ATTEMPTS, 1);
        if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
            log.warn("Ignoring out-of-range {}={}, using default", ENV_MAX_ATTEMPTS, value);
            return 1;
        }
        return (int) value;
    }

    private static long number(Map<String, String> env, String key, long fallback) {
        String raw = blankToNull(env.get(key));
        if (raw == null) {
            return fallback;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Ignoring malformed {}={}, using default", key, raw);
            return fallback;
        }
    }
}
