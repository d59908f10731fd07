package com.stratus.demofunction.config;

import com.stratus.demofunction.domain.Operation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;

/**
 * Handler-level configuration of the demo function.
 *
 * <p>Read from environment variables:
 *
 * <pre>
 * AWS_REGION=eu-west-1
 * DEMO_SIMULATED_DELAY_MS=100
 * DEMO_FAIL_OPERATION=s3
 * </pre>
 *
 * @param region          cloud region reported on root spans (empty if unknown)
 * @param simulatedDelay  base unit of the simulated downstream latencies; zero disables sleeping
 * @param failOperation   simulated operation that should fail, or null for none
 */
public record FunctionProperties(String region, Duration simulatedDelay, Operation failOperation) {

    private static final Logger log = LoggerFactory.getLogger(FunctionProperties.class);

    public static final String ENV_REGION = "AWS_REGION";
    public static final String ENV_SIMULATED_DELAY_MS = "DEMO_SIMULATED_DELAY_MS";
    public static final String ENV_FAIL_OPERATION = "DEMO_FAIL_OPERATION";

    public static final Duration DEFAULT_SIMULATED_DELAY = Duration.ofMillis(100);

    /**
     * Compact constructor: applies defaults for optional fields.
     */
    public FunctionProperties {
        if (region == null) {
            region = "";
        }
        if (simulatedDelay == null || simulatedDelay.isNegative()) {
            simulatedDelay = DEFAULT_SIMULATED_DELAY;
        }
    }

    /**
     * Properties without simulated latency or failures.
     */
    public static FunctionProperties instant() {
        return new FunctionProperties("", Duration.ZERO, null);
    }

    public static FunctionProperties fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    public static FunctionProperties fromEnvironment(Map<String, String> env) {
        return new FunctionProperties(env.get(ENV_REGION), delay(env.get(ENV_SIMULATED_DELAY_MS)),
                operation(env.get(ENV_FAIL_OPERATION)));
    }

    private static Duration delay(String raw) {
        if (raw == null || raw.isBlank()) {
            return DEFAULT_SIMULATED_DELAY;
        }
        try {
            return Duration.ofMillis(Long.parseLong(raw.trim()));
        } catch (NumberFormatException e) {
            log.warn("Ignoring malformed {}='{}', using {} ms", ENV_SIMULATED_DELAY_MS, raw,
                    DEFAULT_SIMULATED_DELAY.toMillis());
            return DEFAULT_SIMULATED_DELAY;
        }
    }

    private static Operation operation(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Operation.fromValue(raw.trim().toLowerCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring unknown {}='{}'", ENV_FAIL_OPERATION, raw);
            return null;
        }
    }
}
