package com.stratus.demofunction.testing;

import com.stratus.demofunction.runtime.InvocationContext;

import java.util.UUID;

/**
 * {@link InvocationContext} with fixed values, for tests and local runs.
 * <p>
 * Placed in {@code src/main/java} so other modules can import it as a regular dependency
 * in their test scope.
 */
public record FixedInvocationContext(
        String awsRequestId,
        String functionName,
        String functionVersion,
        String invokedFunctionArn,
        long remainingTimeMillis
) implements InvocationContext {

    public static final String DEFAULT_FUNCTION_NAME = "lambda-openobserve-demo";
    public static final String DEFAULT_FUNCTION_VERSION = "$LATEST";
    public static final String DEFAULT_ACCOUNT_ID = "123456789012";
    public static final long DEFAULT_REMAINING_TIME_MS = 30_000;

    /**
     * A context for {@code requestId} with the default function identity and 30 s remaining.
     */
    public static FixedInvocationContext of(String requestId) {
        return new FixedInvocationContext(requestId, DEFAULT_FUNCTION_NAME, DEFAULT_FUNCTION_VERSION,
                "arn:aws:lambda:us-east-1:" + DEFAULT_ACCOUNT_ID + ":function:" + DEFAULT_FUNCTION_NAME,
                DEFAULT_REMAINING_TIME_MS);
    }

    /**
     * Same as {@link #of(String)} with a random request ID.
     */
    public static FixedInvocationContext random() {
        return of(UUID.randomUUID().toString());
    }

    public FixedInvocationContext withRemainingTimeMillis(long remaining) {
        return new FixedInvocationContext(awsRequestId, functionName, functionVersion, invokedFunctionArn,
                remaining);
    }
}
