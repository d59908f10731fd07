package com.stratus.demofunction.runtime;

/**
 * What the function runtime tells a handler about the current invocation.
 */
public interface InvocationContext {

    /** Runtime-assigned request ID; used as the invocation's correlation ID. */
    String awsRequestId();

    String functionName();

    String functionVersion();

    /** ARN the caller invoked, possibly null outside a real runtime. */
    String invokedFunctionArn();

    /** Milliseconds left before the runtime terminates the invocation. */
    long remainingTimeMillis();

    /**
     * Account ID segment of {@link #invokedFunctionArn()}, or an empty string if the ARN is absent
     * or malformed.
     */
    default String accountId() {
        String arn = invokedFunctionArn();
        if (arn == null) {
            return "";
        }
        String[] parts = arn.split(":");
        return parts.length > 4 ? parts[4] : "";
    }
}
