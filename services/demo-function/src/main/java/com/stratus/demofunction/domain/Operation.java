package com.stratus.demofunction.domain;

/**
 * Simulated downstream operations, named as in {@code DEMO_FAIL_OPERATION}.
 */
public enum Operation {

    DYNAMODB("dynamodb", 1.0),
    S3("s3", 1.5),
    PROCESSING("processing", 2.0),
    EXTERNAL_API("external_api", 3.0),
    API_PROCESSING("api_processing", 1.0);

    private final String value;
    private final double delayUnits;

    Operation(String value, double delayUnits) {
        this.value = value;
        this.delayUnits = delayUnits;
    }

    public String value() {
        return value;
    }

    /** Simulated latency as a multiple of the configured delay unit. */
    public double delayUnits() {
        return delayUnits;
    }

    /**
     * @throws IllegalArgumentException if no operation has that name
     */
    public static Operation fromValue(String value) {
        for (Operation operation : values()) {
            if (operation.value.equals(value)) {
                return operation;
            }
        }
        throw new IllegalArgumentException("Unknown operation: " + value);
    }
}
