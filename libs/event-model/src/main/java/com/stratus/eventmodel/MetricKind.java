package com.stratus.eventmodel;

/**
 * The two instrument kinds the metrics aggregator supports.
 */
public enum MetricKind {
    /** Monotonic sum of increments. */
    COUNTER("counter"),
    /** Distribution of observed values. */
    HISTOGRAM("histogram");

    private final String value;

    MetricKind(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
