package com.stratus.eventmodel;

/**
 * Discriminator for the records written to the sink.
 */
public enum RecordType {
    LOG("log"),
    SPAN("span"),
    METRIC("metric");

    private final String value;

    RecordType(String value) {
        this.value = value;
    }

    /** The string written to the {@code record_type} field. */
    public String value() {
        return value;
    }
}
