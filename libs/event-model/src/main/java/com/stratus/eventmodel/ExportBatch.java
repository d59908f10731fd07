package com.stratus.eventmodel;

import java.util.List;

/**
 * The set of events assembled for a single delivery attempt.
 *
 * <p>A batch lives only for the duration of one flush: it is built right after the event buffer
 * is drained and discarded once the HTTP call resolves.
 *
 * @param serviceName  logical service name stamped on every record
 * @param functionName name of the function being invoked (may be blank outside a runtime)
 * @param events       events in buffer-append order
 */
public record ExportBatch(String serviceName, String functionName, List<TelemetryEvent> events) {

    public ExportBatch {
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be null or blank");
        }
        functionName = functionName == null ? "" : functionName;
        events = events == null ? List.of() : List.copyOf(events);
    }

    public boolean isEmpty() {
        return events.isEmpty();
    }

    public int size() {
        return events.size();
    }
}
