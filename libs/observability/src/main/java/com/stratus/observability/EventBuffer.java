package com.stratus.observability;

import com.stratus.eventmodel.TelemetryEvent;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Append-only, per-invocation queue of telemetry events waiting to be exported.
 * <p>
 * There is no capacity limit; the buffer lives only as long as the invocation. {@link #drain()}
 * hands the current contents to the caller atomically, and drained events are never put back,
 * even if their delivery fails.
 */
public final class EventBuffer {

    private final Object lock = new Object();
    private List<TelemetryEvent> events = new ArrayList<>();

    /**
     * Appends an event.
     *
     * @throws IllegalArgumentException if event is null
     */
    public void append(TelemetryEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("event must not be null");
        }
        synchronized (lock) {
            events.add(event);
        }
    }

    /**
     * Removes and returns every buffered event, in append order.
     */
    public List<TelemetryEvent> drain() {
        List<TelemetryEvent> drained;
        synchronized (lock) {
            if (events.isEmpty()) {
                return List.of();
            }
            drained = events;
            events = new ArrayList<>();
        }
        return Collections.unmodifiableList(drained);
    }

    public int size() {
        synchronized (lock) {
            return events.size();
        }
    }

    public boolean isEmpty() {
        return size() == 0;
    }
}
