package com.stratus.eventmodel;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Snapshot of one aggregated metric series, keyed by name and sorted label set.
 *
 * <p>For counters only {@code value} is meaningful and {@code count} is zero. For histograms
 * {@code count}, {@code sum} and {@code max} describe the observed distribution and
 * {@code value} holds the mean.
 *
 * @param kind          counter or histogram
 * @param name          metric name
 * @param labels        label set, sorted by key
 * @param value         cumulative counter value, or histogram mean
 * @param count         number of histogram observations
 * @param sum           sum of histogram observations
 * @param max           largest histogram observation
 * @param correlationId invocation the snapshot was taken in
 * @param timestamp     when the snapshot was taken
 */
public record MetricPoint(
        MetricKind kind,
        String name,
        SortedMap<String, String> labels,
        double value,
        long count,
        double sum,
        double max,
        String correlationId,
        Instant timestamp
) implements TelemetryEvent {

    public MetricPoint {
        if (kind == null) {
            throw new IllegalArgumentException("kind must not be null");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp must not be null");
        }
        labels = Collections.unmodifiableSortedMap(
                labels == null ? new TreeMap<>() : new TreeMap<>(labels));
    }

    /** Creates a counter point. */
    public static MetricPoint counter(String name, Map<String, String> labels, double value,
                                      String correlationId, Instant timestamp) {
        return new MetricPoint(MetricKind.COUNTER, name, sorted(labels), value, 0, 0, 0,
                correlationId, timestamp);
    }

    /** Creates a histogram point; the mean is derived from {@code sum / count}. */
    public static MetricPoint histogram(String name, Map<String, String> labels, long count,
                                        double sum, double max, String correlationId,
                                        Instant timestamp) {
        double mean = count == 0 ? 0 : sum / count;
        return new MetricPoint(MetricKind.HISTOGRAM, name, sorted(labels), mean, count, sum, max,
                correlationId, timestamp);
    }

    private static SortedMap<String, String> sorted(Map<String, String> labels) {
        return labels == null ? new TreeMap<>() : new TreeMap<>(labels);
    }

    @Override
    public RecordType recordType() {
        return RecordType.METRIC;
    }
}
