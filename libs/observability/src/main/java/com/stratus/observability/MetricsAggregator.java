package com.stratus.observability;

import com.stratus.eventmodel.MetricPoint;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Aggregates counters and histograms recorded during an invocation.
 * <p>
 * Backed by a Micrometer {@link MeterRegistry}: counters are {@link Counter}s and histograms
 * are {@link DistributionSummary}s. The aggregation key is the meter ID, i.e. the name plus the
 * sorted label set, so label order never splits a series. Values accumulate for the life of the
 * aggregator and are exported as {@link MetricPoint}s by {@link #snapshot(String, Instant)}.
 * <p>
 * A name is bound to the kind it was first recorded as. Recording it as the other kind is
 * dropped with a WARN.
 */
public final class MetricsAggregator {

    private static final Logger log = LoggerFactory.getLogger(MetricsAggregator.class);

    private final MeterRegistry registry;

    /**
     * Creates an aggregator over a fresh {@link SimpleMeterRegistry}.
     */
    public MetricsAggregator() {
        this(new SimpleMeterRegistry());
    }

    /**
     * Creates an aggregator bound to the given registry.
     *
     * @param registry the Micrometer meter registry
     */
    public MetricsAggregator(MeterRegistry registry) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        this.registry = registry;
    }

    /**
     * Adds {@code delta} to the counter identified by name and labels.
     *
     * @return false if the name is already taken by a histogram and the delta was dropped
     * @throws IllegalArgumentException if the name is blank or delta is negative or NaN
     */
    public boolean increment(String name, double delta, Map<String, String> labels) {
        requireName(name);
        if (Double.isNaN(delta) || delta < 0) {
            throw new IllegalArgumentException("counter delta must be a non-negative number, got " + delta);
        }
        Tags tags = tagsOf(labels);
        Counter counter;
        try {
            counter = Counter.builder(name).tags(tags).register(registry);
        } catch (IllegalArgumentException e) {
            log.warn("Dropping counter increment for '{}': {}", name, e.getMessage());
            return false;
        }
        counter.increment(delta);
        return true;
    }

    /**
     * Records one observation in the histogram identified by name and labels.
     *
     * @return false if the name is already taken by a counter and the value was dropped
     * @throws IllegalArgumentException if the name is blank or value is negative or NaN
     */
    public boolean observe(String name, double value, Map<String, String> labels) {
        requireName(name);
        if (Double.isNaN(value) || value < 0) {
            throw new IllegalArgumentException("histogram value must be a non-negative number, got " + value);
        }
        Tags tags = tagsOf(labels);
        DistributionSummary summary;
        try {
            summary = DistributionSummary.builder(name).tags(tags).register(registry);
        } catch (IllegalArgumentException e) {
            log.warn("Dropping histogram observation for '{}': {}", name, e.getMessage());
            return false;
        }
        summary.record(value);
        return true;
    }

    /**
     * Current value of a counter, or 0 if it was never incremented. Labels must match exactly.
     */
    public double counterValue(String name, Map<String, String> labels) {
        return findExact(name, labels)
                .filter(Counter.class::isInstance)
                .map(meter -> ((Counter) meter).count())
                .orElse(0.0);
    }

    /**
     * The histogram identified by name and exact labels, if any observation was recorded.
     */
    public Optional<DistributionSummary> histogram(String name, Map<String, String> labels) {
        return findExact(name, labels)
                .filter(DistributionSummary.class::isInstance)
                .map(DistributionSummary.class::cast);
    }

    /**
     * Exports every meter as a {@link MetricPoint} stamped with the correlation ID, ordered by
     * name and then labels.
     */
    public List<MetricPoint> snapshot(String correlationId, Instant at) {
        List<Meter> meters = new ArrayList<>(registry.getMeters());
        meters.sort(Comparator.comparing((Meter m) -> m.getId().getName())
                .thenComparing(m -> m.getId().getTags().toString()));

        List<MetricPoint> points = new ArrayList<>(meters.size());
        for (Meter meter : meters) {
            Map<String, String> labels = labelsOf(meter);
            if (meter instanceof Counter counter) {
                points.add(MetricPoint.counter(meter.getId().getName(), labels, counter.count(),
                        correlationId, at));
            } else if (meter instanceof DistributionSummary summary) {
                points.add(MetricPoint.histogram(meter.getId().getName(), labels, summary.count(),
                        summary.totalAmount(), summary.max(), correlationId, at));
            }
        }
        return points;
    }

    /** Snapshot stamped with the current time. */
    public List<MetricPoint> snapshot(String correlationId) {
        return snapshot(correlationId, Instant.now());
    }

    /** True until the first counter or histogram is recorded. */
    public boolean isEmpty() {
        return registry.getMeters().isEmpty();
    }

    public MeterRegistry registry() {
        return registry;
    }

    private Optional<Meter> findExact(String name, Map<String, String> labels) {
        Tags wanted = tagsOf(labels);
        return registry.getMeters().stream()
                .filter(meter -> meter.getId().getName().equals(name))
                .filter(meter -> Tags.of(meter.getId().getTags()).equals(wanted))
                .findFirst();
    }

    private static Map<String, String> labelsOf(Meter meter) {
        Map<String, String> labels = new TreeMap<>();
        for (Tag tag : meter.getId().getTags()) {
            labels.put(tag.getKey(), tag.getValue());
        }
        return labels;
    }

    private static Tags tagsOf(Map<String, String> labels) {
        if (labels == null || labels.isEmpty()) {
            return Tags.empty();
        }
        Tags tags = Tags.empty();
        for (Map.Entry<String, String> label : labels.entrySet()) {
            if (label.getKey() == null || label.getValue() == null) {
                throw new IllegalArgumentException("metric label keys and values must not be null");
            }
            tags = tags.and(label.getKey(), label.getValue());
        }
        return tags;
    }

    private static void requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("metric name must not be null or blank");
        }
    }
}
