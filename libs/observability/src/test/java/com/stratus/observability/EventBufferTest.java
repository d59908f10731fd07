package com.stratus.observability;

import com.stratus.eventmodel.LogLevel;
import com.stratus.eventmodel.LogRecord;
import com.stratus.eventmodel.TelemetryEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("EventBuffer")
class EventBufferTest {

    private final EventBuffer buffer = new EventBuffer();

    @Test
    @DisplayName("should drain events in append order")
    void shouldDrainInAppendOrder() {
        buffer.append(record("first"));
        buffer.append(record("second"));
        buffer.append(record("third"));

        List<TelemetryEvent> drained = buffer.drain();

        assertThat(drained).extracting(e -> ((LogRecord) e).message())
                .containsExactly("first", "second", "third");
    }

    @Test
    @DisplayName("should be empty after drain")
    void shouldBeEmptyAfterDrain() {
        buffer.append(record("x"));
        buffer.drain();

        assertThat(buffer.isEmpty()).isTrue();
        assertThat(buffer.drain()).isEmpty();
    }

    @Test
    @DisplayName("should keep appending after a drain")
    void shouldKeepAppendingAfterDrain() {
        buffer.append(record("a"));
        List<TelemetryEvent> first = buffer.drain();
        buffer.append(record("b"));

        assertThat(first).hasSize(1);
        assertThat(buffer.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("should return an unmodifiable list")
    void shouldReturnUnmodifiableList() {
        buffer.append(record("a"));

        List<TelemetryEvent> drained = buffer.drain();

        assertThatThrownBy(() -> drained.add(record("b")))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("should reject null events")
    void shouldRejectNull() {
        assertThatThrownBy(() -> buffer.append(null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("should not lose events appended concurrently with drains")
    void shouldNotLoseEventsUnderConcurrency() throws InterruptedException {
        int threads = 4;
        int perThread = 500;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch done = new CountDownLatch(threads);
        List<TelemetryEvent> collected = new ArrayList<>();

        for (int t = 0; t < threads; t++) {
            pool.submit(() -> {
                for (int i = 0; i < perThread; i++) {
                    buffer.append(record("m"));
                }
                done.countDown();
            });
        }
        while (done.getCount() > 0) {
            collected.addAll(buffer.drain());
        }
        done.await(5, TimeUnit.SECONDS);
        collected.addAll(buffer.drain());
        pool.shutdown();

        assertThat(collected).hasSize(threads * perThread);
    }

    private static LogRecord record(String message) {
        return LogRecord.of(LogLevel.INFO, message, "req-1", Map.of());
    }
}
