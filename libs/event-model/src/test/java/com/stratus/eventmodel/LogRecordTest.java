package com.stratus.eventmodel;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("LogRecord")
class LogRecordTest {

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        @DisplayName("rejects blank correlation ID")
        void rejectsBlankCorrelationId() {
            assertThatThrownBy(() -> LogRecord.of(LogLevel.INFO, "msg", " ", Map.of()))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("correlationId");
        }

        @Test
        @DisplayName("rejects null level")
        void rejectsNullLevel() {
            assertThatThrownBy(() -> new LogRecord(null, "msg", "req-1", Map.of(), Instant.now()))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("level");
        }

        @Test
        @DisplayName("rejects null message")
        void rejectsNullMessage() {
            assertThatThrownBy(() -> LogRecord.of(LogLevel.INFO, null, "req-1", Map.of()))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("message");
        }
    }

    @Nested
    @DisplayName("Metadata")
    class Metadata {

        @Test
        @DisplayName("null metadata becomes an empty map")
        void nullMetadataBecomesEmpty() {
            LogRecord record = LogRecord.of(LogLevel.INFO, "msg", "req-1", null);

            assertThat(record.metadata()).isEmpty();
        }

        @Test
        @DisplayName("is a defensive copy that preserves insertion order")
        void defensiveCopyPreservesOrder() {
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("zeta", 1);
            metadata.put("alpha", 2);

            LogRecord record = LogRecord.of(LogLevel.WARN, "msg", "req-1", metadata);
            metadata.put("late", 3);

            assertThat(record.metadata()).containsOnlyKeys("zeta", "alpha");
            assertThat(record.metadata().keySet()).containsExactly("zeta", "alpha");
        }

        @Test
        @DisplayName("keeps null values")
        void keepsNullValues() {
            Map<String, Object> metadata = new HashMap<>();
            metadata.put("event_source", null);

            LogRecord record = LogRecord.of(LogLevel.INFO, "msg", "req-1", metadata);

            assertThat(record.metadata()).containsEntry("event_source", null);
        }

        @Test
        @DisplayName("cannot be modified")
        void isUnmodifiable() {
            LogRecord record = LogRecord.of(LogLevel.INFO, "msg", "req-1", Map.of("a", 1));

            assertThatThrownBy(() -> record.metadata().put("b", 2))
                    .isInstanceOf(UnsupportedOperationException.class);
        }
    }

    @Test
    @DisplayName("reports LOG record type")
    void reportsLogRecordType() {
        assertThat(LogRecord.of(LogLevel.ERROR, "boom", "req-1", Map.of()).recordType())
                .isEqualTo(RecordType.LOG);
    }
}
