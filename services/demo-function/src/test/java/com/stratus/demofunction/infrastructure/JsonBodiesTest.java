package com.stratus.demofunction.infrastructure;

import com.stratus.demofunction.domain.DbWriteResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.UncheckedIOException;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("JsonBodies")
class JsonBodiesTest {

    @Test
    @DisplayName("should write domain results with snake_case names")
    void shouldWriteSnakeCase() {
        String json = JsonBodies.write(new DbWriteResult("item_1", "req-1", "created"));

        assertThat(JsonBodies.readEvent(json))
                .containsOnlyKeys("item_id", "request_id", "status")
                .containsEntry("item_id", "item_1");
    }

    @Test
    @DisplayName("should parse an event object")
    void shouldParseEvent() {
        Map<String, Object> event = JsonBodies.readEvent("{\"test\":\"manual\",\"n\":2}");

        assertThat(event).containsEntry("test", "manual").containsEntry("n", 2);
    }

    @Test
    @DisplayName("should reject text that is not a JSON object")
    void shouldRejectNonObject() {
        assertThatThrownBy(() -> JsonBodies.readEvent("[1,2]"))
                .isInstanceOf(UncheckedIOException.class);
    }

    @Test
    @DisplayName("should report the length of the JSON form")
    void shouldReportSize() {
        assertThat(JsonBodies.sizeOf(Map.of("test", "manual"))).isEqualTo("{\"test\":\"manual\"}".length());
    }
}
