package com.stratus.observability;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("SensitiveDataRedactor")
class SensitiveDataRedactorTest {

    private final SensitiveDataRedactor redactor = new SensitiveDataRedactor();

    @Test
    @DisplayName("should redact sensitive keys case-insensitively")
    void shouldRedactSensitiveKeys() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("user", "alice");
        data.put("Password", "hunter2");
        data.put("x-api-token", "abc");
        data.put("Authorization", "Basic Zm9v");
        data.put("apiKey", "k");

        Map<String, Object> redacted = redactor.redact(data);

        assertThat(redacted)
                .containsEntry("user", "alice")
                .containsEntry("Password", SensitiveDataRedactor.REDACTED)
                .containsEntry("x-api-token", SensitiveDataRedactor.REDACTED)
                .containsEntry("Authorization", SensitiveDataRedactor.REDACTED)
                .containsEntry("apiKey", SensitiveDataRedactor.REDACTED);
        assertThat(redacted.keySet()).containsExactly("user", "Password", "x-api-token",
                "Authorization", "apiKey");
    }

    @Test
    @DisplayName("should redact inside nested maps and lists")
    void shouldRedactNested() {
        Map<String, Object> data = Map.of(
                "headers", Map.of("Authorization", "Bearer t", "Accept", "*/*"),
                "items", List.of(Map.of("secret", "s", "id", 1)));

        Map<String, Object> redacted = redactor.redact(data);

        assertThat(asMap(redacted.get("headers")))
                .containsEntry("Authorization", SensitiveDataRedactor.REDACTED)
                .containsEntry("Accept", "*/*");
        assertThat((List<?>) redacted.get("items")).singleElement()
                .satisfies(item -> assertThat(asMap(item))
                        .containsEntry("secret", SensitiveDataRedactor.REDACTED)
                        .containsEntry("id", 1));
    }

    @Test
    @DisplayName("should keep null values and tolerate null input")
    void shouldHandleNulls() {
        Map<String, Object> data = new HashMap<>();
        data.put("note", null);

        assertThat(redactor.redact(data)).containsEntry("note", null);
        assertThat(redactor.redact(null)).isEmpty();
        assertThat(redactor.isSensitive(null)).isFalse();
    }

    @Test
    @DisplayName("should support custom patterns")
    void shouldSupportCustomPatterns() {
        SensitiveDataRedactor custom = new SensitiveDataRedactor(Set.of("ssn"));

        assertThat(custom.isSensitive("customer_SSN")).isTrue();
        assertThat(custom.isSensitive("password")).isFalse();
        assertThat(custom.sensitivePatterns()).containsExactly("ssn");
    }

    @Test
    @DisplayName("should reject an empty pattern set")
    void shouldRejectEmptyPatterns() {
        assertThatThrownBy(() -> new SensitiveDataRedactor(Set.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value) {
        return (Map<String, Object>) value;
    }
}
