package com.stratus.demofunction.infrastructure;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.UncheckedIOException;
import java.util.Map;

/**
 * JSON helpers for handler events and response bodies.
 */
public final class JsonBodies {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private static final TypeReference<Map<String, Object>> EVENT_TYPE = new TypeReference<>() {
    };

    private JsonBodies() {
        // utility class
    }

    /**
     * Serializes a response body.
     *
     * @throws UncheckedIOException if the value cannot be serialized
     */
    public static String write(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize response body", e);
        }
    }

    /**
     * Parses a JSON object into an event map.
     *
     * @throws UncheckedIOException if the text is not a JSON object
     */
    public static Map<String, Object> readEvent(String json) {
        try {
            return MAPPER.readValue(json, EVENT_TYPE);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to parse event", e);
        }
    }

    /** Length of the value's JSON form, as reported in {@code event_size} style metadata. */
    public static int sizeOf(Object value) {
        return write(value).length();
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }
}
