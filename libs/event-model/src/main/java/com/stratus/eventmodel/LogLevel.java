package com.stratus.eventmodel;

import java.util.Locale;
import java.util.Optional;

/**
 * Severity levels accepted by the sink.
 *
 * <p>The {@code value} field holds the lower-case string used on the wire.
 */
public enum LogLevel {
    INFO("info"),
    WARN("warn"),
    ERROR("error");

    private final String value;

    LogLevel(String value) {
        this.value = value;
    }

    /** The canonical wire representation (e.g. "info"). */
    public String value() {
        return value;
    }

    /**
     * Looks up a level by its wire value, ignoring case. {@code "warning"} is accepted as an
     * alias of {@link #WARN}.
     *
     * @param value the string to match
     * @return the matching level, or empty if not recognized
     */
    public static Optional<LogLevel> fromString(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if ("warning".equals(normalized)) {
            return Optional.of(WARN);
        }
        for (LogLevel level : values()) {
            if (level.value.equals(normalized)) {
                return Optional.of(level);
            }
        }
        return Optional.empty();
    }
}
