package com.stratus.eventmodel;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Instant;

/**
 * An exception captured on a span while it was open.
 *
 * @param type       fully-qualified exception class name
 * @param message    exception message (nullable)
 * @param stackTrace rendered stack trace
 * @param timestamp  when the exception was recorded
 */
public record RecordedException(String type, String message, String stackTrace, Instant timestamp) {

    public RecordedException {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("type must not be null or blank");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp must not be null");
        }
    }

    /**
     * Captures the given throwable at the current time.
     */
    public static RecordedException from(Throwable error) {
        if (error == null) {
            throw new IllegalArgumentException("error must not be null");
        }
        return new RecordedException(
                error.getClass().getName(), error.getMessage(), stackTraceOf(error), Instant.now());
    }

    /** Renders the full stack trace of a throwable, including causes. */
    public static String stackTraceOf(Throwable error) {
        StringWriter out = new StringWriter();
        error.printStackTrace(new PrintWriter(out));
        return out.toString();
    }
}
