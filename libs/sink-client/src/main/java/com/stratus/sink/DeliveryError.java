package com.stratus.sink;

/**
 * Why a delivery attempt failed.
 *
 * @param kind       transient or permanent
 * @param statusCode HTTP status, or {@code -1} when no response was received
 * @param message    diagnostic text (sink body, exception message, or reason)
 */
public record DeliveryError(FailureKind kind, int statusCode, String message) {

    /** Maximum number of response-body characters kept in {@link #message()}. */
    public static final int MAX_MESSAGE_LENGTH = 512;

    /** Status code used when the sink never answered. */
    public static final int NO_STATUS = -1;

    public DeliveryError {
        if (kind == null) {
            throw new IllegalArgumentException("kind must not be null");
        }
        message = truncate(message == null ? "" : message);
    }

    /** Failure derived from a non-2xx response. */
    public static DeliveryError fromResponse(SinkResponse response) {
        return new DeliveryError(FailureKind.forStatus(response.statusCode()),
                response.statusCode(), "HTTP " + response.statusCode() + ": " + response.body());
    }

    /** Transient failure without an HTTP status (network, timeout, deadline). */
    public static DeliveryError transientFailure(String message) {
        return new DeliveryError(FailureKind.TRANSIENT, NO_STATUS, message);
    }

    /** Permanent failure without an HTTP status (serialization). */
    public static DeliveryError permanentFailure(String message) {
        return new DeliveryError(FailureKind.PERMANENT, NO_STATUS, message);
    }

    public boolean isTransient() {
        return kind == FailureKind.TRANSIENT;
    }

    private static String truncate(String value) {
        return value.length() <= MAX_MESSAGE_LENGTH ? value : value.substring(0, MAX_MESSAGE_LENGTH);
    }
}
