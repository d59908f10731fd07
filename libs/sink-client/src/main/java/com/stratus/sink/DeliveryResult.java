package com.stratus.sink;

import java.util.Optional;

/**
 * Outcome of one {@link TelemetryExporter#flush} call.
 *
 * @param outcome    delivered, skipped or failed
 * @param eventCount number of events in the batch
 * @param attempts   HTTP attempts made (0 when skipped or not attempted)
 * @param statusCode status of the last response, or {@code -1}
 * @param detail     reason for a skip (null otherwise)
 * @param error      failure details (null unless {@code outcome == FAILED})
 */
public record DeliveryResult(
        Outcome outcome,
        int eventCount,
        int attempts,
        int statusCode,
        String detail,
        DeliveryError error
) {

    /** The three possible flush outcomes. */
    public enum Outcome {
        /** The sink accepted the batch with a 2xx status. */
        DELIVERED,
        /** Nothing was sent: export disabled or nothing to send. Not an error. */
        SKIPPED,
        /** Every attempt failed; see {@link #error()}. */
        FAILED
    }

    public DeliveryResult {
        if (outcome == null) {
            throw new IllegalArgumentException("outcome must not be null");
        }
        if (outcome == Outcome.FAILED && error == null) {
            throw new IllegalArgumentException("a FAILED result requires an error");
        }
    }

    public static DeliveryResult delivered(int eventCount, int attempts, int statusCode) {
        return new DeliveryResult(Outcome.DELIVERED, eventCount, attempts, statusCode, null, null);
    }

    public static DeliveryResult skipped(int eventCount, String reason) {
        return new DeliveryResult(Outcome.SKIPPED, eventCount, 0, DeliveryError.NO_STATUS, reason, null);
    }

    public static DeliveryResult failed(int eventCount, int attempts, DeliveryError error) {
        return new DeliveryResult(Outcome.FAILED, eventCount, attempts, error.statusCode(), null, error);
    }

    public boolean isDelivered() {
        return outcome == Outcome.DELIVERED;
    }

    public boolean isSkipped() {
        return outcome == Outcome.SKIPPED;
    }

    public boolean isFailed() {
        return outcome == Outcome.FAILED;
    }

    /** The failure, if any. */
    public Optional<DeliveryError> failure() {
        return Optional.ofNullable(error);
    }
}
