package com.stratus.sink;

/**
 * Whether a failed delivery could succeed if tried again.
 */
public enum FailureKind {

    /** Network failure, timeout, deadline exhaustion, 408, 429 or 5xx. */
    TRANSIENT,

    /** Rejected by the sink (other 4xx) or unserializable batch. */
    PERMANENT;

    /**
     * Classifies a non-2xx HTTP status.
     */
    public static FailureKind forStatus(int statusCode) {
        if (statusCode == 408 || statusCode == 429 || statusCode >= 500) {
            return TRANSIENT;
        }
        return PERMANENT;
    }
}
