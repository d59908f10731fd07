package com.stratus.observability;

/**
 * Lifecycle state of a {@link SpanHandle}.
 */
public enum SpanState {

    /** Accepting attributes, exceptions and status. */
    OPEN,

    /** Finalized; further mutations are ignored. */
    ENDED
}
