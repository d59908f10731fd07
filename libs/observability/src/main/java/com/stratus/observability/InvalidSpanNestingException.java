package com.stratus.observability;

/**
 * Thrown when spans are started in a way that would break the invocation's span tree: a second
 * root, or a parent that belongs to another invocation.
 * <p>
 * This signals a bug in the calling code and is always propagated.
 */
public class InvalidSpanNestingException extends RuntimeException {

    public InvalidSpanNestingException(String message) {
        super(message);
    }
}
