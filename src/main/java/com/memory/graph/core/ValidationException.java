package com.memory.graph.core;

/**
 * Thrown when caller input is malformed, for example blank entry text
 * or an out-of-range page request.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
