package com.scholarly.citegraph.exception;

/**
 * Raised when a persisted graph document cannot be parsed into a graph.
 */
public class CorruptGraphDataException extends RuntimeException {

    public CorruptGraphDataException(String message) {
        super(message);
    }

    public CorruptGraphDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
