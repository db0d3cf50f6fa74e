package com.scholarly.citegraph.exception;

/**
 * I/O failure while reading or writing graph files or shard files.
 */
public class GraphStorageException extends RuntimeException {

    public GraphStorageException(String message) {
        super(message);
    }

    public GraphStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
