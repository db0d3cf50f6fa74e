package com.scholarly.citegraph.exception;

public class InvalidTraversalRequestException extends RuntimeException {

    public InvalidTraversalRequestException(String message) {
        super(message);
    }
}
