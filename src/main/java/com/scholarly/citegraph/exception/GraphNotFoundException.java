package com.scholarly.citegraph.exception;

public class GraphNotFoundException extends RuntimeException {

    public GraphNotFoundException(String message) {
        super(message);
    }
}
