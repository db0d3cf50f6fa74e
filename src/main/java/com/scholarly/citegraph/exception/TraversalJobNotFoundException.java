package com.scholarly.citegraph.exception;

public class TraversalJobNotFoundException extends RuntimeException {

    public TraversalJobNotFoundException(String message) {
        super(message);
    }
}
