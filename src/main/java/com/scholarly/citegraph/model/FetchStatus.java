package com.scholarly.citegraph.model;

/**
 * Outcome of a single provider lookup for one identifier.
 */
public enum FetchStatus {
    OK,
    NOT_FOUND,
    UNAVAILABLE,
    SKIPPED;

    public boolean isFailure() {
        return this == NOT_FOUND || this == UNAVAILABLE;
    }
}
