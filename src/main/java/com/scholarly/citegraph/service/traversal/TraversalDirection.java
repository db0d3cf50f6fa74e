package com.scholarly.citegraph.service.traversal;

/**
 * Edge directions a traversal records and follows.
 */
public enum TraversalDirection {
    /** References and citers. */
    BOTH,
    /** Works cited by each visited work only; builds a reference tree. */
    REFERENCES,
    /** Works citing each visited work only. Metadata is still looked up. */
    CITERS;

    public boolean followsReferences() {
        return this != CITERS;
    }

    public boolean followsCiters() {
        return this != REFERENCES;
    }
}
