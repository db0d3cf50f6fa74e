package com.scholarly.citegraph.service.provider;

/**
 * Source of citation data for one identifier.
 * Implementations report failures through the lookup status and never throw.
 */
public interface MetadataProvider {

    /**
     * Metadata of the work and the identifiers of the works it references.
     */
    ForwardLookup fetchForward(String id);

    /**
     * Identifiers of the works that cite this one.
     */
    BackwardLookup fetchBackward(String id);
}
