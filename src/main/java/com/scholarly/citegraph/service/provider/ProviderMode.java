package com.scholarly.citegraph.service.provider;

/**
 * Where node metadata and citation links come from.
 */
public enum ProviderMode {
    /** CrossRef for references, OpenCitations for citers. */
    LIVE,
    /** Local journal shard files only. */
    LOCAL,
    /** Local shards first, live services when the shards have no answer. */
    HYBRID
}
