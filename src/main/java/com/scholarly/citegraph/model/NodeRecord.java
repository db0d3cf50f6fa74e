package com.scholarly.citegraph.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Per-identifier entry of a citation graph.
 * Neighbor lists are fixed at construction and keep provider order.
 */
@Value
public class NodeRecord {

    String id;
    PaperMetadata metadata;
    List<String> references;
    List<String> citedBy;
    int depth;
    FetchStatus forwardStatus;
    FetchStatus backwardStatus;
    boolean expanded;

    @Builder(toBuilder = true)
    private NodeRecord(String id,
                       PaperMetadata metadata,
                       List<String> references,
                       List<String> citedBy,
                       int depth,
                       FetchStatus forwardStatus,
                       FetchStatus backwardStatus,
                       boolean expanded) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Node id must not be blank");
        }
        if (depth < 0) {
            throw new IllegalArgumentException("Node depth must not be negative: " + depth);
        }
        this.id = id;
        this.metadata = metadata;
        this.references = references == null ? List.of() : List.copyOf(references);
        this.citedBy = citedBy == null ? List.of() : List.copyOf(citedBy);
        this.depth = depth;
        this.forwardStatus = forwardStatus == null ? FetchStatus.SKIPPED : forwardStatus;
        this.backwardStatus = backwardStatus == null ? FetchStatus.SKIPPED : backwardStatus;
        this.expanded = expanded;
    }

    public boolean hasNeighbors() {
        return !references.isEmpty() || !citedBy.isEmpty();
    }

    /**
     * True when either lookup failed, i.e. some fields are unknown or empty because of the provider.
     */
    public boolean isDegraded() {
        return forwardStatus.isFailure() || backwardStatus.isFailure();
    }
}
