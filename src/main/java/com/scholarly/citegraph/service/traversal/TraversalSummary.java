package com.scholarly.citegraph.service.traversal;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Counters reported at the end of a traversal run.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TraversalSummary {
    private String root;
    private int maxDepth;
    private int nodesVisited;       // records in the resulting graph
    private int nodesFetched;       // records created by this run
    private int nodesSeeded;        // records carried over from the seed
    private int forwardFailures;
    private int backwardFailures;
    private int notFound;
    private int degradedNodes;
    private int levelsCompleted;
    private StopReason stopReason;
    private long elapsedMillis;
}
