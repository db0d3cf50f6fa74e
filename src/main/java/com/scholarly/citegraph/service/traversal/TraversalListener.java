package com.scholarly.citegraph.service.traversal;

import com.scholarly.citegraph.model.CitationGraph;
import com.scholarly.citegraph.model.NodeRecord;

/**
 * Progress callbacks, invoked on the thread that called {@code expand}.
 */
public interface TraversalListener {

    TraversalListener NONE = new TraversalListener() {
    };

    default void onNodeRecorded(NodeRecord record, int visitedCount) {
    }

    /**
     * Called after every identifier of one depth has been recorded (or dropped on cancellation).
     * The snapshot is consistent and can be persisted as a resume point.
     */
    default void onLevelCompleted(int depth, CitationGraph snapshot) {
    }
}
