package com.scholarly.citegraph.service.traversal;

import com.scholarly.citegraph.model.CitationGraph;
import lombok.Value;

@Value
public class TraversalResult {
    CitationGraph graph;
    TraversalSummary summary;
}
