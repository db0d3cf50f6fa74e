package com.scholarly.citegraph.dto;

import com.scholarly.citegraph.model.CitationGraph;
import com.scholarly.citegraph.service.traversal.TraversalSummary;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TraversalRunResponse {
    private String graphName;       // null when the graph was not stored
    private TraversalSummary summary;
    private CitationGraph graph;
}
