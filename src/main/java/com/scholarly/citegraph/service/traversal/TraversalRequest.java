package com.scholarly.citegraph.service.traversal;

import com.scholarly.citegraph.model.CitationGraph;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TraversalRequest {
    private String root;
    private int maxDepth;
    private CitationGraph seed;     // optional resume point

    @Builder.Default
    private TraversalDirection direction = TraversalDirection.BOTH;
}
