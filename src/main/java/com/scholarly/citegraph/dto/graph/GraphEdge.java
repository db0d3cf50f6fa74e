package com.scholarly.citegraph.dto.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A citation in the graph visualization, always pointing from the citing to the cited paper.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GraphEdge {

    private String id;
    private String source;      // Citing paper
    private String target;      // Cited paper
    private String type;        // CITES
}
