package com.scholarly.citegraph.dto.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * A paper in the graph visualization.
 * Compatible with D3.js, Cytoscape.js, and vis.js.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GraphNode {

    private String id;          // DOI
    private String label;       // Title, or the DOI when the title is unknown
    private String type;        // Paper
    private String group;       // Journal name, for clustering
    private Map<String, Object> properties;
}
