package com.scholarly.citegraph.dto.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Summary information about a visualized graph.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GraphMetadata {

    private String root;
    private int nodeCount;
    private int edgeCount;
    private int degradedNodeCount;
    private Map<String, Integer> nodeCountByType;
    private Map<String, Integer> edgeCountByType;
    private Map<Integer, Integer> nodeCountByDepth;
    private int depth;                  // Deepest recorded depth
}
