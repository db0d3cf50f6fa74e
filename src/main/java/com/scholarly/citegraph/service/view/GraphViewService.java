package com.scholarly.citegraph.service.view;

import com.scholarly.citegraph.dto.graph.*;
import com.scholarly.citegraph.model.CitationGraph;
import com.scholarly.citegraph.model.NodeRecord;
import com.scholarly.citegraph.model.PaperMetadata;
import com.scholarly.citegraph.service.journal.JournalCatalog;
import com.scholarly.citegraph.service.store.GraphStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Read-only projections of a citation graph for display and reporting.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class GraphViewService {

    static final String PAPER = "Paper";
    static final String CITES = "CITES";

    private final JournalCatalog journalCatalog;
    private final GraphStore graphStore;

    /**
     * Nodes and CITES edges of the graph. An edge is emitted once per citing/cited pair, whether it
     * was discovered as a reference of the citing paper or as a citer of the cited one, and only
     * when both endpoints are recorded and shown.
     *
     * @param includeDegraded whether papers whose lookups failed are shown
     */
    public GraphVisualizationResponse toVisualization(CitationGraph graph, boolean includeDegraded) {
        Map<String, NodeRecord> shown = new LinkedHashMap<>();
        for (NodeRecord record : graph.getNodes().values()) {
            if (includeDegraded || !record.isDegraded() || record.getId().equals(graph.getRoot())) {
                shown.put(record.getId(), record);
            }
        }

        Map<String, Set<String>> citers = knownCiters(graph);
        List<GraphNode> nodes = new ArrayList<>(shown.size());
        Map<Integer, Integer> countByDepth = new TreeMap<>();
        int degraded = 0;
        for (NodeRecord record : shown.values()) {
            nodes.add(toNode(record, citers.getOrDefault(record.getId(), Set.of()).size()));
            countByDepth.merge(record.getDepth(), 1, Integer::sum);
            if (record.isDegraded()) {
                degraded++;
            }
        }

        Set<String> seenPairs = new HashSet<>();
        List<GraphEdge> edges = new ArrayList<>();
        for (NodeRecord record : shown.values()) {
            for (String cited : record.getReferences()) {
                addEdge(edges, seenPairs, shown, record.getId(), cited);
            }
            for (String citing : record.getCitedBy()) {
                addEdge(edges, seenPairs, shown, citing, record.getId());
            }
        }

        GraphMetadata metadata = GraphMetadata.builder()
                .root(graph.getRoot())
                .nodeCount(nodes.size())
                .edgeCount(edges.size())
                .degradedNodeCount(degraded)
                .nodeCountByType(nodes.isEmpty() ? Map.of() : Map.of(PAPER, nodes.size()))
                .edgeCountByType(edges.isEmpty() ? Map.of() : Map.of(CITES, edges.size()))
                .nodeCountByDepth(countByDepth)
                .depth(graph.maxDepth())
                .build();

        log.debug("Built visualization of {}: {} nodes, {} edges", graph.getRoot(), nodes.size(), edges.size());
        return GraphVisualizationResponse.builder()
                .nodes(nodes)
                .edges(edges)
                .metadata(metadata)
                .build();
    }

    /**
     * Journals of the graph's leaf papers (records with no neighbors), most frequent first and
     * ties by name. The journal comes from the paper's metadata, then from the DOI prefix tables,
     * else {@value JournalCatalog#UNKNOWN_JOURNAL}.
     */
    public List<JournalPopularity> popularJournals(CitationGraph graph) {
        Map<String, Integer> counts = new HashMap<>();
        for (NodeRecord record : graph.getNodes().values()) {
            if (!record.hasNeighbors()) {
                counts.merge(journalOf(record), 1, Integer::sum);
            }
        }
        return counts.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed()
                        .thenComparing(Map.Entry.comparingByKey()))
                .map(entry -> new JournalPopularity(entry.getKey(), entry.getValue()))
                .toList();
    }

    public Map<String, Object> toNestedTree(CitationGraph graph) {
        return graphStore.exportNestedTree(graph);
    }

    String journalOf(NodeRecord record) {
        PaperMetadata metadata = record.getMetadata();
        if (metadata != null && metadata.getJournal() != null && !metadata.getJournal().isBlank()) {
            return metadata.getJournal();
        }
        return journalCatalog.journalNameForIdentifier(record.getId()).orElse(JournalCatalog.UNKNOWN_JOURNAL);
    }

    /**
     * Distinct citing works per identifier, from both the citer lists and the reference lists of
     * the whole graph, shown or not.
     */
    static Map<String, Set<String>> knownCiters(CitationGraph graph) {
        Map<String, Set<String>> citers = new HashMap<>();
        for (NodeRecord record : graph.getNodes().values()) {
            for (String citing : record.getCitedBy()) {
                citers.computeIfAbsent(record.getId(), k -> new HashSet<>()).add(citing);
            }
            for (String cited : record.getReferences()) {
                citers.computeIfAbsent(cited, k -> new HashSet<>()).add(record.getId());
            }
        }
        return citers;
    }

    private GraphNode toNode(NodeRecord record, int citedByCount) {
        PaperMetadata metadata = record.getMetadata();
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("doi", record.getId());
        properties.put("depth", record.getDepth());
        properties.put("citedByCount", citedByCount);
        properties.put("degraded", record.isDegraded());
        properties.put("expanded", record.isExpanded());
        if (metadata != null) {
            properties.put("authors", metadata.getAuthors());
            properties.put("year", metadata.getYear());
        }
        String title = metadata != null ? metadata.getTitle() : null;
        boolean untitled = title == null || title.isBlank() || PaperMetadata.UNKNOWN.equals(title);
        return GraphNode.builder()
                .id(record.getId())
                .label(untitled ? record.getId() : title)
                .type(PAPER)
                .group(journalOf(record))
                .properties(properties)
                .build();
    }

    private static void addEdge(List<GraphEdge> edges, Set<String> seenPairs, Map<String, NodeRecord> shown,
                                String citing, String cited) {
        if (!shown.containsKey(citing) || !shown.containsKey(cited)) {
            return;
        }
        String id = citing + "->" + cited;
        if (seenPairs.add(id)) {
            edges.add(GraphEdge.builder()
                    .id(id)
                    .source(citing)
                    .target(cited)
                    .type(CITES)
                    .build());
        }
    }
}
