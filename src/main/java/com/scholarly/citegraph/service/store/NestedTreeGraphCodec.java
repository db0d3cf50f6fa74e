package com.scholarly.citegraph.service.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.scholarly.citegraph.exception.CorruptGraphDataException;
import com.scholarly.citegraph.model.CitationGraph;
import com.scholarly.citegraph.model.FetchStatus;
import com.scholarly.citegraph.model.NodeRecord;

import java.util.*;

/**
 * Legacy reference-tree layout, {@code {root: {child: {grandchild: {}}}}}.
 * <p>
 * The tree repeats a work under every parent that references it. Loading collapses those
 * repetitions into one record per identifier, at the shallowest depth it appears, with the union of
 * its children as references. Exporting is the reverse view and is lossy: citers, statuses and
 * metadata are not represented.
 */
public class NestedTreeGraphCodec {

    public CitationGraph decode(JsonNode tree) {
        if (tree == null || !tree.isObject() || tree.size() != 1) {
            throw new CorruptGraphDataException("Reference tree must be an object with exactly one root key");
        }
        String root = tree.fieldNames().next();

        Map<String, Integer> depths = new LinkedHashMap<>();
        Map<String, LinkedHashSet<String>> children = new HashMap<>();
        Deque<Occurrence> queue = new ArrayDeque<>();
        queue.add(new Occurrence(root, tree.get(root), 0));

        while (!queue.isEmpty()) {
            Occurrence occurrence = queue.poll();
            if (occurrence.id().isBlank()) {
                throw new CorruptGraphDataException("Reference tree contains a blank identifier");
            }
            if (occurrence.subtree() == null || !occurrence.subtree().isObject()) {
                throw new CorruptGraphDataException("Subtree of " + occurrence.id() + " is not an object");
            }
            depths.putIfAbsent(occurrence.id(), occurrence.depth());
            LinkedHashSet<String> refs = children.computeIfAbsent(occurrence.id(), k -> new LinkedHashSet<>());
            Iterator<Map.Entry<String, JsonNode>> fields = occurrence.subtree().fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> child = fields.next();
                refs.add(child.getKey());
                queue.add(new Occurrence(child.getKey(), child.getValue(), occurrence.depth() + 1));
            }
        }

        List<NodeRecord> records = new ArrayList<>(depths.size());
        depths.forEach((id, depth) -> {
            List<String> refs = new ArrayList<>(children.get(id));
            records.add(NodeRecord.builder()
                    .id(id)
                    .depth(depth)
                    .references(refs)
                    .forwardStatus(FetchStatus.OK)
                    .backwardStatus(FetchStatus.SKIPPED)
                    .expanded(!refs.isEmpty())
                    .build());
        });
        return CitationGraph.of(root, records);
    }

    /**
     * Nested view of the graph: each record's references that were recorded one level deeper,
     * recursively from the root.
     */
    public Map<String, Object> export(CitationGraph graph) {
        Map<String, Object> tree = new LinkedHashMap<>();
        tree.put(graph.getRoot(), subtree(graph, graph.getRoot()));
        return tree;
    }

    private Map<String, Object> subtree(CitationGraph graph, String id) {
        Map<String, Object> subtree = new LinkedHashMap<>();
        NodeRecord record = graph.getNodes().get(id);
        if (record == null) {
            return subtree;
        }
        for (String reference : record.getReferences()) {
            NodeRecord child = graph.getNodes().get(reference);
            if (child != null && child.getDepth() == record.getDepth() + 1 && !subtree.containsKey(reference)) {
                subtree.put(reference, subtree(graph, reference));
            }
        }
        return subtree;
    }

    private record Occurrence(String id, JsonNode subtree, int depth) {
    }
}
