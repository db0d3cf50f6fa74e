package com.scholarly.citegraph.model;

import lombok.EqualsAndHashCode;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Flat, deduplicated citation graph: the root identifier plus one {@link NodeRecord} per visited identifier.
 * Iteration order is the order in which records were added.
 */
@EqualsAndHashCode
public final class CitationGraph {

    private final String root;
    private final Map<String, NodeRecord> nodes;

    public CitationGraph(String root, Map<String, NodeRecord> nodes) {
        this.root = root;
        this.nodes = Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
    }

    public static CitationGraph of(String root, Collection<NodeRecord> records) {
        Map<String, NodeRecord> byId = new LinkedHashMap<>();
        for (NodeRecord record : records) {
            if (byId.putIfAbsent(record.getId(), record) != null) {
                throw new IllegalArgumentException("Duplicate record for identifier: " + record.getId());
            }
        }
        return new CitationGraph(root, byId);
    }

    public static CitationGraph empty(String root) {
        return new CitationGraph(root, Map.of());
    }

    public String getRoot() {
        return root;
    }

    public Map<String, NodeRecord> getNodes() {
        return nodes;
    }

    public Optional<NodeRecord> find(String id) {
        return Optional.ofNullable(nodes.get(id));
    }

    public boolean contains(String id) {
        return nodes.containsKey(id);
    }

    public int size() {
        return nodes.size();
    }

    public int maxDepth() {
        return nodes.values().stream().mapToInt(NodeRecord::getDepth).max().orElse(0);
    }

    @Override
    public String toString() {
        return "CitationGraph{root=" + root + ", nodes=" + nodes.size() + "}";
    }
}
