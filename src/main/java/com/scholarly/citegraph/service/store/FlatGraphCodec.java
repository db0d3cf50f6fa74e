package com.scholarly.citegraph.service.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholarly.citegraph.dto.StoredGraphDocument;
import com.scholarly.citegraph.dto.StoredNode;
import com.scholarly.citegraph.exception.CorruptGraphDataException;
import com.scholarly.citegraph.exception.GraphStorageException;
import com.scholarly.citegraph.model.CitationGraph;
import com.scholarly.citegraph.model.NodeRecord;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads and writes the flat graph layout.
 */
class FlatGraphCodec {

    private final ObjectMapper objectMapper;
    private final Clock clock;

    FlatGraphCodec(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    byte[] encode(CitationGraph graph) {
        LinkedHashMap<String, StoredNode> nodes = new LinkedHashMap<>();
        for (NodeRecord record : graph.getNodes().values()) {
            nodes.put(record.getId(), StoredNode.builder()
                    .id(record.getId())
                    .depth(record.getDepth())
                    .metadata(record.getMetadata())
                    .references(record.getReferences())
                    .citedBy(record.getCitedBy())
                    .forwardStatus(record.getForwardStatus())
                    .backwardStatus(record.getBackwardStatus())
                    .expanded(record.isExpanded())
                    .build());
        }
        StoredGraphDocument document = StoredGraphDocument.builder()
                .root(graph.getRoot())
                .savedAt(Instant.now(clock).toString())
                .nodes(nodes)
                .build();
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(document);
        } catch (JsonProcessingException e) {
            throw new GraphStorageException("Failed to serialize graph rooted at " + graph.getRoot(), e);
        }
    }

    CitationGraph decode(JsonNode tree) {
        StoredGraphDocument document;
        try {
            document = objectMapper.treeToValue(tree, StoredGraphDocument.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new CorruptGraphDataException("Graph document does not match the flat layout: " + e.getMessage(), e);
        }

        String root = document.getRoot();
        if (root == null || root.isBlank()) {
            throw new CorruptGraphDataException("Graph document has no root identifier");
        }
        if (document.getNodes() == null) {
            throw new CorruptGraphDataException("Graph document has no nodes object");
        }

        List<NodeRecord> records = new ArrayList<>(document.getNodes().size());
        for (Map.Entry<String, StoredNode> entry : document.getNodes().entrySet()) {
            records.add(toRecord(entry.getKey(), entry.getValue()));
        }
        if (!records.isEmpty() && !document.getNodes().containsKey(root)) {
            throw new CorruptGraphDataException("Root " + root + " is not among the stored nodes");
        }
        return CitationGraph.of(root, records);
    }

    private NodeRecord toRecord(String key, StoredNode node) {
        if (node == null) {
            throw new CorruptGraphDataException("Node " + key + " is null");
        }
        if (node.getId() != null && !node.getId().equals(key)) {
            throw new CorruptGraphDataException("Node key " + key + " does not match its id " + node.getId());
        }
        if (node.getDepth() == null || node.getDepth() < 0) {
            throw new CorruptGraphDataException("Node " + key + " has a missing or negative depth");
        }
        checkIdentifiers(key, "references", node.getReferences());
        checkIdentifiers(key, "citedBy", node.getCitedBy());
        try {
            return NodeRecord.builder()
                    .id(key)
                    .depth(node.getDepth())
                    .metadata(node.getMetadata())
                    .references(node.getReferences())
                    .citedBy(node.getCitedBy())
                    .forwardStatus(node.getForwardStatus())
                    .backwardStatus(node.getBackwardStatus())
                    .expanded(Boolean.TRUE.equals(node.getExpanded()))
                    .build();
        } catch (IllegalArgumentException e) {
            throw new CorruptGraphDataException("Node " + key + " is invalid: " + e.getMessage(), e);
        }
    }

    private static void checkIdentifiers(String key, String field, List<String> ids) {
        if (ids == null) {
            throw new CorruptGraphDataException("Node " + key + " has no " + field + " list");
        }
        for (String id : ids) {
            if (id == null || id.isBlank()) {
                throw new CorruptGraphDataException("Node " + key + " has a blank identifier in " + field);
            }
        }
    }
}
