package com.scholarly.citegraph.service.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholarly.citegraph.exception.CorruptGraphDataException;
import com.scholarly.citegraph.model.CitationGraph;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.util.Map;

/**
 * Serializes citation graphs to JSON bytes and back.
 * Graphs are always written in the flat layout; loading accepts the flat layout and the legacy
 * nested reference tree. A load either returns a complete graph or throws.
 */
@Service
@Slf4j
public class GraphStore {

    private final ObjectMapper objectMapper;
    private final FlatGraphCodec flatCodec;
    private final NestedTreeGraphCodec nestedCodec;

    @Autowired
    public GraphStore(ObjectMapper objectMapper) {
        this(objectMapper, Clock.systemUTC());
    }

    GraphStore(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.flatCodec = new FlatGraphCodec(objectMapper, clock);
        this.nestedCodec = new NestedTreeGraphCodec();
    }

    public byte[] save(CitationGraph graph) {
        byte[] bytes = flatCodec.encode(graph);
        log.debug("Serialized graph rooted at {} ({} nodes, {} bytes)", graph.getRoot(), graph.size(), bytes.length);
        return bytes;
    }

    public CitationGraph load(byte[] bytes) {
        JsonNode tree = parse(bytes);
        return load(tree, detectLayout(tree));
    }

    public CitationGraph load(byte[] bytes, GraphLayout layout) {
        return load(parse(bytes), layout);
    }

    /**
     * Nested reference-tree view of a graph, for export to tools that expect the legacy layout.
     */
    public Map<String, Object> exportNestedTree(CitationGraph graph) {
        return nestedCodec.export(graph);
    }

    /**
     * A document with a textual {@code root} and a {@code nodes} member is flat; any other object is
     * treated as a nested tree and validated as such.
     */
    GraphLayout detectLayout(JsonNode tree) {
        if (tree.isObject() && tree.path("root").isTextual() && tree.has("nodes")) {
            return GraphLayout.FLAT;
        }
        return GraphLayout.NESTED_TREE;
    }

    private CitationGraph load(JsonNode tree, GraphLayout layout) {
        CitationGraph graph = layout == GraphLayout.FLAT ? flatCodec.decode(tree) : nestedCodec.decode(tree);
        log.debug("Loaded {} graph rooted at {} ({} nodes)", layout, graph.getRoot(), graph.size());
        return graph;
    }

    private JsonNode parse(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            throw new CorruptGraphDataException("Graph data is empty");
        }
        try {
            JsonNode tree = objectMapper.readTree(bytes);
            if (tree == null || tree.isMissingNode() || !tree.isObject()) {
                throw new CorruptGraphDataException("Graph data is not a JSON object");
            }
            return tree;
        } catch (IOException e) {
            throw new CorruptGraphDataException("Graph data is not valid JSON: " + e.getMessage(), e);
        }
    }
}
