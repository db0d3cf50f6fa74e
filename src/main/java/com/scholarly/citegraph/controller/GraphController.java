package com.scholarly.citegraph.controller;

import com.scholarly.citegraph.dto.graph.GraphVisualizationResponse;
import com.scholarly.citegraph.dto.graph.JournalPopularity;
import com.scholarly.citegraph.model.CitationGraph;
import com.scholarly.citegraph.repository.StoredGraphFile;
import com.scholarly.citegraph.service.store.GraphArchiveService;
import com.scholarly.citegraph.service.store.GraphLayout;
import com.scholarly.citegraph.service.view.GraphViewService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST controller for stored citation graphs and their views.
 */
@RestController
@RequestMapping("/api/graphs")
@RequiredArgsConstructor
@Slf4j
public class GraphController {

    private final GraphArchiveService graphArchiveService;
    private final GraphViewService graphViewService;

    @GetMapping
    public ResponseEntity<List<StoredGraphFile>> listGraphs() {
        return ResponseEntity.ok(graphArchiveService.list());
    }

    @GetMapping("/{name}")
    public ResponseEntity<CitationGraph> getGraph(@PathVariable String name) {
        log.info("Getting graph: {}", name);
        return ResponseEntity.ok(graphArchiveService.load(name));
    }

    /**
     * Legacy nested reference-tree export.
     */
    @GetMapping("/{name}/tree")
    public ResponseEntity<Map<String, Object>> getTree(@PathVariable String name) {
        log.info("Getting reference tree for graph: {}", name);
        return ResponseEntity.ok(graphViewService.toNestedTree(graphArchiveService.load(name)));
    }

    /**
     * Nodes and edges for graph rendering libraries.
     */
    @GetMapping("/{name}/visualization")
    public ResponseEntity<GraphVisualizationResponse> getVisualization(
            @PathVariable String name,
            @RequestParam(defaultValue = "true") boolean includeDegraded) {
        log.info("Getting visualization for graph: {} (includeDegraded={})", name, includeDegraded);
        CitationGraph graph = graphArchiveService.load(name);
        return ResponseEntity.ok(graphViewService.toVisualization(graph, includeDegraded));
    }

    @GetMapping("/{name}/journals/popular")
    public ResponseEntity<List<JournalPopularity>> getPopularJournals(@PathVariable String name) {
        log.info("Getting popular journals for graph: {}", name);
        return ResponseEntity.ok(graphViewService.popularJournals(graphArchiveService.load(name)));
    }

    /**
     * Import a graph document, flat or nested. The layout is detected unless given.
     */
    @PostMapping("/import")
    public ResponseEntity<Map<String, String>> importGraph(
            @RequestBody byte[] data,
            @RequestParam(required = false) GraphLayout layout,
            @RequestParam(required = false) String label) {
        log.info("Importing graph ({} bytes, layout {})", data.length, layout != null ? layout : "auto");
        String name = graphArchiveService.importGraph(data, layout, label);
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("name", name));
    }

    @DeleteMapping("/{name}")
    public ResponseEntity<Void> deleteGraph(@PathVariable String name) {
        log.info("Deleting graph: {}", name);
        graphArchiveService.delete(name);
        return ResponseEntity.noContent().build();
    }
}
