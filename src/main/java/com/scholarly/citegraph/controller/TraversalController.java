package com.scholarly.citegraph.controller;

import com.scholarly.citegraph.dto.TraversalJobResponse;
import com.scholarly.citegraph.dto.TraversalRequestDto;
import com.scholarly.citegraph.dto.TraversalRunResponse;
import com.scholarly.citegraph.service.traversal.TraversalJobService;
import com.scholarly.citegraph.service.traversal.TraversalService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST controller for citation traversals, synchronous or as background jobs.
 */
@RestController
@RequestMapping("/api/traversals")
@RequiredArgsConstructor
@Slf4j
public class TraversalController {

    private final TraversalService traversalService;
    private final TraversalJobService traversalJobService;

    /**
     * Expand a root identifier and return the graph in the response.
     */
    @PostMapping
    public ResponseEntity<TraversalRunResponse> runTraversal(@Valid @RequestBody TraversalRequestDto request) {
        log.info("Running traversal for root: {}, depth: {}", request.getRoot(), request.getMaxDepth());
        return ResponseEntity.ok(traversalService.run(request));
    }

    /**
     * Start a traversal job. Returns immediately with PENDING status.
     */
    @PostMapping("/jobs")
    public ResponseEntity<TraversalJobResponse> startJob(@Valid @RequestBody TraversalRequestDto request) {
        log.info("Starting traversal job for root: {}, depth: {}", request.getRoot(), request.getMaxDepth());
        TraversalJobResponse response = traversalJobService.startJob(request);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(response);
    }

    @GetMapping("/jobs")
    public ResponseEntity<List<TraversalJobResponse>> listJobs() {
        return ResponseEntity.ok(traversalJobService.listJobs());
    }

    @GetMapping("/jobs/{jobId}")
    public ResponseEntity<TraversalJobResponse> getJob(@PathVariable String jobId) {
        return ResponseEntity.ok(traversalJobService.getJob(jobId));
    }

    @PostMapping("/jobs/{jobId}/cancel")
    public ResponseEntity<TraversalJobResponse> cancelJob(@PathVariable String jobId) {
        log.info("Cancelling traversal job: {}", jobId);
        return ResponseEntity.ok(traversalJobService.cancelJob(jobId));
    }
}
