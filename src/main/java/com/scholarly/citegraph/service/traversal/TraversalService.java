package com.scholarly.citegraph.service.traversal;

import com.scholarly.citegraph.dto.TraversalRequestDto;
import com.scholarly.citegraph.dto.TraversalRunResponse;
import com.scholarly.citegraph.model.CitationGraph;
import com.scholarly.citegraph.service.store.GraphArchiveService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Runs a traversal on the calling thread, optionally resuming from and saving to the graph archive.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TraversalService {

    private final CitationTraversalEngine traversalEngine;
    private final GraphArchiveService graphArchiveService;

    @Value("${citegraph.traversal.default-depth:2}")
    private int defaultDepth;

    public TraversalRunResponse run(TraversalRequestDto request) {
        CitationGraph seed = request.getResumeFrom() == null || request.getResumeFrom().isBlank()
                ? null
                : graphArchiveService.load(request.getResumeFrom());

        int maxDepth = request.getMaxDepth() != null ? request.getMaxDepth() : defaultDepth;
        TraversalRequest traversal = TraversalRequest.builder()
                .root(request.getRoot())
                .maxDepth(maxDepth)
                .seed(seed)
                .direction(request.getDirection() != null ? request.getDirection() : TraversalDirection.BOTH)
                .build();
        TraversalResult result = traversalEngine.expand(traversal, TraversalListener.NONE, new CancellationToken());

        String graphName = null;
        if (request.isSave()) {
            graphName = graphArchiveService.save(result.getGraph(), request.getLabel());
        }
        log.info("Traversal of {} finished: {} nodes, stop reason {}",
                request.getRoot(), result.getGraph().size(), result.getSummary().getStopReason());

        return TraversalRunResponse.builder()
                .graphName(graphName)
                .summary(result.getSummary())
                .graph(result.getGraph())
                .build();
    }
}
