package com.scholarly.citegraph.service.traversal;

import com.scholarly.citegraph.model.CitationGraph;
import com.scholarly.citegraph.model.NodeRecord;
import com.scholarly.citegraph.model.TraversalJob;
import com.scholarly.citegraph.service.store.GraphArchiveService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TraversalJobRunnerTest {

    @Mock
    private CitationTraversalEngine traversalEngine;

    @Mock
    private GraphArchiveService graphArchiveService;

    private TraversalJobRunner runner;

    @BeforeEach
    void setUp() {
        runner = new TraversalJobRunner(traversalEngine, graphArchiveService);
        ReflectionTestUtils.setField(runner, "ttlHours", 24);
    }

    private static TraversalJob job() {
        return TraversalJob.builder()
                .jobId("j1")
                .root("A")
                .maxDepth(1)
                .graphName("citation_graph_A")
                .status(TraversalJob.Status.PENDING)
                .createdAt(LocalDateTime.now())
                .build();
    }

    private static TraversalResult result(StopReason stopReason) {
        CitationGraph graph = CitationGraph.of("A", List.of(NodeRecord.builder().id("A").depth(0).build()));
        TraversalSummary summary = TraversalSummary.builder()
                .root("A").maxDepth(1).nodesVisited(1).levelsCompleted(1).stopReason(stopReason).build();
        return new TraversalResult(graph, summary);
    }

    @Test
    void completedRunCheckpointsEachLevelAndStoresTheGraph() {
        TraversalJob job = job();
        TraversalResult result = result(StopReason.COMPLETED);
        when(traversalEngine.expand(any(TraversalRequest.class), any(TraversalListener.class), eq(job.getCancellationToken())))
                .thenAnswer(invocation -> {
                    TraversalListener listener = invocation.getArgument(1);
                    listener.onNodeRecorded(result.getGraph().find("A").orElseThrow(), 1);
                    listener.onLevelCompleted(0, result.getGraph());
                    return result;
                });

        runner.run(job);

        verify(graphArchiveService, times(2)).save(result.getGraph(), "citation_graph_A");
        assertThat(job.getStatus()).isEqualTo(TraversalJob.Status.COMPLETED);
        assertThat(job.getNodesVisited()).isEqualTo(1);
        assertThat(job.getLevelsCompleted()).isEqualTo(1);
        assertThat(job.getSummary()).isSameAs(result.getSummary());
        assertThat(job.getCompletedAt()).isNotNull();
        assertThat(job.getExpiresAt()).isAfter(LocalDateTime.now().plusHours(23));
    }

    @Test
    void cancelledRunStoresPartialGraph() {
        TraversalJob job = job();
        TraversalResult result = result(StopReason.CANCELLED);
        when(traversalEngine.expand(any(TraversalRequest.class), any(TraversalListener.class), any(CancellationToken.class)))
                .thenReturn(result);

        runner.run(job);

        verify(graphArchiveService).save(result.getGraph(), "citation_graph_A");
        assertThat(job.getStatus()).isEqualTo(TraversalJob.Status.CANCELLED);
    }

    @Test
    void resumesFromStoredGraph() {
        TraversalJob job = job();
        job.setResumeFrom("citation_graph_A");
        CitationGraph seed = CitationGraph.empty("A");
        when(graphArchiveService.load("citation_graph_A")).thenReturn(seed);
        when(traversalEngine.expand(any(TraversalRequest.class), any(TraversalListener.class), any(CancellationToken.class)))
                .thenAnswer(invocation -> {
                    TraversalRequest request = invocation.getArgument(0);
                    assertThat(request.getSeed()).isSameAs(seed);
                    return result(StopReason.COMPLETED);
                });

        runner.run(job);

        assertThat(job.getStatus()).isEqualTo(TraversalJob.Status.COMPLETED);
    }

    @Test
    void failureMarksJobFailed() {
        TraversalJob job = job();
        when(traversalEngine.expand(any(TraversalRequest.class), any(TraversalListener.class), any(CancellationToken.class)))
                .thenThrow(new IllegalStateException("executor shut down"));

        runner.run(job);

        assertThat(job.getStatus()).isEqualTo(TraversalJob.Status.FAILED);
        assertThat(job.getErrorMessage()).isEqualTo("executor shut down");
        assertThat(job.getCompletedAt()).isNotNull();
    }
}
