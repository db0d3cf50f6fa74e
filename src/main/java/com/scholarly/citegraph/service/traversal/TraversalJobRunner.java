package com.scholarly.citegraph.service.traversal;

import com.scholarly.citegraph.exception.GraphStorageException;
import com.scholarly.citegraph.model.CitationGraph;
import com.scholarly.citegraph.model.NodeRecord;
import com.scholarly.citegraph.model.TraversalJob;
import com.scholarly.citegraph.service.store.GraphArchiveService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;

/**
 * Executes traversal jobs on the job executor.
 * The graph is checkpointed under the job's graph name after every completed depth, so a
 * cancelled or failed job can be resumed from its last stored level.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class TraversalJobRunner {

    private final CitationTraversalEngine traversalEngine;
    private final GraphArchiveService graphArchiveService;

    @Value("${citegraph.jobs.ttl-hours:24}")
    private int ttlHours;

    @Async("traversalJobExecutor")
    public void run(TraversalJob job) {
        job.setStatus(TraversalJob.Status.RUNNING);
        job.setStartedAt(LocalDateTime.now());
        log.info("Starting traversal job {} for {} (depth {})", job.getJobId(), job.getRoot(), job.getMaxDepth());

        try {
            CitationGraph seed = job.getResumeFrom() == null ? null : graphArchiveService.load(job.getResumeFrom());
            TraversalRequest request = TraversalRequest.builder()
                    .root(job.getRoot())
                    .maxDepth(job.getMaxDepth())
                    .seed(seed)
                    .direction(job.getDirection() != null ? job.getDirection() : TraversalDirection.BOTH)
                    .build();

            TraversalResult result = traversalEngine.expand(request, new JobProgress(job), job.getCancellationToken());
            graphArchiveService.save(result.getGraph(), job.getGraphName());

            StopReason stopReason = result.getSummary().getStopReason();
            boolean cancelled = stopReason == StopReason.CANCELLED || stopReason == StopReason.INTERRUPTED;
            job.setSummary(result.getSummary());
            job.setNodesVisited(result.getGraph().size());
            job.setLevelsCompleted(result.getSummary().getLevelsCompleted());
            job.setStatus(cancelled ? TraversalJob.Status.CANCELLED : TraversalJob.Status.COMPLETED);
            log.info("Traversal job {} {}: {} nodes stored as {}",
                    job.getJobId(), job.getStatus().toLowerCase(), result.getGraph().size(), job.getGraphName());
        } catch (Exception e) {
            log.error("Traversal job {} failed: {}", job.getJobId(), e.getMessage(), e);
            job.setStatus(TraversalJob.Status.FAILED);
            job.setErrorMessage(e.getMessage());
        } finally {
            job.setCompletedAt(LocalDateTime.now());
            job.setExpiresAt(LocalDateTime.now().plusHours(ttlHours));
        }
    }

    private class JobProgress implements TraversalListener {

        private final TraversalJob job;

        JobProgress(TraversalJob job) {
            this.job = job;
        }

        @Override
        public void onNodeRecorded(NodeRecord record, int visitedCount) {
            job.setNodesVisited(visitedCount);
        }

        @Override
        public void onLevelCompleted(int depth, CitationGraph snapshot) {
            if (!job.getCancellationToken().isCancelled()) {
                job.setLevelsCompleted(job.getLevelsCompleted() + 1);
            }
            try {
                graphArchiveService.save(snapshot, job.getGraphName());
                log.debug("Checkpointed job {} at depth {} ({} nodes)", job.getJobId(), depth, snapshot.size());
            } catch (GraphStorageException e) {
                log.warn("Checkpoint of job {} at depth {} failed: {}", job.getJobId(), depth, e.getMessage());
            }
        }
    }
}
