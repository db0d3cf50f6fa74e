package com.scholarly.citegraph.service.traversal;

import com.scholarly.citegraph.dto.TraversalJobResponse;
import com.scholarly.citegraph.dto.TraversalRequestDto;
import com.scholarly.citegraph.exception.GraphNotFoundException;
import com.scholarly.citegraph.exception.InvalidTraversalRequestException;
import com.scholarly.citegraph.exception.TraversalJobNotFoundException;
import com.scholarly.citegraph.model.TraversalJob;
import com.scholarly.citegraph.repository.GraphFileRepository;
import com.scholarly.citegraph.repository.TraversalJobRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Orchestrates asynchronous traversals.
 *
 * Flow:
 * 1. Validate the request and register a PENDING job
 * 2. Hand the job to {@link TraversalJobRunner} on the job executor
 * 3. The runner checkpoints per depth and records the outcome on the job
 * 4. Finished jobs are dropped from the registry once they expire
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TraversalJobService {

    private final TraversalJobRegistry jobRegistry;
    private final TraversalJobRunner jobRunner;
    private final GraphFileRepository graphFileRepository;

    @Value("${citegraph.jobs.ttl-hours:24}")
    private int ttlHours;

    @Value("${citegraph.traversal.default-depth:2}")
    private int defaultDepth;

    /**
     * Registers a job and starts it. Returns immediately with PENDING status.
     */
    public TraversalJobResponse startJob(TraversalRequestDto request) {
        if (request.getRoot() == null || request.getRoot().isBlank()) {
            throw new InvalidTraversalRequestException("Root identifier must not be blank");
        }
        int maxDepth = request.getMaxDepth() != null ? request.getMaxDepth() : defaultDepth;
        if (maxDepth < 0) {
            throw new InvalidTraversalRequestException("maxDepth must be a non-negative integer");
        }
        String resumeFrom = request.getResumeFrom() == null || request.getResumeFrom().isBlank()
                ? null
                : request.getResumeFrom();
        if (resumeFrom != null && !graphFileRepository.exists(resumeFrom)) {
            throw new GraphNotFoundException("Graph not found: " + resumeFrom);
        }

        String graphName = request.getLabel() == null || request.getLabel().isBlank()
                ? GraphFileRepository.nameFor(request.getRoot())
                : GraphFileRepository.sanitize(request.getLabel());

        TraversalJob job = TraversalJob.builder()
                .jobId(UUID.randomUUID().toString().substring(0, 8))
                .root(request.getRoot())
                .maxDepth(maxDepth)
                .direction(request.getDirection() != null ? request.getDirection() : TraversalDirection.BOTH)
                .resumeFrom(resumeFrom)
                .graphName(graphName)
                .status(TraversalJob.Status.PENDING)
                .createdAt(LocalDateTime.now())
                .expiresAt(LocalDateTime.now().plusHours(ttlHours))
                .build();

        jobRegistry.save(job);
        log.info("Created traversal job {} for {} (depth {})", job.getJobId(), job.getRoot(), job.getMaxDepth());

        jobRunner.run(job);

        return toResponse(job);
    }

    public TraversalJobResponse getJob(String jobId) {
        return toResponse(findJob(jobId));
    }

    public List<TraversalJobResponse> listJobs() {
        return jobRegistry.findAllOrderByCreatedAtDesc().stream()
                .map(this::toResponse)
                .toList();
    }

    /**
     * Requests cancellation. The runner stops at the next identifier boundary and stores what it has.
     * Cancelling a finished job has no effect.
     */
    public TraversalJobResponse cancelJob(String jobId) {
        TraversalJob job = findJob(jobId);
        if (!job.isFinished()) {
            job.getCancellationToken().cancel();
            log.info("Cancellation requested for traversal job {}", jobId);
        }
        return toResponse(job);
    }

    /**
     * Drops finished jobs past their expiry time. Stored graphs are kept.
     */
    public int cleanupExpiredJobs() {
        List<TraversalJob> expired = jobRegistry.findFinishedExpiringBefore(LocalDateTime.now());
        for (TraversalJob job : expired) {
            jobRegistry.delete(job);
            log.debug("Removed expired traversal job {}", job.getJobId());
        }
        if (!expired.isEmpty()) {
            log.info("Cleaned up {} expired traversal jobs", expired.size());
        }
        return expired.size();
    }

    private TraversalJob findJob(String jobId) {
        return jobRegistry.findByJobId(jobId)
                .orElseThrow(() -> new TraversalJobNotFoundException("Traversal job not found: " + jobId));
    }

    // ========================= RESPONSE MAPPING =========================

    private TraversalJobResponse toResponse(TraversalJob job) {
        return TraversalJobResponse.builder()
                .jobId(job.getJobId())
                .root(job.getRoot())
                .maxDepth(job.getMaxDepth())
                .direction(job.getDirection())
                .resumeFrom(job.getResumeFrom())
                .graphName(job.getGraphName())
                .status(job.getStatus())
                .nodesVisited(job.getNodesVisited())
                .levelsCompleted(job.getLevelsCompleted())
                .errorMessage(job.getErrorMessage())
                .createdAt(job.getCreatedAt())
                .startedAt(job.getStartedAt())
                .completedAt(job.getCompletedAt())
                .expiresAt(job.getExpiresAt())
                .summary(job.getSummary())
                .build();
    }
}
