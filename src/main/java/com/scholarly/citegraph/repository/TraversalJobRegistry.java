package com.scholarly.citegraph.repository;

import com.scholarly.citegraph.model.TraversalJob;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory registry of traversal jobs. Jobs do not survive a restart; their graphs do.
 */
@Repository
public class TraversalJobRegistry {

    private final Map<String, TraversalJob> jobs = new ConcurrentHashMap<>();

    public TraversalJob save(TraversalJob job) {
        jobs.put(job.getJobId(), job);
        return job;
    }

    public Optional<TraversalJob> findByJobId(String jobId) {
        return Optional.ofNullable(jobs.get(jobId));
    }

    public List<TraversalJob> findAllOrderByCreatedAtDesc() {
        return jobs.values().stream()
                .sorted(Comparator.comparing(TraversalJob::getCreatedAt).reversed())
                .toList();
    }

    public List<TraversalJob> findFinishedExpiringBefore(LocalDateTime time) {
        return jobs.values().stream()
                .filter(TraversalJob::isFinished)
                .filter(job -> job.getExpiresAt() != null && job.getExpiresAt().isBefore(time))
                .toList();
    }

    public void delete(TraversalJob job) {
        jobs.remove(job.getJobId());
    }
}
