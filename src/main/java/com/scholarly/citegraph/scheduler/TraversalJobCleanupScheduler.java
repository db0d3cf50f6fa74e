package com.scholarly.citegraph.scheduler;

import com.scholarly.citegraph.service.traversal.TraversalJobService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Evicts finished traversal jobs from the in-memory registry once their retention
 * ({@code citegraph.jobs.ttl-hours}) has passed. Their stored graphs stay on disk.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class TraversalJobCleanupScheduler {

    private final TraversalJobService traversalJobService;

    @Scheduled(fixedRateString = "${citegraph.jobs.cleanup-interval-ms:3600000}",
            initialDelayString = "${citegraph.jobs.cleanup-interval-ms:3600000}")
    public void evictExpiredJobs() {
        int evicted;
        try {
            evicted = traversalJobService.cleanupExpiredJobs();
        } catch (RuntimeException e) {
            log.error("Evicting expired traversal jobs failed: {}", e.getMessage(), e);
            return;
        }
        if (evicted > 0) {
            log.info("Evicted {} expired traversal jobs, {} still tracked",
                    evicted, traversalJobService.listJobs().size());
        }
    }
}
