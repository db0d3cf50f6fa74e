package com.scholarly.citegraph.model;

import com.scholarly.citegraph.service.traversal.CancellationToken;
import com.scholarly.citegraph.service.traversal.TraversalDirection;
import com.scholarly.citegraph.service.traversal.TraversalSummary;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.LocalDateTime;

/**
 * State of an asynchronous traversal. The runner thread updates progress fields while
 * request threads read them.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TraversalJob {

    private String jobId;
    private String root;
    private int maxDepth;
    private TraversalDirection direction;
    private String resumeFrom;      // stored graph to resume from, optional
    private String graphName;       // name the result and checkpoints are stored under

    private volatile String status; // PENDING, RUNNING, COMPLETED, CANCELLED, FAILED
    private volatile int nodesVisited;
    private volatile int levelsCompleted;
    private volatile TraversalSummary summary;
    private volatile String errorMessage;

    private LocalDateTime createdAt;
    private volatile LocalDateTime startedAt;
    private volatile LocalDateTime completedAt;
    private volatile LocalDateTime expiresAt;

    @ToString.Exclude
    @Builder.Default
    private CancellationToken cancellationToken = new CancellationToken();

    public boolean isFinished() {
        return Status.COMPLETED.equals(status) || Status.CANCELLED.equals(status) || Status.FAILED.equals(status);
    }

    public static class Status {
        public static final String PENDING = "PENDING";
        public static final String RUNNING = "RUNNING";
        public static final String COMPLETED = "COMPLETED";
        public static final String CANCELLED = "CANCELLED";
        public static final String FAILED = "FAILED";
    }
}
