package com.scholarly.citegraph.dto;

import com.scholarly.citegraph.service.traversal.TraversalDirection;
import com.scholarly.citegraph.service.traversal.TraversalSummary;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TraversalJobResponse {
    private String jobId;
    private String root;
    private int maxDepth;
    private TraversalDirection direction;
    private String resumeFrom;
    private String graphName;
    private String status;          // PENDING, RUNNING, COMPLETED, CANCELLED, FAILED
    private int nodesVisited;
    private int levelsCompleted;
    private String errorMessage;    // If FAILED
    private LocalDateTime createdAt;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private LocalDateTime expiresAt;
    private TraversalSummary summary;   // Only once finished
}
