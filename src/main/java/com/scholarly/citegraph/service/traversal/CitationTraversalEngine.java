package com.scholarly.citegraph.service.traversal;

import com.scholarly.citegraph.exception.InvalidTraversalRequestException;
import com.scholarly.citegraph.model.CitationGraph;
import com.scholarly.citegraph.model.FetchStatus;
import com.scholarly.citegraph.model.NodeRecord;
import com.scholarly.citegraph.service.provider.BackwardLookup;
import com.scholarly.citegraph.service.provider.ForwardLookup;
import com.scholarly.citegraph.service.provider.MetadataProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Explores the citation neighborhood of a root identifier, following references and citers
 * out to a bounded depth.
 *
 * <p>The frontier is processed one depth at a time. All identifiers of depth {@code d} are fetched
 * concurrently on the traversal executor; each worker claims the neighbors it discovers in a shared
 * visited set (atomic test-and-set) and the claimed identifiers form depth {@code d + 1}. Finishing a
 * depth before starting the next one makes every recorded depth the shortest hop distance from the
 * root, in either edge direction.</p>
 *
 * <p>{@link TraversalDirection} restricts which neighbor lists are recorded and followed; the
 * lookup for the unused side is not made and its status is SKIPPED.</p>
 *
 * <p>Records are written to the result map by the calling thread only, after both lookups for the
 * identifier returned, so a cancelled run always leaves a consistent graph.</p>
 */
@Service
@Slf4j
public class CitationTraversalEngine {

    private final MetadataProvider metadataProvider;
    private final ExecutorService traversalExecutor;
    private final int maxNodes;

    public CitationTraversalEngine(MetadataProvider metadataProvider,
                                   @Qualifier("traversalExecutor") ExecutorService traversalExecutor,
                                   @Value("${citegraph.traversal.max-nodes:0}") int maxNodes) {
        this.metadataProvider = metadataProvider;
        this.traversalExecutor = traversalExecutor;
        this.maxNodes = Math.max(0, maxNodes);
    }

    public TraversalResult expand(String root, int maxDepth) {
        return expand(root, maxDepth, null);
    }

    public TraversalResult expand(String root, int maxDepth, CitationGraph seed) {
        TraversalRequest request = TraversalRequest.builder()
                .root(root)
                .maxDepth(maxDepth)
                .seed(seed)
                .direction(TraversalDirection.BOTH)
                .build();
        return expand(request, TraversalListener.NONE, new CancellationToken());
    }

    public TraversalResult expand(TraversalRequest request, TraversalListener listener, CancellationToken token) {
        validate(request);

        String root = request.getRoot();
        int maxDepth = request.getMaxDepth();
        CitationGraph seed = request.getSeed();
        TraversalDirection direction = request.getDirection() != null ? request.getDirection() : TraversalDirection.BOTH;
        long startedAt = System.currentTimeMillis();

        Map<String, NodeRecord> records = new LinkedHashMap<>();
        Set<String> visited = ConcurrentHashMap.newKeySet();
        TreeMap<Integer, List<String>> frontier = new TreeMap<>();

        if (seed != null && seed.size() > 0) {
            restoreFrontier(seed, maxDepth, direction, records, visited, frontier);
            log.info("Resuming traversal of {} from {} seeded nodes, {} pending identifiers",
                    root, records.size(), frontier.values().stream().mapToInt(List::size).sum());
        } else {
            visited.add(root);
            frontier.put(0, new ArrayList<>(List.of(root)));
            log.info("Starting traversal of {} with max depth {} ({})", root, maxDepth, direction);
        }
        int seeded = records.size();

        StopReason stopReason = StopReason.COMPLETED;
        int levelsCompleted = 0;

        while (!frontier.isEmpty()) {
            if (token.isCancelled()) {
                break;
            }

            Map.Entry<Integer, List<String>> level = frontier.pollFirstEntry();
            int depth = level.getKey();
            List<String> ids = level.getValue();

            boolean budgetExhausted = false;
            if (maxNodes > 0) {
                int remaining = maxNodes - records.size();
                if (remaining <= 0) {
                    token.cancel(StopReason.NODE_LIMIT);
                    break;
                }
                if (ids.size() > remaining) {
                    log.warn("Node budget of {} reached at depth {}; dropping {} identifiers",
                            maxNodes, depth, ids.size() - remaining);
                    ids = ids.subList(0, remaining);
                    budgetExhausted = true;
                }
            }

            log.debug("Expanding depth {} with {} identifiers", depth, ids.size());

            List<Future<VisitOutcome>> futures = new ArrayList<>(ids.size());
            for (String id : ids) {
                futures.add(traversalExecutor.submit(() -> visit(id, depth, maxDepth, direction, visited, token)));
            }

            List<String> nextLevel = new ArrayList<>();
            boolean interrupted = false;
            for (int i = 0; i < futures.size(); i++) {
                VisitOutcome outcome;
                try {
                    outcome = futures.get(i).get();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    token.cancel(StopReason.INTERRUPTED);
                    futures.subList(i, futures.size()).forEach(f -> f.cancel(false));
                    interrupted = true;
                    break;
                } catch (ExecutionException e) {
                    log.error("Visit of {} failed unexpectedly", ids.get(i), e.getCause());
                    outcome = new VisitOutcome(degradedRecord(ids.get(i), depth, maxDepth, direction), List.of());
                }
                if (outcome == null) {
                    continue;
                }
                records.put(outcome.record().getId(), outcome.record());
                nextLevel.addAll(outcome.claimed());
                listener.onNodeRecorded(outcome.record(), records.size());
            }

            if (interrupted) {
                break;
            }

            if (!nextLevel.isEmpty()) {
                frontier.computeIfAbsent(depth + 1, k -> new ArrayList<>()).addAll(nextLevel);
            }
            if (!token.isCancelled()) {
                levelsCompleted++;
            }
            listener.onLevelCompleted(depth, new CitationGraph(root, records));

            if (budgetExhausted) {
                token.cancel(StopReason.NODE_LIMIT);
                break;
            }
        }

        if (token.isCancelled()) {
            stopReason = token.getReason();
        }

        CitationGraph graph = new CitationGraph(root, records);
        TraversalSummary summary = summarize(root, maxDepth, graph, seeded, levelsCompleted, stopReason,
                System.currentTimeMillis() - startedAt);

        log.info("Traversal of {} finished ({}): {} nodes, {} fetched, {} forward failures, {} backward failures, {} not found in {} ms",
                root, summary.getStopReason(), summary.getNodesVisited(), summary.getNodesFetched(),
                summary.getForwardFailures(), summary.getBackwardFailures(), summary.getNotFound(),
                summary.getElapsedMillis());
        return new TraversalResult(graph, summary);
    }

    /**
     * Fetch one identifier and claim its unvisited neighbors for the next depth.
     * Neighbors are claimed only once the record is built, so a failure never leaves claimed
     * identifiers without a record that lists them.
     * Returns null when the run was cancelled before the identifier was fetched.
     */
    private VisitOutcome visit(String id, int depth, int maxDepth, TraversalDirection direction,
                               Set<String> visited, CancellationToken token) {
        if (token.isCancelled()) {
            return null;
        }

        boolean expand = depth < maxDepth;
        ForwardLookup forward = fetchForward(id);
        BackwardLookup backward = expand && direction.followsCiters() ? fetchBackward(id) : null;

        List<String> references = expand && direction.followsReferences() ? forward.getReferences() : List.of();
        List<String> citedBy = backward != null ? backward.getCiters() : List.of();

        NodeRecord record = NodeRecord.builder()
                .id(id)
                .depth(depth)
                .metadata(forward.isOk() ? forward.getMetadata() : null)
                .references(references)
                .citedBy(citedBy)
                .forwardStatus(forward.getStatus())
                .backwardStatus(backward != null ? backward.getStatus() : FetchStatus.SKIPPED)
                .expanded(expand)
                .build();
        if (record.isDegraded()) {
            log.debug("Degraded node {} at depth {} (forward={}, backward={})",
                    id, depth, record.getForwardStatus(), record.getBackwardStatus());
        }

        List<String> claimed = new ArrayList<>();
        claimAll(record.getReferences(), visited, claimed);
        claimAll(record.getCitedBy(), visited, claimed);
        return new VisitOutcome(record, claimed);
    }

    private ForwardLookup fetchForward(String id) {
        try {
            ForwardLookup lookup = metadataProvider.fetchForward(id);
            return lookup != null ? lookup : ForwardLookup.unavailable();
        } catch (RuntimeException e) {
            log.warn("Forward lookup for {} failed: {}", id, e.getMessage());
            return ForwardLookup.unavailable();
        }
    }

    private BackwardLookup fetchBackward(String id) {
        try {
            BackwardLookup lookup = metadataProvider.fetchBackward(id);
            return lookup != null ? lookup : BackwardLookup.unavailable();
        } catch (RuntimeException e) {
            log.warn("Backward lookup for {} failed: {}", id, e.getMessage());
            return BackwardLookup.unavailable();
        }
    }

    private NodeRecord degradedRecord(String id, int depth, int maxDepth, TraversalDirection direction) {
        boolean expand = depth < maxDepth;
        return NodeRecord.builder()
                .id(id)
                .depth(depth)
                .forwardStatus(FetchStatus.UNAVAILABLE)
                .backwardStatus(expand && direction.followsCiters() ? FetchStatus.UNAVAILABLE : FetchStatus.SKIPPED)
                .expanded(expand)
                .build();
    }

    /**
     * Seed records are visited and never fetched again. Neighbors of expanded seed records that
     * are missing from the seed are what an interrupted run still had queued.
     */
    private void restoreFrontier(CitationGraph seed, int maxDepth, TraversalDirection direction,
                                 Map<String, NodeRecord> records,
                                 Set<String> visited, TreeMap<Integer, List<String>> frontier) {
        List<NodeRecord> byDepth = new ArrayList<>(seed.getNodes().values());
        byDepth.sort(Comparator.comparingInt(NodeRecord::getDepth));

        for (NodeRecord record : byDepth) {
            records.put(record.getId(), record);
            visited.add(record.getId());
        }
        for (NodeRecord record : byDepth) {
            if (!record.isExpanded() || record.getDepth() >= maxDepth) {
                continue;
            }
            List<String> pending = new ArrayList<>();
            if (direction.followsReferences()) {
                claimAll(record.getReferences(), visited, pending);
            }
            if (direction.followsCiters()) {
                claimAll(record.getCitedBy(), visited, pending);
            }
            if (!pending.isEmpty()) {
                frontier.computeIfAbsent(record.getDepth() + 1, k -> new ArrayList<>()).addAll(pending);
            }
        }
    }

    private void validate(TraversalRequest request) {
        if (request == null) {
            throw new InvalidTraversalRequestException("Traversal request is required");
        }
        if (request.getRoot() == null || request.getRoot().isBlank()) {
            throw new InvalidTraversalRequestException("Root identifier must not be empty");
        }
        if (request.getMaxDepth() < 0) {
            throw new InvalidTraversalRequestException("Max depth must be >= 0, got " + request.getMaxDepth());
        }
        CitationGraph seed = request.getSeed();
        if (seed != null && seed.size() > 0) {
            if (!request.getRoot().equals(seed.getRoot()) || !seed.contains(request.getRoot())) {
                throw new InvalidTraversalRequestException(
                        "Seed graph is rooted at " + seed.getRoot() + ", not " + request.getRoot());
            }
            if (seed.maxDepth() > request.getMaxDepth()) {
                throw new InvalidTraversalRequestException(
                        "Seed graph reaches depth " + seed.maxDepth() + ", beyond max depth " + request.getMaxDepth());
            }
        }
    }

    private TraversalSummary summarize(String root, int maxDepth, CitationGraph graph, int seeded,
                                       int levelsCompleted, StopReason stopReason, long elapsedMillis) {
        int forwardFailures = 0;
        int backwardFailures = 0;
        int notFound = 0;
        int degraded = 0;
        for (NodeRecord record : graph.getNodes().values()) {
            if (record.getForwardStatus().isFailure()) {
                forwardFailures++;
            }
            if (record.getBackwardStatus().isFailure()) {
                backwardFailures++;
            }
            if (record.getForwardStatus() == FetchStatus.NOT_FOUND
                    || record.getBackwardStatus() == FetchStatus.NOT_FOUND) {
                notFound++;
            }
            if (record.isDegraded()) {
                degraded++;
            }
        }
        return TraversalSummary.builder()
                .root(root)
                .maxDepth(maxDepth)
                .nodesVisited(graph.size())
                .nodesFetched(graph.size() - seeded)
                .nodesSeeded(seeded)
                .forwardFailures(forwardFailures)
                .backwardFailures(backwardFailures)
                .notFound(notFound)
                .degradedNodes(degraded)
                .levelsCompleted(levelsCompleted)
                .stopReason(stopReason)
                .elapsedMillis(elapsedMillis)
                .build();
    }

    private record VisitOutcome(NodeRecord record, List<String> claimed) {}
}
