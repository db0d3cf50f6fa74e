package com.scholarly.citegraph.service.store;

import com.scholarly.citegraph.model.CitationGraph;
import com.scholarly.citegraph.repository.GraphFileRepository;
import com.scholarly.citegraph.repository.StoredGraphFile;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Named, file-backed graph archive on top of {@link GraphStore}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GraphArchiveService {

    private final GraphStore graphStore;
    private final GraphFileRepository graphFileRepository;

    /**
     * Saves the graph under the given label, or under the default name derived from its root.
     *
     * @return the name the graph was stored under
     */
    public String save(CitationGraph graph, String label) {
        String name = label == null || label.isBlank()
                ? GraphFileRepository.nameFor(graph.getRoot())
                : GraphFileRepository.sanitize(label);
        graphFileRepository.write(name, graphStore.save(graph));
        return name;
    }

    public CitationGraph load(String name) {
        return graphStore.load(graphFileRepository.read(name));
    }

    /**
     * Like {@link #load(String)}, but an absent graph yields {@code null} instead of an exception.
     */
    public CitationGraph loadIfPresent(String name) {
        return graphFileRepository.exists(name) ? load(name) : null;
    }

    /**
     * Validates uploaded graph data in the given layout (auto-detected when null) and stores it
     * in the flat layout.
     */
    public String importGraph(byte[] data, GraphLayout layout, String label) {
        CitationGraph graph = layout == null ? graphStore.load(data) : graphStore.load(data, layout);
        String name = save(graph, label);
        log.info("Imported graph rooted at {} as {} ({} nodes)", graph.getRoot(), name, graph.size());
        return name;
    }

    public List<StoredGraphFile> list() {
        return graphFileRepository.list();
    }

    public void delete(String name) {
        graphFileRepository.delete(name);
    }
}
