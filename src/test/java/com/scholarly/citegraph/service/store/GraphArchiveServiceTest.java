package com.scholarly.citegraph.service.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholarly.citegraph.exception.CorruptGraphDataException;
import com.scholarly.citegraph.model.CitationGraph;
import com.scholarly.citegraph.model.NodeRecord;
import com.scholarly.citegraph.repository.GraphFileRepository;
import com.scholarly.citegraph.repository.StoredGraphFile;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GraphArchiveServiceTest {

    @TempDir
    Path tempDir;

    private GraphArchiveService archiveService;

    @BeforeEach
    void setUp() {
        archiveService = new GraphArchiveService(
                new GraphStore(new ObjectMapper()), new GraphFileRepository(tempDir.toString()));
    }

    @Test
    void savesUnderRootDerivedNameAndLoadsBack() {
        NodeRecord root = NodeRecord.builder().id("10.1/abc").depth(0).references(List.of("10.1/def")).expanded(true).build();
        CitationGraph graph = CitationGraph.of("10.1/abc", List.of(root));

        String name = archiveService.save(graph, null);

        assertThat(name).isEqualTo("citation_graph_10.1_abc");
        assertThat(archiveService.load(name)).isEqualTo(graph);
        assertThat(archiveService.list()).extracting(StoredGraphFile::getName).containsExactly(name);
        assertThat(archiveService.loadIfPresent("citation_graph_other")).isNull();
    }

    @Test
    void importConvertsNestedTreeToFlatLayout() {
        byte[] tree = "{\"A\": {\"B\": {}}}".getBytes(StandardCharsets.UTF_8);

        String name = archiveService.importGraph(tree, null, "legacy");

        CitationGraph loaded = archiveService.load(name);
        assertThat(name).isEqualTo("legacy");
        assertThat(loaded.getNodes().keySet()).containsExactly("A", "B");
        assertThat(loaded.find("A").orElseThrow().getReferences()).containsExactly("B");
    }

    @Test
    void importOfCorruptDataStoresNothing() {
        byte[] corrupt = "{\"A\": {\"B\": 3}}".getBytes(StandardCharsets.UTF_8);

        assertThatThrownBy(() -> archiveService.importGraph(corrupt, GraphLayout.NESTED_TREE, "bad"))
                .isInstanceOf(CorruptGraphDataException.class);
        assertThat(archiveService.list()).isEmpty();
    }
}
