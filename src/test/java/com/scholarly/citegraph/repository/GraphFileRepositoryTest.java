package com.scholarly.citegraph.repository;

import com.scholarly.citegraph.exception.GraphNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GraphFileRepositoryTest {

    @TempDir
    Path tempDir;

    private GraphFileRepository repository;

    @BeforeEach
    void setUp() {
        repository = new GraphFileRepository(tempDir.resolve("graphs").toString());
    }

    @Test
    void derivesFileSafeNamesFromDois() {
        assertThat(GraphFileRepository.nameFor("10.1038/s42005-020-0317-3"))
                .isEqualTo("citation_graph_10.1038_s42005-020-0317-3");
        assertThat(GraphFileRepository.sanitize("10.1002/(SICI)1097")).isEqualTo("10.1002__SICI_1097");
    }

    @Test
    void writesReadsListsAndDeletes() throws Exception {
        byte[] data = "{\"root\":\"A\",\"nodes\":{}}".getBytes(StandardCharsets.UTF_8);

        Path written = repository.write("citation_graph_A", data);

        assertThat(written).exists();
        assertThat(repository.read("citation_graph_A")).isEqualTo(data);
        List<StoredGraphFile> listed = repository.list();
        assertThat(listed).extracting(StoredGraphFile::getName).containsExactly("citation_graph_A");
        assertThat(listed.get(0).getSizeBytes()).isEqualTo(data.length);
        try (Stream<Path> files = Files.list(tempDir.resolve("graphs"))) {
            assertThat(files.map(p -> p.getFileName().toString())).containsExactly("citation_graph_A.json");
        }

        repository.delete("citation_graph_A");

        assertThat(repository.exists("citation_graph_A")).isFalse();
        assertThat(repository.list()).isEmpty();
    }

    @Test
    void overwritesExistingGraph() {
        repository.write("g", "{\"v\":1}".getBytes(StandardCharsets.UTF_8));
        repository.write("g", "{\"v\":2}".getBytes(StandardCharsets.UTF_8));

        assertThat(new String(repository.read("g"), StandardCharsets.UTF_8)).isEqualTo("{\"v\":2}");
    }

    @Test
    void missingOrUnsafeNamesAreNotFound() {
        assertThatThrownBy(() -> repository.read("absent"))
                .isInstanceOf(GraphNotFoundException.class);
        assertThatThrownBy(() -> repository.read("../etc/passwd"))
                .isInstanceOf(GraphNotFoundException.class);
        assertThatThrownBy(() -> repository.delete("absent"))
                .isInstanceOf(GraphNotFoundException.class);
    }

    @Test
    void listingAMissingDirectoryIsEmpty() {
        assertThat(repository.list()).isEmpty();
    }
}
