package com.scholarly.citegraph.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholarly.citegraph.dto.ShardEntry;
import com.scholarly.citegraph.dto.ShardPaperInfo;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class JournalShardRepositoryTest {

    @TempDir
    Path tempDir;

    private JournalShardRepository repository;

    @BeforeEach
    void setUp() {
        repository = new JournalShardRepository(tempDir.toString(), new ObjectMapper());
    }

    @Test
    void listsOnlyShardFilesOrderedByIssnAndYear() throws Exception {
        Files.writeString(tempDir.resolve("2399-3650_2021.json"), "{}");
        Files.writeString(tempDir.resolve("2399-3650_2019.json"), "{}");
        Files.writeString(tempDir.resolve("0031-9007_2020.json"), "{}");
        Files.writeString(tempDir.resolve("issn_doi_dict.json"), "{}");
        Files.writeString(tempDir.resolve("notes.txt"), "x");

        List<ShardFile> shards = repository.listShards();

        assertThat(shards).extracting(ShardFile::getIssn, ShardFile::getYear)
                .containsExactly(
                        tuple("0031-9007", 2020),
                        tuple("2399-3650", 2019),
                        tuple("2399-3650", 2021));
        assertThat(repository.listShards("2399-3650")).hasSize(2);
    }

    @Test
    void readsLegacyShardsWithUnknownYear() throws Exception {
        Files.writeString(tempDir.resolve("2399-3650_2020.json"), """
                {"10.1038/s42005-020-0001-1": {
                    "info": {"title": "T", "authors": "A B", "year": "unknown", "doi": "10.1038/s42005-020-0001-1"},
                    "references": ["10.1103/x"]}}
                """);

        Map<String, ShardEntry> entries = repository.readShard(repository.listShards().get(0));

        ShardEntry entry = entries.get("10.1038/s42005-020-0001-1");
        assertThat(entry.getInfo().getYearAsInteger()).isNull();
        assertThat(entry.getReferences()).containsExactly("10.1103/x");
    }

    @Test
    void writesShardThatReadsBack() {
        ShardEntry entry = new ShardEntry(
                ShardPaperInfo.builder().title("T").authors("A").year(2021).doi("10.1/a").build(),
                List.of("10.1/b"));

        repository.writeShard("1234-5678", 2021, Map.of("10.1/a", entry));

        assertThat(repository.exists("1234-5678", 2021)).isTrue();
        ShardEntry read = repository.readShard(repository.listShards("1234-5678").get(0)).get("10.1/a");
        assertThat(read.getInfo().getYearAsInteger()).isEqualTo(2021);
        assertThat(read.getReferences()).containsExactly("10.1/b");
    }
}
