package com.scholarly.citegraph.service.journal;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholarly.citegraph.repository.JournalShardRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class IssnPrefixIndexerTest {

    @TempDir
    Path shardDir;

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void computesLongestCommonPrefixPerIssnAndWritesTable() throws Exception {
        Files.writeString(shardDir.resolve("2399-3650_2020.json"), """
                {"10.1038/s42005-020-0317-3": {"references": []}, "10.1038/s42005-020-0401-1": {"references": []}}
                """);
        Files.writeString(shardDir.resolve("2399-3650_2021.json"), """
                {"10.1038/s42005-021-0001-0": {"references": []}}
                """);
        Files.writeString(shardDir.resolve("0031-9007_2020.json"), """
                {"10.1103/PhysRevLett.124.010501": {"references": []}}
                """);
        Files.writeString(shardDir.resolve("1111-2222_2020.json"), "{}");
        IssnPrefixIndexer indexer = new IssnPrefixIndexer(new JournalShardRepository(shardDir.toString(), objectMapper), objectMapper);

        Map<String, String> prefixes = indexer.computePrefixes();

        assertThat(prefixes).containsOnly(
                Map.entry("2399-3650", "10.1038/s42005-02"),
                Map.entry("0031-9007", "10.1103/PhysRevLett.124.010501"));
        Map<String, String> written = objectMapper.readValue(
                shardDir.resolve(IssnPrefixIndexer.PREFIX_FILE_NAME).toFile(), new TypeReference<Map<String, String>>() {});
        assertThat(written).isEqualTo(prefixes);
    }

    @Test
    void commonPrefixStopsAtFirstDifference() {
        assertThat(IssnPrefixIndexer.commonPrefix(List.of("10.1021/acsnano.1", "10.1021/acsnano.2b", "10.1021/acsanm.3")))
                .isEqualTo("10.1021/acs");
        assertThat(IssnPrefixIndexer.commonPrefix(List.of("abc", "xyz"))).isEmpty();
    }
}
