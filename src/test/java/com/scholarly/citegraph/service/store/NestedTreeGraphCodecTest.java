package com.scholarly.citegraph.service.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholarly.citegraph.exception.CorruptGraphDataException;
import com.scholarly.citegraph.model.CitationGraph;
import com.scholarly.citegraph.model.FetchStatus;
import com.scholarly.citegraph.model.NodeRecord;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NestedTreeGraphCodecTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final NestedTreeGraphCodec codec = new NestedTreeGraphCodec();

    private JsonNode tree(String json) throws Exception {
        return objectMapper.readTree(json);
    }

    @Test
    void collapsesDuplicatedSubtreesIntoOneRecord() throws Exception {
        CitationGraph graph = codec.decode(tree("""
                {"A": {"B": {"D": {"E": {}}}, "C": {"D": {"F": {}}}, "D": {}}}
                """));

        NodeRecord d = graph.find("D").orElseThrow();
        assertThat(graph.size()).isEqualTo(6);
        assertThat(d.getDepth()).isEqualTo(1);
        assertThat(d.getReferences()).containsExactly("E", "F");
        assertThat(d.isExpanded()).isTrue();
        assertThat(graph.find("A").orElseThrow().getReferences()).containsExactly("B", "C", "D");
    }

    @Test
    void decodedRecordsCarryReferenceOnlyStatuses() throws Exception {
        CitationGraph graph = codec.decode(tree("{\"A\": {\"B\": {}}}"));

        NodeRecord leaf = graph.find("B").orElseThrow();
        assertThat(leaf.getForwardStatus()).isEqualTo(FetchStatus.OK);
        assertThat(leaf.getBackwardStatus()).isEqualTo(FetchStatus.SKIPPED);
        assertThat(leaf.isExpanded()).isFalse();
        assertThat(leaf.getMetadata()).isNull();
        assertThat(leaf.getCitedBy()).isEmpty();
    }

    @Test
    void rejectsTreesWithoutASingleRoot() {
        assertThatThrownBy(() -> codec.decode(tree("{\"A\": {}, \"B\": {}}")))
                .isInstanceOf(CorruptGraphDataException.class);
        assertThatThrownBy(() -> codec.decode(tree("{}")))
                .isInstanceOf(CorruptGraphDataException.class);
        assertThatThrownBy(() -> codec.decode(tree("{\"A\": {\"B\": [1]}}")))
                .isInstanceOf(CorruptGraphDataException.class)
                .hasMessageContaining("B");
    }

    @Test
    void exportsReferencesOneLevelDeeperRecursively() {
        NodeRecord a = NodeRecord.builder().id("A").depth(0).references(List.of("B", "C")).citedBy(List.of("Z")).build();
        NodeRecord b = NodeRecord.builder().id("B").depth(1).references(List.of("C", "D")).build();
        NodeRecord c = NodeRecord.builder().id("C").depth(1).build();
        NodeRecord d = NodeRecord.builder().id("D").depth(2).build();
        NodeRecord z = NodeRecord.builder().id("Z").depth(1).build();

        Map<String, Object> exported = codec.export(CitationGraph.of("A", List.of(a, b, c, d, z)));

        assertThat(exported).isEqualTo(Map.of("A", Map.of(
                "B", Map.of("D", Map.of()),
                "C", Map.of())));
    }

    @Test
    void exportOfEmptyGraphIsBareRoot() {
        assertThat(codec.export(CitationGraph.empty("A"))).isEqualTo(Map.of("A", Map.of()));
    }
}
