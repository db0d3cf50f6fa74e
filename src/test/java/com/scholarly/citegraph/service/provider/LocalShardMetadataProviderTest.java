package com.scholarly.citegraph.service.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholarly.citegraph.model.FetchStatus;
import com.scholarly.citegraph.repository.JournalShardRepository;
import com.scholarly.citegraph.service.journal.JournalCatalog;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class LocalShardMetadataProviderTest {

    @TempDir
    Path shardDir;

    private JournalShardRepository repository;
    private LocalShardMetadataProvider provider;

    @BeforeEach
    void setUp() throws Exception {
        Files.writeString(shardDir.resolve("2399-3650_2020.json"), """
                {"10.1038/s42005-020-0001-1": {
                    "info": {"title": "Spin waves", "authors": "A B", "year": 2020, "doi": "10.1038/s42005-020-0001-1"},
                    "references": ["10.1103/PhysRevLett.7", "10.1038/s42005-019-0009-9"]}}
                """);
        Files.writeString(shardDir.resolve("2399-3650_2019.json"), """
                {"10.1038/s42005-019-0009-9": {
                    "info": {"title": "Magnons", "authors": "C D", "year": "unknown", "doi": "10.1038/s42005-019-0009-9"},
                    "references": []}}
                """);
        Files.writeString(shardDir.resolve("0031-9007_2021.json"), """
                {"10.1103/PhysRevLett.9": {
                    "info": {"title": "Letters", "authors": "E F", "year": 2021, "doi": "10.1103/PhysRevLett.9"},
                    "references": ["10.1103/PhysRevLett.7"]}}
                """);

        repository = new JournalShardRepository(shardDir.toString(), new ObjectMapper());
        JournalCatalog catalog = new JournalCatalog(
                Map.of("2399-3650", "Communications Physics"),
                Map.of("2399-3650", "10.1038/s42005-"));
        provider = new LocalShardMetadataProvider(repository, catalog);
    }

    @Test
    void findsPaperInShardsOfTheMatchingJournal() {
        ForwardLookup lookup = provider.fetchForward("10.1038/s42005-020-0001-1");

        assertThat(lookup.getStatus()).isEqualTo(FetchStatus.OK);
        assertThat(lookup.getMetadata().getTitle()).isEqualTo("Spin waves");
        assertThat(lookup.getMetadata().getJournal()).isEqualTo("Communications Physics");
        assertThat(lookup.getReferences())
                .containsExactly("10.1103/PhysRevLett.7", "10.1038/s42005-019-0009-9");
    }

    @Test
    void usesShardYearWhenInfoYearIsUnknown() {
        ForwardLookup lookup = provider.fetchForward("10.1038/s42005-019-0009-9");

        assertThat(lookup.getMetadata().getYear()).isEqualTo(2019);
    }

    @Test
    void searchesAllShardsWhenNoPrefixMatches() {
        ForwardLookup lookup = provider.fetchForward("10.1103/PhysRevLett.9");

        assertThat(lookup.getStatus()).isEqualTo(FetchStatus.OK);
        assertThat(lookup.getMetadata().getJournal()).isNull();
    }

    @Test
    void reportsUnknownPaperAsNotFound() {
        assertThat(provider.fetchForward("10.9999/nothing").getStatus()).isEqualTo(FetchStatus.NOT_FOUND);
        assertThat(provider.fetchBackward("10.9999/nothing").getStatus()).isEqualTo(FetchStatus.NOT_FOUND);
    }

    @Test
    void derivesCitersFromReferencesAcrossShards() {
        BackwardLookup lookup = provider.fetchBackward("10.1103/PhysRevLett.7");

        assertThat(lookup.getStatus()).isEqualTo(FetchStatus.OK);
        assertThat(lookup.getCiters())
                .containsExactlyInAnyOrder("10.1038/s42005-020-0001-1", "10.1103/PhysRevLett.9");
        assertThat(provider.fetchBackward("10.1103/PhysRevLett.9").getCiters()).isEmpty();
    }

    @Test
    void rebuildsCitersWhenShardsChange() throws Exception {
        assertThat(provider.fetchBackward("10.1038/s42005-020-0001-1").getCiters()).isEmpty();

        Files.writeString(shardDir.resolve("2399-3650_2021.json"), """
                {"10.1038/s42005-021-0002-2": {"info": {"title": "Later", "authors": "G", "year": 2021,
                    "doi": "10.1038/s42005-021-0002-2"}, "references": ["10.1038/s42005-020-0001-1"]}}
                """);

        assertThat(provider.fetchBackward("10.1038/s42005-020-0001-1").getCiters())
                .containsExactly("10.1038/s42005-021-0002-2");
    }

    @Test
    void skipsUnreadableShardAndAnswersFromTheOthers() throws Exception {
        Files.writeString(shardDir.resolve("2399-3650_2018.json"), "{ not json");

        ForwardLookup forward = provider.fetchForward("10.1038/s42005-020-0001-1");
        BackwardLookup backward = provider.fetchBackward("10.1103/PhysRevLett.7");

        assertThat(forward.getStatus()).isEqualTo(FetchStatus.OK);
        assertThat(forward.getMetadata().getTitle()).isEqualTo("Spin waves");
        assertThat(backward.getStatus()).isEqualTo(FetchStatus.OK);
        assertThat(backward.getCiters())
                .containsExactlyInAnyOrder("10.1038/s42005-020-0001-1", "10.1103/PhysRevLett.9");
        assertThat(provider.fetchBackward("10.9999/nothing").getStatus()).isEqualTo(FetchStatus.NOT_FOUND);
    }

    @Test
    void reportsMissOnlyAsUnavailableWhenACandidateShardWasUnreadable() throws Exception {
        Files.writeString(shardDir.resolve("2399-3650_2022.json"), "{ broken");

        assertThat(provider.fetchForward("10.1038/s42005-022-0404-0").getStatus())
                .isEqualTo(FetchStatus.UNAVAILABLE);
        assertThat(provider.fetchForward("10.1103/PhysRevLett.404").getStatus())
                .isEqualTo(FetchStatus.UNAVAILABLE);
    }
}
