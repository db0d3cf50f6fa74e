package com.scholarly.citegraph.service.journal;

import com.fasterxml.jackson.databind.JsonNode;
import com.scholarly.citegraph.dto.ShardBuildReport;
import com.scholarly.citegraph.dto.ShardEntry;
import com.scholarly.citegraph.dto.crossref.WorksPage;
import com.scholarly.citegraph.exception.GraphStorageException;
import com.scholarly.citegraph.exception.ProviderUnavailableException;
import com.scholarly.citegraph.repository.JournalShardRepository;
import com.scholarly.citegraph.service.provider.CrossRefClient;
import com.scholarly.citegraph.service.provider.CrossRefWorkMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Downloads a journal's works per publication year from CrossRef and stores them as local shards.
 */
@Service
@Slf4j
public class JournalShardBuilder {

    static final String FIRST_CURSOR = "*";

    private final CrossRefClient crossRefClient;
    private final JournalShardRepository shardRepository;
    private final int rows;

    public JournalShardBuilder(CrossRefClient crossRefClient,
                               JournalShardRepository shardRepository,
                               @Value("${crossref.rows:100}") int rows) {
        this.crossRefClient = crossRefClient;
        this.shardRepository = shardRepository;
        this.rows = rows;
    }

    /**
     * Builds one shard per ISSN and year in {@code [startYear, endYear]}. Existing shards are kept
     * unless {@code overwrite} is set. A failing shard is reported and does not stop the others.
     */
    public ShardBuildReport buildShards(List<String> issns, int startYear, int endYear, boolean overwrite) {
        if (issns == null || issns.isEmpty()) {
            throw new IllegalArgumentException("At least one ISSN is required");
        }
        if (endYear < startYear) {
            throw new IllegalArgumentException("endYear " + endYear + " is before startYear " + startYear);
        }

        List<ShardBuildReport.ShardOutcome> outcomes = new ArrayList<>();
        for (String issn : issns) {
            for (int year = startYear; year <= endYear; year++) {
                outcomes.add(buildShard(issn.trim(), year, overwrite));
            }
        }

        ShardBuildReport report = ShardBuildReport.builder()
                .written(count(outcomes, ShardStatus.WRITTEN))
                .skipped(count(outcomes, ShardStatus.SKIPPED))
                .failed(count(outcomes, ShardStatus.FAILED))
                .shards(outcomes)
                .build();
        log.info("Shard build finished: {} written, {} skipped, {} failed",
                report.getWritten(), report.getSkipped(), report.getFailed());
        return report;
    }

    private ShardBuildReport.ShardOutcome buildShard(String issn, int year, boolean overwrite) {
        if (!overwrite && shardRepository.exists(issn, year)) {
            log.info("Shard {}_{} already exists, skipping", issn, year);
            return outcome(issn, year, ShardStatus.SKIPPED, 0, null);
        }
        try {
            Map<String, ShardEntry> entries = fetchYear(issn, year);
            shardRepository.writeShard(issn, year, entries);
            return outcome(issn, year, ShardStatus.WRITTEN, entries.size(), null);
        } catch (ProviderUnavailableException | GraphStorageException e) {
            log.error("Failed to build shard {}_{}: {}", issn, year, e.getMessage());
            return outcome(issn, year, ShardStatus.FAILED, 0, e.getMessage());
        }
    }

    Map<String, ShardEntry> fetchYear(String issn, int year) {
        Map<String, ShardEntry> entries = new LinkedHashMap<>();
        String cursor = FIRST_CURSOR;
        while (cursor != null) {
            WorksPage page = crossRefClient.fetchJournalWorks(issn, year, cursor, rows);
            if (page.getItems() == null || page.getItems().isEmpty()) {
                break;
            }
            for (JsonNode item : page.getItems()) {
                String doi = item.path("DOI").asText("");
                if (!doi.isBlank()) {
                    entries.putIfAbsent(doi, CrossRefWorkMapper.toShardEntry(item));
                }
            }
            log.debug("Fetched {} of {} works for {} in {}", entries.size(), page.getTotalResults(), issn, year);
            cursor = cursor.equals(page.getNextCursor()) ? null : page.getNextCursor();
        }
        log.info("Retrieved {} articles for {} in {}", entries.size(), issn, year);
        return entries;
    }

    private static ShardBuildReport.ShardOutcome outcome(String issn, int year, ShardStatus status,
                                                         int articles, String errorMessage) {
        return ShardBuildReport.ShardOutcome.builder()
                .issn(issn)
                .year(year)
                .status(status.name())
                .articles(articles)
                .errorMessage(errorMessage)
                .build();
    }

    private static int count(List<ShardBuildReport.ShardOutcome> outcomes, ShardStatus status) {
        return (int) outcomes.stream().filter(o -> o.getStatus().equals(status.name())).count();
    }

    enum ShardStatus {
        WRITTEN, SKIPPED, FAILED
    }
}
