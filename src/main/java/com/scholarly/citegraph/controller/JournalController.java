package com.scholarly.citegraph.controller;

import com.scholarly.citegraph.dto.ShardBuildReport;
import com.scholarly.citegraph.dto.ShardBuildRequest;
import com.scholarly.citegraph.dto.crossref.JournalSearchResult;
import com.scholarly.citegraph.service.journal.IssnPrefixIndexer;
import com.scholarly.citegraph.service.journal.JournalShardBuilder;
import com.scholarly.citegraph.service.provider.CrossRefClient;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST controller for journal lookup and the local shard dataset.
 */
@RestController
@RequestMapping("/api/journals")
@RequiredArgsConstructor
@Slf4j
public class JournalController {

    private final CrossRefClient crossRefClient;
    private final JournalShardBuilder journalShardBuilder;
    private final IssnPrefixIndexer issnPrefixIndexer;

    @GetMapping("/search")
    public ResponseEntity<List<JournalSearchResult>> searchJournals(
            @RequestParam String name,
            @RequestParam(defaultValue = "10") int rows) {
        return ResponseEntity.ok(crossRefClient.searchJournals(name, rows));
    }

    /**
     * Download journal works from CrossRef into local shards. Runs synchronously.
     */
    @PostMapping("/shards")
    public ResponseEntity<ShardBuildReport> buildShards(@Valid @RequestBody ShardBuildRequest request) {
        log.info("Building shards for {} ISSNs, {}-{}", request.getIssns().size(), request.getStartYear(), request.getEndYear());
        ShardBuildReport report = journalShardBuilder.buildShards(
                request.getIssns(), request.getStartYear(), request.getEndYear(), request.isOverwrite());
        return ResponseEntity.ok(report);
    }

    /**
     * Recompute the ISSN to DOI prefix table from the local shards.
     */
    @PostMapping("/prefixes")
    public ResponseEntity<Map<String, String>> computePrefixes() {
        log.info("Recomputing ISSN DOI prefixes");
        return ResponseEntity.ok(issnPrefixIndexer.computePrefixes());
    }
}
