package com.scholarly.citegraph.service.provider;

import com.scholarly.citegraph.dto.ShardEntry;
import com.scholarly.citegraph.dto.ShardPaperInfo;
import com.scholarly.citegraph.exception.GraphStorageException;
import com.scholarly.citegraph.model.PaperMetadata;
import com.scholarly.citegraph.repository.JournalShardRepository;
import com.scholarly.citegraph.repository.ShardFile;
import com.scholarly.citegraph.service.journal.JournalCatalog;
import lombok.extern.slf4j.Slf4j;

import java.util.*;

/**
 * Answers lookups from the local journal shard dataset.
 * Candidate shards for a DOI are those of the journals whose DOI prefix matches it,
 * or every shard when no prefix matches. Citers come from a reverse index over all shards,
 * rebuilt whenever the set of shard files changes.
 */
@Slf4j
public class LocalShardMetadataProvider implements MetadataProvider {

    private final JournalShardRepository shardRepository;
    private final JournalCatalog journalCatalog;

    private final Object indexLock = new Object();
    private volatile ReverseIndex reverseIndex;

    public LocalShardMetadataProvider(JournalShardRepository shardRepository, JournalCatalog journalCatalog) {
        this.shardRepository = shardRepository;
        this.journalCatalog = journalCatalog;
    }

    /**
     * Unreadable shards are skipped. When the paper is in none of the readable candidates and some
     * candidate could not be read, the answer is UNAVAILABLE rather than NOT_FOUND.
     */
    @Override
    public ForwardLookup fetchForward(String id) {
        List<ShardFile> candidates;
        try {
            candidates = candidateShards(id);
        } catch (GraphStorageException e) {
            log.warn("Local forward lookup for {} failed: {}", id, e.getMessage());
            return ForwardLookup.unavailable();
        }
        boolean skipped = false;
        for (ShardFile shard : candidates) {
            ShardEntry entry;
            try {
                entry = shardRepository.readShard(shard).get(id);
            } catch (GraphStorageException e) {
                log.warn("Skipping unreadable shard {} during lookup of {}: {}", shard.getPath(), id, e.getMessage());
                skipped = true;
                continue;
            }
            if (entry != null) {
                return ForwardLookup.found(toMetadata(id, entry, shard), entry.getReferences());
            }
        }
        return skipped ? ForwardLookup.unavailable() : ForwardLookup.notFound();
    }

    /**
     * Works in the dataset that list the identifier among their references. Identifiers the
     * readable shards neither contain nor reference are reported as not found.
     */
    @Override
    public BackwardLookup fetchBackward(String id) {
        ReverseIndex index;
        try {
            index = currentIndex();
        } catch (GraphStorageException e) {
            log.warn("Local backward lookup for {} failed: {}", id, e.getMessage());
            return BackwardLookup.unavailable();
        }
        if (!index.knows(id)) {
            return BackwardLookup.notFound();
        }
        return BackwardLookup.found(index.citersOf(id));
    }

    private List<ShardFile> candidateShards(String id) {
        List<String> issns = journalCatalog.issnsForIdentifier(id);
        if (issns.isEmpty()) {
            return shardRepository.listShards();
        }
        List<ShardFile> shards = new ArrayList<>();
        for (String issn : issns) {
            shards.addAll(shardRepository.listShards(issn));
        }
        return shards;
    }

    private PaperMetadata toMetadata(String id, ShardEntry entry, ShardFile shard) {
        ShardPaperInfo info = entry.getInfo();
        if (info == null) {
            return PaperMetadata.unknown(id).toBuilder()
                    .year(shard.getYear())
                    .journal(journalCatalog.journalName(shard.getIssn()).orElse(null))
                    .build();
        }
        Integer year = info.getYearAsInteger();
        return PaperMetadata.builder()
                .title(info.getTitle() != null ? info.getTitle() : PaperMetadata.UNKNOWN)
                .authors(info.getAuthors() != null ? info.getAuthors() : PaperMetadata.UNKNOWN)
                .year(year != null ? year : shard.getYear())
                .doi(id)
                .journal(journalCatalog.journalName(shard.getIssn()).orElse(null))
                .build();
    }

    private ReverseIndex currentIndex() {
        List<ShardFile> shards = shardRepository.listShards();
        ReverseIndex index = reverseIndex;
        if (index != null && index.shards.equals(shards)) {
            return index;
        }
        synchronized (indexLock) {
            index = reverseIndex;
            if (index == null || !index.shards.equals(shards)) {
                index = ReverseIndex.build(shards, shardRepository);
                reverseIndex = index;
                log.info("Built local citation index over {} shards ({} unreadable, {} cited works)",
                        shards.size(), index.unreadable, index.citers.size());
            }
            return index;
        }
    }

    private static final class ReverseIndex {

        private final List<ShardFile> shards;
        private final Set<String> papers;
        private final Map<String, List<String>> citers;
        private final int unreadable;

        private ReverseIndex(List<ShardFile> shards, Set<String> papers, Map<String, List<String>> citers, int unreadable) {
            this.shards = shards;
            this.papers = papers;
            this.citers = citers;
            this.unreadable = unreadable;
        }

        static ReverseIndex build(List<ShardFile> shards, JournalShardRepository repository) {
            Set<String> papers = new HashSet<>();
            Map<String, LinkedHashSet<String>> citers = new HashMap<>();
            int unreadable = 0;
            for (ShardFile shard : shards) {
                Map<String, ShardEntry> entries;
                try {
                    entries = repository.readShard(shard);
                } catch (GraphStorageException e) {
                    log.warn("Skipping unreadable shard {} in citation index: {}", shard.getPath(), e.getMessage());
                    unreadable++;
                    continue;
                }
                for (Map.Entry<String, ShardEntry> paper : entries.entrySet()) {
                    papers.add(paper.getKey());
                    List<String> references = paper.getValue() == null ? null : paper.getValue().getReferences();
                    if (references == null) {
                        continue;
                    }
                    for (String reference : references) {
                        citers.computeIfAbsent(reference, k -> new LinkedHashSet<>()).add(paper.getKey());
                    }
                }
            }
            Map<String, List<String>> frozen = new HashMap<>();
            citers.forEach((cited, citing) -> frozen.put(cited, List.copyOf(citing)));
            return new ReverseIndex(List.copyOf(shards), papers, frozen, unreadable);
        }

        boolean knows(String id) {
            return papers.contains(id) || citers.containsKey(id);
        }

        List<String> citersOf(String id) {
            return citers.getOrDefault(id, List.of());
        }
    }
}
