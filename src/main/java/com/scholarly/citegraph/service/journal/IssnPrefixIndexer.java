package com.scholarly.citegraph.service.journal;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholarly.citegraph.dto.ShardEntry;
import com.scholarly.citegraph.exception.GraphStorageException;
import com.scholarly.citegraph.repository.JournalShardRepository;
import com.scholarly.citegraph.repository.ShardFile;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Derives the DOI prefix each journal's papers share, from the DOIs stored in its shards,
 * and writes the ISSN to prefix table next to the shards.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class IssnPrefixIndexer {

    public static final String PREFIX_FILE_NAME = "issn_doi_dict.json";

    private final JournalShardRepository shardRepository;
    private final ObjectMapper objectMapper;

    /**
     * Computes the longest common prefix of all DOIs per ISSN and persists the result.
     * ISSNs whose shards hold no DOIs, or DOIs without a common prefix, are left out.
     */
    public Map<String, String> computePrefixes() {
        Map<String, List<String>> doisByIssn = new TreeMap<>();
        for (ShardFile shard : shardRepository.listShards()) {
            Map<String, ShardEntry> entries = shardRepository.readShard(shard);
            doisByIssn.computeIfAbsent(shard.getIssn(), k -> new ArrayList<>()).addAll(entries.keySet());
        }

        Map<String, String> prefixes = new LinkedHashMap<>();
        doisByIssn.forEach((issn, dois) -> {
            if (dois.isEmpty()) {
                log.debug("No DOIs recorded for ISSN {}", issn);
                return;
            }
            String prefix = commonPrefix(dois);
            if (prefix.isEmpty()) {
                log.warn("DOIs of ISSN {} share no common prefix", issn);
                return;
            }
            prefixes.put(issn, prefix);
        });

        write(prefixes);
        log.info("Computed DOI prefixes for {} journals; the journal catalog picks them up on restart", prefixes.size());
        return prefixes;
    }

    static String commonPrefix(List<String> values) {
        String prefix = values.get(0);
        for (String value : values) {
            int length = Math.min(prefix.length(), value.length());
            int i = 0;
            while (i < length && prefix.charAt(i) == value.charAt(i)) {
                i++;
            }
            prefix = prefix.substring(0, i);
            if (prefix.isEmpty()) {
                break;
            }
        }
        return prefix;
    }

    private void write(Map<String, String> prefixes) {
        Path target = shardRepository.getDirectory().resolve(PREFIX_FILE_NAME);
        try {
            Files.createDirectories(target.getParent());
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(target.toFile(), prefixes);
        } catch (IOException e) {
            throw new GraphStorageException("Failed to write prefix table " + target, e);
        }
    }
}
