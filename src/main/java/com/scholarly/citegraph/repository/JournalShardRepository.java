package com.scholarly.citegraph.repository;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholarly.citegraph.dto.ShardEntry;
import com.scholarly.citegraph.exception.GraphStorageException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * File access to the local journal shard dataset: one JSON file per (ISSN, year),
 * mapping DOI to paper info and references.
 */
@Repository
@Slf4j
public class JournalShardRepository {

    private static final Pattern SHARD_NAME = Pattern.compile("^(.+)_(\\d{4})\\.json$");
    private static final TypeReference<LinkedHashMap<String, ShardEntry>> SHARD_TYPE = new TypeReference<>() {};

    private final Path directory;
    private final ObjectMapper objectMapper;

    public JournalShardRepository(@Value("${citegraph.shards.directory:./journal_data}") String directory,
                                  ObjectMapper objectMapper) {
        this.directory = Path.of(directory);
        this.objectMapper = objectMapper;
    }

    public Path getDirectory() {
        return directory;
    }

    /**
     * All shard files, ordered by ISSN then year.
     */
    public List<ShardFile> listShards() {
        if (!Files.isDirectory(directory)) {
            log.debug("Shard directory {} does not exist", directory);
            return List.of();
        }
        List<ShardFile> shards = new ArrayList<>();
        try (Stream<Path> files = Files.list(directory)) {
            files.filter(Files::isRegularFile).forEach(path -> {
                Matcher matcher = SHARD_NAME.matcher(path.getFileName().toString());
                if (matcher.matches()) {
                    shards.add(new ShardFile(matcher.group(1), Integer.parseInt(matcher.group(2)), path));
                }
            });
        } catch (IOException e) {
            throw new GraphStorageException("Failed to list shard directory " + directory, e);
        }
        shards.sort(Comparator.comparing(ShardFile::getIssn).thenComparingInt(ShardFile::getYear));
        return shards;
    }

    public List<ShardFile> listShards(String issn) {
        return listShards().stream()
                .filter(shard -> shard.getIssn().equals(issn))
                .toList();
    }

    public boolean exists(String issn, int year) {
        return Files.isRegularFile(shardPath(issn, year));
    }

    @Cacheable(value = "journalShards", key = "#p0.path.toString()")
    public Map<String, ShardEntry> readShard(ShardFile shard) {
        try {
            Map<String, ShardEntry> entries = objectMapper.readValue(shard.getPath().toFile(), SHARD_TYPE);
            if (entries == null) {
                throw new GraphStorageException("Shard " + shard.getPath() + " holds no entries");
            }
            log.debug("Read {} entries from shard {}", entries.size(), shard.getPath().getFileName());
            return Collections.unmodifiableMap(entries);
        } catch (IOException e) {
            throw new GraphStorageException("Failed to read shard " + shard.getPath(), e);
        }
    }

    @CacheEvict(value = "journalShards", allEntries = true)
    public Path writeShard(String issn, int year, Map<String, ShardEntry> entries) {
        Path target = shardPath(issn, year);
        try {
            Files.createDirectories(directory);
            Path temp = Files.createTempFile(directory, issn + "_" + year, ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), entries);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.info("Wrote shard {} with {} entries", target.getFileName(), entries.size());
            return target;
        } catch (IOException e) {
            throw new GraphStorageException("Failed to write shard " + target, e);
        }
    }

    private Path shardPath(String issn, int year) {
        return directory.resolve(issn + "_" + year + ".json");
    }
}
