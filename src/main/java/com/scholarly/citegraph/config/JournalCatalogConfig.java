package com.scholarly.citegraph.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholarly.citegraph.dto.JournalCatalogDocument;
import com.scholarly.citegraph.service.journal.IssnPrefixIndexer;
import com.scholarly.citegraph.service.journal.JournalCatalog;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Builds the {@link JournalCatalog} once at startup from the bundled catalog resource and,
 * when present, the prefix index generated next to the local shard files.
 */
@Configuration
@Slf4j
public class JournalCatalogConfig {

    @Value("${citegraph.journals.catalog:classpath:journals/journal-catalog.json}")
    private String catalogLocation;

    @Value("${citegraph.shards.directory:./journal_data}")
    private String shardDirectory;

    @Bean
    public JournalCatalog journalCatalog(ResourceLoader resourceLoader, ObjectMapper objectMapper) throws IOException {
        Resource resource = resourceLoader.getResource(catalogLocation);
        JournalCatalogDocument document;
        try (InputStream in = resource.getInputStream()) {
            document = objectMapper.readValue(in, JournalCatalogDocument.class);
        }
        JournalCatalog catalog = new JournalCatalog(
                document.getJournals() != null ? document.getJournals() : Map.of(),
                document.getDoiPrefixes() != null ? document.getDoiPrefixes() : Map.of());
        log.info("[Journal Catalog] Loaded {} ISSNs from {}", catalog.knownIssns().size(), catalogLocation);

        Path prefixFile = Path.of(shardDirectory).resolve(IssnPrefixIndexer.PREFIX_FILE_NAME);
        if (Files.isRegularFile(prefixFile)) {
            try {
                Map<String, String> prefixes = objectMapper.readValue(prefixFile.toFile(), new TypeReference<Map<String, String>>() {});
                if (prefixes == null) {
                    log.warn("[Journal Catalog] Ignoring empty prefix index {}", prefixFile);
                } else {
                    catalog = catalog.withDoiPrefixes(prefixes);
                    log.info("[Journal Catalog] Applied {} DOI prefixes from {}", prefixes.size(), prefixFile);
                }
            } catch (IOException e) {
                log.warn("[Journal Catalog] Ignoring unreadable prefix index {}: {}", prefixFile, e.getMessage());
            }
        }
        return catalog;
    }
}
