package com.scholarly.citegraph.config;

import com.scholarly.citegraph.repository.JournalShardRepository;
import com.scholarly.citegraph.service.journal.JournalCatalog;
import com.scholarly.citegraph.service.provider.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Locale;

/**
 * Selects the {@link MetadataProvider} the traversal engine talks to.
 */
@Configuration
@Slf4j
public class ProviderConfig {

    @Value("${citegraph.provider.mode:live}")
    private String mode;

    @Bean
    public MetadataProvider metadataProvider(CrossRefClient crossRefClient,
                                             OpenCitationsClient openCitationsClient,
                                             JournalShardRepository shardRepository,
                                             JournalCatalog journalCatalog) {
        ProviderMode providerMode = ProviderMode.valueOf(mode.trim().toUpperCase(Locale.ROOT));
        log.info("[Provider] Using {} metadata provider", providerMode);
        return switch (providerMode) {
            case LIVE -> new LiveMetadataProvider(crossRefClient, openCitationsClient);
            case LOCAL -> new LocalShardMetadataProvider(shardRepository, journalCatalog);
            case HYBRID -> new FallbackMetadataProvider(
                    new LocalShardMetadataProvider(shardRepository, journalCatalog),
                    new LiveMetadataProvider(crossRefClient, openCitationsClient));
        };
    }
}
