package com.scholarly.citegraph.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Bibliographic metadata of a single work as returned by a provider.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class PaperMetadata {

    public static final String UNKNOWN = "unknown";

    String title;
    String authors;
    Integer year;       // null when the provider has no print/online date
    String doi;         // raw identifier the provider was asked for
    String journal;     // container title, optional

    public static PaperMetadata unknown(String doi) {
        return PaperMetadata.builder()
                .title(UNKNOWN)
                .authors(UNKNOWN)
                .doi(doi)
                .build();
    }
}
