package com.scholarly.citegraph.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * On-disk form of the journal catalog resource.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JournalCatalogDocument {
    private Map<String, String> journals;       // ISSN -> journal name
    private Map<String, String> doiPrefixes;    // ISSN -> common DOI prefix
}
