package com.scholarly.citegraph.dto.crossref;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One cursor page of a CrossRef journal works listing.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorksPage {
    private List<JsonNode> items;
    private String nextCursor;
    private long totalResults;
}
