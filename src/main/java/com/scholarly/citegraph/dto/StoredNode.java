package com.scholarly.citegraph.dto;

import com.scholarly.citegraph.model.FetchStatus;
import com.scholarly.citegraph.model.PaperMetadata;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Persisted form of a node record in the flat graph layout.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StoredNode {
    private String id;
    private Integer depth;
    private PaperMetadata metadata;
    private List<String> references;
    private List<String> citedBy;
    private FetchStatus forwardStatus;
    private FetchStatus backwardStatus;
    private Boolean expanded;
}
