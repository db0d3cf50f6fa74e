package com.scholarly.citegraph.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;

/**
 * Root document of the flat graph layout: {@code {root, savedAt, nodes: {id: node}}}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StoredGraphDocument {
    private String root;
    private String savedAt;
    private LinkedHashMap<String, StoredNode> nodes;
}
