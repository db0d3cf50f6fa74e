package com.scholarly.citegraph.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One paper of a journal/year shard file, keyed by DOI in the file.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ShardEntry {
    private ShardPaperInfo info;
    private List<String> references;
}
