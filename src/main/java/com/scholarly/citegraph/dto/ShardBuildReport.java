package com.scholarly.citegraph.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Outcome of a shard build, one entry per ISSN and year.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ShardBuildReport {

    private int written;
    private int skipped;
    private int failed;
    private List<ShardOutcome> shards;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ShardOutcome {
        private String issn;
        private int year;
        private String status;          // WRITTEN, SKIPPED, FAILED
        private int articles;
        private String errorMessage;    // If FAILED
    }
}
