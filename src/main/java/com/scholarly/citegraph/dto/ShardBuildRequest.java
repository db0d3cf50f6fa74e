package com.scholarly.citegraph.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ShardBuildRequest {

    @NotEmpty
    private List<String> issns;

    @NotNull
    @Min(1800)
    private Integer startYear;

    @NotNull
    @Min(1800)
    private Integer endYear;

    private boolean overwrite;      // rebuild shards that already exist
}
