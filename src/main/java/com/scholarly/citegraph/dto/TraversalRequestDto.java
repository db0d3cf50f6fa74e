package com.scholarly.citegraph.dto;

import com.scholarly.citegraph.service.traversal.TraversalDirection;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request to expand the citation neighborhood of a root identifier.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TraversalRequestDto {

    @NotBlank
    private String root;            // DOI of the root paper

    @Min(0)
    private Integer maxDepth;       // defaults to citegraph.traversal.default-depth

    private String resumeFrom;      // name of a stored graph to resume from, optional
    private String label;           // name to store the result under, optional
    private TraversalDirection direction;   // BOTH when absent

    @Builder.Default
    private boolean save = true;    // synchronous runs only; jobs always store their graph
}
