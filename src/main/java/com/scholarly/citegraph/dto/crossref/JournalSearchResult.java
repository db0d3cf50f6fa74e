package com.scholarly.citegraph.dto.crossref;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JournalSearchResult {
    private String title;
    private String publisher;
    private List<String> issns;
}
