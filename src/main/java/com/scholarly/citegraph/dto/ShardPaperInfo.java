package com.scholarly.citegraph.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Paper info block of a shard entry. Older shards store "unknown" instead of a numeric year.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ShardPaperInfo {
    private String title;
    private String authors;
    private Object year;
    private String doi;

    @JsonIgnore
    public Integer getYearAsInteger() {
        if (year instanceof Number number) {
            return number.intValue();
        }
        if (year instanceof String text && text.matches("\\d{4}")) {
            return Integer.valueOf(text);
        }
        return null;
    }
}
