package com.scholarly.citegraph.service.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.scholarly.citegraph.dto.ShardEntry;
import com.scholarly.citegraph.dto.ShardPaperInfo;
import com.scholarly.citegraph.dto.crossref.JournalSearchResult;
import com.scholarly.citegraph.model.PaperMetadata;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Converts CrossRef {@code message} objects into the application's model.
 */
public final class CrossRefWorkMapper {

    private static final String[] YEAR_FIELDS = {"published-print", "published-online", "issued"};

    private CrossRefWorkMapper() {
    }

    public static PaperMetadata toMetadata(JsonNode work, String doi) {
        return PaperMetadata.builder()
                .title(title(work))
                .authors(authors(work))
                .year(year(work))
                .doi(doi)
                .journal(firstText(work.path("container-title")))
                .build();
    }

    /**
     * DOIs of the work's reference list, in reference order. References without a DOI are skipped.
     */
    public static List<String> references(JsonNode work) {
        List<String> references = new ArrayList<>();
        for (JsonNode reference : work.path("reference")) {
            String doi = reference.path("DOI").asText("");
            if (!doi.isBlank()) {
                references.add(doi);
            }
        }
        return references;
    }

    public static ShardEntry toShardEntry(JsonNode work) {
        String doi = work.path("DOI").asText("");
        PaperMetadata metadata = toMetadata(work, doi);
        ShardPaperInfo info = ShardPaperInfo.builder()
                .title(metadata.getTitle())
                .authors(metadata.getAuthors())
                .year(metadata.getYear() != null ? metadata.getYear() : PaperMetadata.UNKNOWN)
                .doi(doi)
                .build();
        return new ShardEntry(info, references(work));
    }

    public static JournalSearchResult toJournal(JsonNode item) {
        List<String> issns = new ArrayList<>();
        item.path("ISSN").forEach(issn -> issns.add(issn.asText()));
        String publisher = item.path("publisher").asText("");
        return JournalSearchResult.builder()
                .title(item.path("title").asText(PaperMetadata.UNKNOWN))
                .publisher(publisher.isEmpty() ? null : publisher)
                .issns(issns)
                .build();
    }

    static String title(JsonNode work) {
        String title = firstText(work.path("title"));
        return title == null ? PaperMetadata.UNKNOWN : title;
    }

    static String authors(JsonNode work) {
        List<String> names = new ArrayList<>();
        for (JsonNode author : work.path("author")) {
            String name = List.of(author.path("given").asText(""), author.path("family").asText(""))
                    .stream()
                    .filter(part -> !part.isBlank())
                    .collect(Collectors.joining(" "));
            if (name.isEmpty()) {
                name = author.path("name").asText("");
            }
            if (!name.isEmpty()) {
                names.add(name);
            }
        }
        return names.isEmpty() ? PaperMetadata.UNKNOWN : String.join(", ", names);
    }

    static Integer year(JsonNode work) {
        for (String field : YEAR_FIELDS) {
            JsonNode year = work.path(field).path("date-parts").path(0).path(0);
            if (year.canConvertToInt() && year.isNumber()) {
                return year.intValue();
            }
        }
        return null;
    }

    private static String firstText(JsonNode array) {
        if (array.isArray() && !array.isEmpty()) {
            String text = array.get(0).asText("");
            return text.isBlank() ? null : text;
        }
        if (array.isTextual() && !array.asText().isBlank()) {
            return array.asText();
        }
        return null;
    }
}
