package com.scholarly.citegraph.service.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.scholarly.citegraph.dto.crossref.JournalSearchResult;
import com.scholarly.citegraph.dto.crossref.WorksPage;
import com.scholarly.citegraph.exception.ProviderUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriBuilder;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * CrossRef REST API client: work metadata and reference lists, journal search and journal work listings.
 */
@Component
@Slf4j
public class CrossRefClient {

    private final WebClient webClient;
    private final Duration timeout;
    private final String mailto;

    public CrossRefClient(WebClient.Builder webClientBuilder,
                          @Value("${crossref.base-url:https://api.crossref.org}") String baseUrl,
                          @Value("${crossref.mailto:}") String mailto,
                          @Value("${citegraph.provider.timeout:10s}") Duration timeout,
                          @Value("${crossref.max-response-bytes:16777216}") int maxResponseBytes) {
        this.webClient = webClientBuilder.clone()
                .baseUrl(baseUrl)
                .defaultHeader("Accept", MediaType.APPLICATION_JSON_VALUE)
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(maxResponseBytes))
                .build();
        this.mailto = mailto;
        this.timeout = timeout;
    }

    /**
     * Looks up a work by DOI. A 404 is reported as not found; any other failure as unavailable.
     */
    public ForwardLookup fetchWork(String doi) {
        try {
            JsonNode body = webClient.get()
                    .uri(builder -> politeUri(builder.path("/works/" + doi)))
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .timeout(timeout)
                    .block();
            if (body == null || !body.path("message").isObject()) {
                log.warn("CrossRef returned no message for {}", doi);
                return ForwardLookup.unavailable();
            }
            JsonNode work = body.path("message");
            return ForwardLookup.found(CrossRefWorkMapper.toMetadata(work, doi), CrossRefWorkMapper.references(work));
        } catch (WebClientResponseException.NotFound e) {
            log.debug("CrossRef has no record for {}", doi);
            return ForwardLookup.notFound();
        } catch (WebClientResponseException e) {
            log.warn("CrossRef lookup for {} failed with status {}", doi, e.getStatusCode().value());
            return ForwardLookup.unavailable();
        } catch (RuntimeException e) {
            log.warn("CrossRef lookup for {} failed: {}", doi, e.getMessage());
            return ForwardLookup.unavailable();
        }
    }

    public List<JournalSearchResult> searchJournals(String name, int rows) {
        log.info("Searching CrossRef journals for '{}'", name);
        JsonNode body = get(builder -> politeUri(builder.path("/journals")
                .queryParam("query", name)
                .queryParam("rows", rows)), "journal search '" + name + "'");

        List<JournalSearchResult> results = new ArrayList<>();
        for (JsonNode item : body.path("message").path("items")) {
            results.add(CrossRefWorkMapper.toJournal(item));
        }
        log.info("Found {} journals for '{}'", results.size(), name);
        return results;
    }

    /**
     * Fetches one cursor page of the works a journal published in the given year.
     */
    public WorksPage fetchJournalWorks(String issn, int year, String cursor, int rows) {
        String filter = "from-pub-date:" + year + "-01-01,until-pub-date:" + year + "-12-31";
        JsonNode body = get(builder -> politeUri(builder.path("/journals/" + issn + "/works")
                .queryParam("filter", filter)
                .queryParam("rows", rows)
                .queryParam("cursor", cursor)), "works of " + issn + " in " + year);

        JsonNode message = body.path("message");
        List<JsonNode> items = new ArrayList<>();
        message.path("items").forEach(items::add);
        String nextCursor = message.path("next-cursor").asText("");
        return WorksPage.builder()
                .items(items)
                .nextCursor(nextCursor.isEmpty() ? null : nextCursor)
                .totalResults(message.path("total-results").asLong(0))
                .build();
    }

    private JsonNode get(Function<UriBuilder, URI> uri, String description) {
        try {
            JsonNode body = webClient.get()
                    .uri(uri)
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .timeout(timeout)
                    .block();
            if (body == null) {
                throw new ProviderUnavailableException("CrossRef returned an empty body for " + description);
            }
            return body;
        } catch (WebClientResponseException e) {
            throw new ProviderUnavailableException(
                    "CrossRef request for " + description + " failed with status " + e.getStatusCode().value(), e);
        } catch (ProviderUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ProviderUnavailableException("CrossRef request for " + description + " failed: " + e.getMessage(), e);
        }
    }

    private URI politeUri(UriBuilder builder) {
        if (mailto != null && !mailto.isBlank()) {
            builder.queryParam("mailto", mailto);
        }
        return builder.build();
    }
}
