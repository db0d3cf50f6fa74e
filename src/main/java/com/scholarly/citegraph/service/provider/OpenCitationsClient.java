package com.scholarly.citegraph.service.provider;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * OpenCitations COCI client: the works citing a DOI.
 */
@Component
@Slf4j
public class OpenCitationsClient {

    private final WebClient webClient;
    private final Duration timeout;

    public OpenCitationsClient(WebClient.Builder webClientBuilder,
                               @Value("${opencitations.base-url:https://opencitations.net/index/coci/api/v1}") String baseUrl,
                               @Value("${opencitations.access-token:}") String accessToken,
                               @Value("${citegraph.provider.timeout:10s}") Duration timeout) {
        WebClient.Builder builder = webClientBuilder.clone()
                .baseUrl(baseUrl)
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE);
        if (accessToken != null && !accessToken.isBlank()) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, accessToken);
        }
        this.webClient = builder.build();
        this.timeout = timeout;
    }

    public BackwardLookup fetchCiters(String doi) {
        try {
            JsonNode body = webClient.get()
                    .uri(builder -> builder.path("/citations/" + doi).build())
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .timeout(timeout)
                    .block();
            if (body == null || !body.isArray()) {
                log.warn("OpenCitations returned no citation list for {}", doi);
                return BackwardLookup.unavailable();
            }
            return BackwardLookup.found(citers(body));
        } catch (WebClientResponseException.NotFound e) {
            log.debug("OpenCitations has no record for {}", doi);
            return BackwardLookup.notFound();
        } catch (WebClientResponseException e) {
            log.warn("OpenCitations lookup for {} failed with status {}", doi, e.getStatusCode().value());
            return BackwardLookup.unavailable();
        } catch (RuntimeException e) {
            log.warn("OpenCitations lookup for {} failed: {}", doi, e.getMessage());
            return BackwardLookup.unavailable();
        }
    }

    static List<String> citers(JsonNode citations) {
        List<String> citers = new ArrayList<>();
        for (JsonNode citation : citations) {
            String citing = stripScheme(citation.path("citing").asText(""));
            if (!citing.isBlank()) {
                citers.add(citing);
            }
        }
        return citers;
    }

    /**
     * Newer index versions return values such as {@code "coci => 10.1/x"} or {@code "doi:10.1/x omid:br/06"}.
     */
    static String stripScheme(String value) {
        String citing = value.trim();
        int arrow = citing.indexOf("=>");
        if (arrow >= 0) {
            citing = citing.substring(arrow + 2).trim();
        }
        for (String token : citing.split("\\s+")) {
            if (token.startsWith("doi:")) {
                return token.substring("doi:".length());
            }
        }
        return citing.split("\\s+")[0];
    }
}
