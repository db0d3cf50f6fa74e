package com.scholarly.citegraph.service.provider;

import com.scholarly.citegraph.dto.crossref.WorksPage;
import com.scholarly.citegraph.exception.ProviderUnavailableException;
import com.scholarly.citegraph.model.FetchStatus;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CrossRefClientTest {

    private final AtomicReference<ClientRequest> lastRequest = new AtomicReference<>();

    private CrossRefClient client(HttpStatus status, String body) {
        WebClient.Builder builder = WebClient.builder().exchangeFunction(request -> {
            lastRequest.set(request);
            return Mono.just(ClientResponse.create(status)
                    .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                    .body(body)
                    .build());
        });
        return new CrossRefClient(builder, "https://api.crossref.org", "me@example.org", Duration.ofSeconds(5), 1 << 20);
    }

    @Test
    void fetchWorkMapsMessage() {
        CrossRefClient client = client(HttpStatus.OK, """
                {"status": "ok", "message": {"title": ["T"], "author": [{"given": "A", "family": "B"}],
                 "published-print": {"date-parts": [[2021]]}, "reference": [{"DOI": "10.1/r"}]}}
                """);

        ForwardLookup lookup = client.fetchWork("10.1038/s41567-021-01234-5");

        assertThat(lookup.getStatus()).isEqualTo(FetchStatus.OK);
        assertThat(lookup.getMetadata().getYear()).isEqualTo(2021);
        assertThat(lookup.getMetadata().getDoi()).isEqualTo("10.1038/s41567-021-01234-5");
        assertThat(lookup.getReferences()).containsExactly("10.1/r");
        assertThat(lastRequest.get().url().getPath()).isEqualTo("/works/10.1038/s41567-021-01234-5");
        assertThat(lastRequest.get().url().getQuery()).isEqualTo("mailto=me@example.org");
    }

    @Test
    void fetchWorkReportsNotFoundFor404() {
        ForwardLookup lookup = client(HttpStatus.NOT_FOUND, "{}").fetchWork("10.1/missing");

        assertThat(lookup.getStatus()).isEqualTo(FetchStatus.NOT_FOUND);
        assertThat(lookup.getMetadata()).isNull();
    }

    @Test
    void fetchWorkReportsUnavailableForServerErrorsAndBadBodies() {
        assertThat(client(HttpStatus.SERVICE_UNAVAILABLE, "{}").fetchWork("10.1/x").getStatus())
                .isEqualTo(FetchStatus.UNAVAILABLE);
        assertThat(client(HttpStatus.OK, "{\"status\": \"ok\"}").fetchWork("10.1/x").getStatus())
                .isEqualTo(FetchStatus.UNAVAILABLE);
        assertThat(client(HttpStatus.OK, "not json").fetchWork("10.1/x").getStatus())
                .isEqualTo(FetchStatus.UNAVAILABLE);
    }

    @Test
    void fetchJournalWorksFiltersByYearAndReturnsCursor() {
        CrossRefClient client = client(HttpStatus.OK, """
                {"message": {"total-results": 2, "next-cursor": "abc",
                 "items": [{"DOI": "10.1/a"}, {"DOI": "10.1/b"}]}}
                """);

        WorksPage page = client.fetchJournalWorks("2399-3650", 2020, "*", 100);

        assertThat(page.getItems()).hasSize(2);
        assertThat(page.getNextCursor()).isEqualTo("abc");
        assertThat(page.getTotalResults()).isEqualTo(2);
        assertThat(lastRequest.get().url().getPath()).isEqualTo("/journals/2399-3650/works");
        assertThat(lastRequest.get().url().getQuery())
                .contains("filter=from-pub-date:2020-01-01,until-pub-date:2020-12-31")
                .contains("cursor=*")
                .contains("rows=100");
    }

    @Test
    void searchJournalsFailsLoudlyWhenCrossRefIsDown() {
        assertThatThrownBy(() -> client(HttpStatus.BAD_GATEWAY, "{}").searchJournals("Nature", 5))
                .isInstanceOf(ProviderUnavailableException.class)
                .hasMessageContaining("502");
    }

    @Test
    void searchJournalsMapsItems() {
        CrossRefClient client = client(HttpStatus.OK, """
                {"message": {"items": [{"title": "Physical Review Letters", "ISSN": ["0031-9007", "1079-7114"]}]}}
                """);

        assertThat(client.searchJournals("Physical Review Letters", 5))
                .singleElement()
                .satisfies(result -> assertThat(result.getIssns()).contains("0031-9007"));
        assertThat(lastRequest.get().url().getQuery()).contains("query=Physical");
    }
}
