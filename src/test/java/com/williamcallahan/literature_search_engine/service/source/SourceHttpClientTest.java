package com.williamcallahan.literature_search_engine.service.source;

import com.williamcallahan.literature_search_engine.exception.SourceException;
import com.williamcallahan.literature_search_engine.service.SourceRequestMonitor;
import com.williamcallahan.literature_search_engine.testutil.StubExchange;
import io.netty.channel.ConnectTimeoutException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.net.ConnectException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class SourceHttpClientTest {

    private SourceRequestMonitor monitor;

    @BeforeEach
    void setUp() {
        monitor = new SourceRequestMonitor();
    }

    @Test
    void parsesJsonAndSendsIdentityHeaders() {
        StubExchange stub = StubExchange.alwaysJson("{\"ok\": true}");
        SourceEndpoint endpoint = StubExchange.endpoint("crossref", "https://api.example.org/")
            .withParam("mailto", "team@example.org")
            .withHeader("x-api-key", "secret");

        StepVerifier.create(stub.client(endpoint, monitor).getJson("/works", Map.of("rows", 3)))
            .assertNext(node -> assertThat(node.path("ok").asBoolean()).isTrue())
            .verifyComplete();

        assertThat(stub.lastUri().toString()).startsWith("https://api.example.org/works?");
        assertThat(stub.lastUri().getRawQuery()).contains("mailto=team@example.org").contains("rows=3");
        HttpHeaders headers = stub.requests().get(0).headers();
        assertThat(headers.getFirst(HttpHeaders.USER_AGENT)).isEqualTo("paper-finder-test/1.0");
        assertThat(headers.getFirst("x-api-key")).isEqualTo("secret");
        assertThat(successCount("crossref")).isEqualTo(1L);
    }

    @Test
    void blankHeaderAndParamValuesAreNotSent() {
        StubExchange stub = StubExchange.alwaysJson("{}");
        SourceEndpoint endpoint = StubExchange.endpoint("doaj", "https://doaj.example.org")
            .withHeader(HttpHeaders.AUTHORIZATION, null)
            .withParam("api_key", "  ");

        StepVerifier.create(stub.client(endpoint).getJson("", Map.of("q", "x")))
            .expectNextCount(1)
            .verifyComplete();

        assertThat(stub.requests().get(0).headers().containsKey(HttpHeaders.AUTHORIZATION)).isFalse();
        assertThat(stub.lastUri().getRawQuery()).isEqualTo("q=x");
    }

    @Test
    void encodesReservedCharactersInQueryValues() {
        StubExchange stub = StubExchange.alwaysJson("{}");
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("filter[provider]", "psyarxiv");
        params.put("q", "title:\"C++ & you\"");
        params.put("skipped", null);

        StepVerifier.create(stub.client(StubExchange.endpoint("osf", "https://api.example.org")).getJson("/preprints/", params))
            .expectNextCount(1)
            .verifyComplete();

        String rawQuery = stub.lastUri().getRawQuery();
        assertThat(rawQuery).contains("filter%5Bprovider%5D=psyarxiv");
        assertThat(rawQuery).contains("q=title:%22C%2B%2B%20%26%20you%22");
        assertThat(rawQuery).doesNotContain("skipped");
    }

    @Test
    void non2xxBecomesHttpDiagnosticWithTruncatedBody() {
        String body = "x".repeat(400);
        StubExchange stub = StubExchange.alwaysStatus(HttpStatus.SERVICE_UNAVAILABLE, body);

        StepVerifier.create(stub.client(StubExchange.endpoint("openalex", "https://api.example.org"), monitor).getJson("/works", Map.of()))
            .expectErrorSatisfies(error -> {
                assertThat(error).isInstanceOf(SourceException.class);
                SourceException sourceException = (SourceException) error;
                assertThat(sourceException.getSource()).isEqualTo("openalex");
                assertThat(sourceException.getDiagnostic()).isEqualTo("HTTP 503: " + "x".repeat(300));
                assertThat(sourceException.getMessage()).startsWith("openalex: HTTP 503: ");
            })
            .verify();

        assertThat(failedCount("openalex")).isEqualTo(1L);
    }

    @Test
    void notFoundIsEmptyOnlyWhenRequested() {
        StubExchange stub = StubExchange.alwaysStatus(HttpStatus.NOT_FOUND, "{\"message\": \"missing\"}");
        SourceHttpClient client = stub.client(StubExchange.endpoint("crossref", "https://api.example.org"), monitor);

        StepVerifier.create(client.getJson("/works/10.1000/x", Map.of(), true))
            .verifyComplete();
        StepVerifier.create(client.getJson("/works", Map.of()))
            .expectErrorSatisfies(error -> assertThat(((SourceException) error).getDiagnostic()).startsWith("HTTP 404: "))
            .verify();

        @SuppressWarnings("unchecked")
        Map<String, Object> crossref = (Map<String, Object>) sources().get("crossref");
        assertThat(crossref.get("not_found")).isEqualTo(1L);
        assertThat(crossref.get("failed")).isEqualTo(1L);
    }

    @Test
    void slowResponseBecomesTimeout() {
        StubExchange stub = StubExchange.respondingWith(request -> Mono.never());
        SourceEndpoint endpoint = SourceEndpoint.of("pubmed", "https://api.example.org", Duration.ofMillis(50), Duration.ZERO, "ua");

        StepVerifier.create(stub.client(endpoint, monitor).getJson("/esearch.fcgi", Map.of()))
            .expectErrorSatisfies(error -> assertThat(((SourceException) error).getDiagnostic()).isEqualTo(SourceException.TIMEOUT))
            .verify(Duration.ofSeconds(5));
    }

    @Test
    void connectTimeoutBecomesTimeout() {
        StubExchange stub = StubExchange.respondingWith(request ->
            Mono.error(new ConnectTimeoutException("connection timed out: api.example.org/203.0.113.5:443")));

        StepVerifier.create(stub.client(StubExchange.endpoint("doaj", "https://api.example.org"), monitor).getJson("/search", Map.of()))
            .expectErrorSatisfies(error -> assertThat(((SourceException) error).getDiagnostic()).isEqualTo(SourceException.TIMEOUT))
            .verify();
        assertThat(monitor.getMetricsMap().get("total_failed")).isEqualTo(1L);
    }

    @Test
    void transportFailureBecomesNetworkError() {
        StubExchange stub = StubExchange.respondingWith(request -> Mono.error(new ConnectException("Connection refused")));

        StepVerifier.create(stub.client(StubExchange.endpoint("plos", "http://api.example.org")).getJson("", Map.of()))
            .expectErrorSatisfies(error -> {
                assertThat(((SourceException) error).getDiagnostic()).isEqualTo(SourceException.NETWORK_ERROR);
                assertThat(error.getCause()).isNotNull();
            })
            .verify();
    }

    @Test
    void undecodableBodyIsReported() {
        StubExchange stub = StubExchange.alwaysJson("<html>maintenance</html>");

        StepVerifier.create(stub.client(StubExchange.endpoint("doaj", "https://api.example.org")).getJson("/search", Map.of()))
            .expectErrorSatisfies(error -> assertThat(((SourceException) error).getDiagnostic()).isEqualTo(SourceException.UNPARSEABLE))
            .verify();
    }

    @Test
    void emptyBodyIsReported() {
        StubExchange stub = StubExchange.alwaysJson("");

        StepVerifier.create(stub.client(StubExchange.endpoint("doaj", "https://api.example.org")).getJson("/search", Map.of()))
            .expectErrorSatisfies(error -> assertThat(((SourceException) error).getDiagnostic()).isEqualTo(SourceException.UNPARSEABLE))
            .verify();
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> sources() {
        return (Map<String, Object>) monitor.getMetricsMap().get("sources");
    }

    @SuppressWarnings("unchecked")
    private long successCount(String source) {
        return (Long) ((Map<String, Object>) sources().get(source)).get("successful");
    }

    @SuppressWarnings("unchecked")
    private long failedCount(String source) {
        return (Long) ((Map<String, Object>) sources().get(source)).get("failed");
    }
}
