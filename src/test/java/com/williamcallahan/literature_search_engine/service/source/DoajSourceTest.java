package com.williamcallahan.literature_search_engine.service.source;

import com.williamcallahan.literature_search_engine.testutil.StubExchange;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;

class DoajSourceTest {

    private static final String ARTICLES = """
        {"total": 1, "results": [
          {"id": "a1", "bibjson": {"title": "Open access and bias", "year": "2018",
           "identifier": [{"type": "pissn", "id": "1234-5678"}, {"type": "doi", "id": "10.1000/d1"}],
           "link": [{"type": "fulltext", "url": "https://journal.example/a1"}],
           "author": [{"name": "A"}, "B"]}}
        ]}
        """;

    private static final String NONE = "{\"total\": 0, \"results\": []}";

    private DoajSource source(StubExchange stub) {
        return new DoajSource(stub.client(StubExchange.endpoint(DoajSource.NAME, DoajSource.BASE_URL)));
    }

    @Test
    void fieldedTitleQueryHitsFirst() {
        StubExchange stub = StubExchange.alwaysJson(ARTICLES);

        StepVerifier.create(source(stub).searchByTitle("open access", 5))
            .assertNext(papers -> {
                assertThat(papers).hasSize(1);
                assertThat(papers.get(0).year()).isEqualTo(2018);
                assertThat(papers.get(0).doi()).isEqualTo("10.1000/d1");
                assertThat(papers.get(0).url()).isEqualTo("https://journal.example/a1");
                assertThat(papers.get(0).authors()).isEqualTo("A, B");
            })
            .verifyComplete();

        assertThat(stub.requestCount()).isEqualTo(1);
        assertThat(stub.lastUri().getRawPath()).isEqualTo("/api/v2/search/articles/bibjson.title:%22open%20access%22");
        assertThat(stub.lastUri().getQuery()).isEqualTo("pageSize=5");
    }

    @Test
    void nullAndNamelessAuthorsAreDropped() {
        StubExchange stub = StubExchange.alwaysJson("""
            {"total": 1, "results": [
              {"id": "a2", "bibjson": {"title": "Framing", "author": [{"name": "A"}, null, "B", {"name": null}]}}
            ]}
            """);

        StepVerifier.create(source(stub).searchByTitle("framing", 5))
            .assertNext(papers -> assertThat(papers.get(0).authors()).isEqualTo("A, B"))
            .verifyComplete();
    }

    @Test
    void emptyFieldedQueryFallsBackToFreeText() {
        StubExchange stub = StubExchange.respondingWith(request -> request.url().getRawPath().contains("bibjson")
            ? StubExchange.json(HttpStatus.OK, NONE)
            : StubExchange.json(HttpStatus.OK, ARTICLES));

        StepVerifier.create(source(stub).searchByTitle("open access", 5))
            .assertNext(papers -> assertThat(papers).hasSize(1))
            .verifyComplete();

        assertThat(stub.requestCount()).isEqualTo(2);
        assertThat(stub.lastUri().getRawPath()).isEqualTo("/api/v2/search/articles/open%20access");
    }

    @Test
    void lookupFallsBackToBareDoi() {
        StubExchange stub = StubExchange.respondingWith(request -> request.url().getRawPath().contains("identifier")
            ? StubExchange.json(HttpStatus.OK, NONE)
            : StubExchange.json(HttpStatus.OK, ARTICLES));

        StepVerifier.create(source(stub).lookupByDoi("10.1000/d1"))
            .assertNext(paper -> assertThat(paper.title()).isEqualTo("Open access and bias"))
            .verifyComplete();
        assertThat(stub.requests().get(0).url().getRawPath()).isEqualTo("/api/v2/search/articles/bibjson.identifier.id:%2210.1000%2Fd1%22");
        assertThat(stub.lastUri().getRawPath()).isEqualTo("/api/v2/search/articles/10.1000%2Fd1");
    }

    @Test
    void lookupWithNoHitsAnywhereIsNotFound() {
        StubExchange stub = StubExchange.alwaysJson(NONE);

        StepVerifier.create(source(stub).lookupByDoi("10.1000/none"))
            .verifyComplete();
        assertThat(stub.requestCount()).isEqualTo(2);
    }
}
