package com.williamcallahan.literature_search_engine.service.source;

import com.williamcallahan.literature_search_engine.testutil.StubExchange;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;

class EuropePmcSourceTest {

    private static final String RESULTS = """
        {"hitCount": 2, "resultList": {"result": [
          {"id": "31234567", "source": "MED", "title": "Cognitive bias modification", "authorString": "Smith J, Doe A.",
           "pubYear": "2019", "doi": "10.1016/j.brat.2019.01.001"},
          {"id": "PPR123", "source": "PPR", "title": "A preprint", "pubYear": 2021}
        ]}}
        """;

    private EuropePmcSource source(StubExchange stub) {
        return new EuropePmcSource(stub.client(StubExchange.endpoint(EuropePmcSource.NAME, EuropePmcSource.BASE_URL)));
    }

    @Test
    void titleSearchQuotesTheTitle() {
        StubExchange stub = StubExchange.alwaysJson(RESULTS);

        StepVerifier.create(source(stub).searchByTitle("cognitive bias", 5))
            .assertNext(papers -> {
                assertThat(papers).hasSize(2);
                assertThat(papers.get(0).year()).isEqualTo(2019);
                assertThat(papers.get(0).authors()).isEqualTo("Smith J, Doe A.");
                assertThat(papers.get(0).url()).isEqualTo("https://doi.org/10.1016/j.brat.2019.01.001");
                assertThat(papers.get(1).doi()).isNull();
                assertThat(papers.get(1).url()).isEqualTo("https://europepmc.org/article/PPR/PPR123");
                assertThat(papers.get(1).citedBy()).isNull();
            })
            .verifyComplete();
        assertThat(stub.lastUri().getQuery()).contains("query=TITLE:\"cognitive bias\"", "format=json", "pageSize=5");
    }

    @Test
    void lookupTakesFirstResult() {
        StubExchange stub = StubExchange.alwaysJson(RESULTS);

        StepVerifier.create(source(stub).lookupByDoi("DOI: 10.1016/j.brat.2019.01.001"))
            .assertNext(paper -> assertThat(paper.title()).isEqualTo("Cognitive bias modification"))
            .verifyComplete();
        assertThat(stub.lastUri().getQuery()).contains("query=DOI:10.1016/j.brat.2019.01.001", "pageSize=1");
    }

    @Test
    void lookupWithNoHitsIsNotFound() {
        StubExchange stub = StubExchange.alwaysJson("{\"hitCount\": 0, \"resultList\": {\"result\": []}}");

        StepVerifier.create(source(stub).lookupByDoi("10.1016/none"))
            .verifyComplete();
    }
}
