package com.williamcallahan.literature_search_engine.service.source;

import com.williamcallahan.literature_search_engine.testutil.StubExchange;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;

class OsfPreprintsSourceTest {

    private static final String PREPRINTS = """
        {"data": [
          {"id": "abcd1", "attributes": {"title": "Replication of ego depletion", "doi": "10.31234/osf.io/abcd1",
           "date_published": null, "date_created": "2018-06-01T10:00:00"},
           "links": {"html": "https://osf.io/preprints/psyarxiv/abcd1"}},
          {"id": "efgh2", "attributes": {"title": "No links", "doi": "10.31234/osf.io/efgh2", "date_modified": "2020-02-02"}}
        ]}
        """;

    @Test
    void searchFiltersByProviderAndTitle() {
        StubExchange stub = StubExchange.alwaysJson(PREPRINTS);
        OsfPreprintsSource source = new OsfPreprintsSource(stub.client(StubExchange.endpoint(OsfPreprintsSource.NAME, OsfPreprintsSource.BASE_URL)), null);

        StepVerifier.create(source.searchByTitle("ego depletion", 5))
            .assertNext(papers -> {
                assertThat(papers).hasSize(2);
                assertThat(papers.get(0).year()).isEqualTo(2018);
                assertThat(papers.get(0).url()).isEqualTo("https://osf.io/preprints/psyarxiv/abcd1");
                assertThat(papers.get(0).authors()).isEmpty();
                assertThat(papers.get(1).year()).isEqualTo(2020);
                assertThat(papers.get(1).url()).isEqualTo("https://doi.org/10.31234/osf.io/efgh2");
            })
            .verifyComplete();

        assertThat(source.getProvider()).isEqualTo("psyarxiv");
        assertThat(stub.lastUri().getPath()).isEqualTo("/v2/preprints/");
        assertThat(stub.lastUri().getQuery()).contains("filter[provider]=psyarxiv", "filter[title]=ego depletion", "page[size]=5");
    }

    @Test
    void lookupFiltersByDoiWithConfiguredProvider() {
        StubExchange stub = StubExchange.alwaysJson(PREPRINTS);
        OsfPreprintsSource source = new OsfPreprintsSource(stub.client(StubExchange.endpoint(OsfPreprintsSource.NAME, OsfPreprintsSource.BASE_URL)), "socarxiv");

        StepVerifier.create(source.lookupByDoi("10.31234/osf.io/abcd1"))
            .assertNext(paper -> assertThat(paper.title()).isEqualTo("Replication of ego depletion"))
            .verifyComplete();
        assertThat(stub.lastUri().getQuery()).contains("filter[provider]=socarxiv", "filter[doi]=10.31234/osf.io/abcd1", "page[size]=1");
    }
}
