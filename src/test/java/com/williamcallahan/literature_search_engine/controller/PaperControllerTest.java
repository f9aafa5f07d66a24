package com.williamcallahan.literature_search_engine.controller;

import com.williamcallahan.literature_search_engine.exception.AggregationException;
import com.williamcallahan.literature_search_engine.exception.SourceException;
import com.williamcallahan.literature_search_engine.model.Paper;
import com.williamcallahan.literature_search_engine.service.LiteratureAggregatorService;
import com.williamcallahan.literature_search_engine.service.SourceRequestMonitor;
import com.williamcallahan.literature_search_engine.service.source.CrossrefSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.ResultActions;
import org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import reactor.core.publisher.Mono;

import java.util.List;

import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.asyncDispatch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class PaperControllerTest {

    @Mock
    private LiteratureAggregatorService aggregatorService;

    @Mock
    private CrossrefSource crossrefSource;

    private SourceRequestMonitor sourceRequestMonitor;

    private MockMvc mockMvc;

    private Paper fixturePaper;

    @BeforeEach
    void setUp() {
        sourceRequestMonitor = new SourceRequestMonitor();
        when(aggregatorService.getDefaultLimit()).thenReturn(5);
        when(aggregatorService.getMaxLimit()).thenReturn(20);
        mockMvc = MockMvcBuilders.standaloneSetup(new PaperController(aggregatorService, crossrefSource, sourceRequestMonitor))
            .build();
        fixturePaper = new Paper("Fixture Paper", 2019, "10.1000/fixture", "https://doi.org/10.1000/fixture",
            "Ada Lovelace, Alan Turing", "crossref", 12);
    }

    @Test
    @DisplayName("GET /api/papers/search returns the aggregated records")
    void searchReturnsResults() throws Exception {
        when(aggregatorService.search("cognitive bias", 5)).thenReturn(Mono.just(List.of(fixturePaper)));

        performAsync(get("/api/papers/search").param("query", "  cognitive bias "))
            .andExpect(status().isOk())
            .andExpect(content().contentType(MediaType.APPLICATION_JSON))
            .andExpect(jsonPath("$.query", equalTo("cognitive bias")))
            .andExpect(jsonPath("$.limit", equalTo(5)))
            .andExpect(jsonPath("$.results", hasSize(1)))
            .andExpect(jsonPath("$.results[0].title", equalTo("Fixture Paper")))
            .andExpect(jsonPath("$.results[0].doi", equalTo("10.1000/fixture")))
            .andExpect(jsonPath("$.results[0].citedBy", equalTo(12)));
    }

    @Test
    void searchCapsLimit() throws Exception {
        when(aggregatorService.search("q", 20)).thenReturn(Mono.just(List.of()));

        performAsync(get("/api/papers/search").param("query", "q").param("limit", "500"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.limit", equalTo(20)))
            .andExpect(jsonPath("$.results", hasSize(0)));
    }

    @Test
    @DisplayName("every source failing maps to 503")
    void aggregationFailureIsServiceUnavailable() throws Exception {
        when(aggregatorService.search("q", 5)).thenReturn(Mono.error(
            new AggregationException("no source returned results", List.of("crossref: timeout"))));

        performAsync(get("/api/papers/search").param("query", "q"))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.status", equalTo(503)))
            .andExpect(jsonPath("$.error", equalTo("Literature sources unavailable")))
            .andExpect(jsonPath("$.message", equalTo("no source returned results")));
    }

    @Test
    void doiLookupReturnsRecord() throws Exception {
        when(aggregatorService.lookupDoi("https://doi.org/10.1000/fixture")).thenReturn(Mono.just(fixturePaper));

        performAsync(get("/api/papers/doi").param("value", "https://doi.org/10.1000/fixture"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.source", equalTo("crossref")));
    }

    @Test
    void doiLookupNotFoundIs404() throws Exception {
        when(aggregatorService.lookupDoi("10.1000/missing")).thenReturn(Mono.empty());

        performAsync(get("/api/papers/doi").param("value", "10.1000/missing"))
            .andExpect(status().isNotFound());
    }

    @Test
    void doiLookupRejectsNonDoi() throws Exception {
        performAsync(get("/api/papers/doi").param("value", "not a doi"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error", equalTo("Invalid request")));
        verify(aggregatorService, never()).lookupDoi(anyString());
    }

    @Test
    void authorSearchUsesCrossref() throws Exception {
        when(crossrefSource.searchByAuthor("Kahneman", 3)).thenReturn(Mono.just(List.of(fixturePaper)));

        performAsync(get("/api/papers/authors/search").param("author", "Kahneman").param("limit", "3"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.query", equalTo("Kahneman")))
            .andExpect(jsonPath("$.results[0].authors", equalTo("Ada Lovelace, Alan Turing")));
    }

    @Test
    void authorSearchFailureIsBadGateway() throws Exception {
        when(crossrefSource.searchByAuthor(anyString(), anyInt()))
            .thenReturn(Mono.error(new SourceException("crossref", "HTTP 500: oops")));

        performAsync(get("/api/papers/authors/search").param("author", "Kahneman"))
            .andExpect(status().isBadGateway())
            .andExpect(jsonPath("$.message", equalTo("crossref: HTTP 500: oops")));
    }

    @Test
    void sourcesListsOrderAndMetrics() throws Exception {
        when(aggregatorService.getTitleSearchOrder()).thenReturn(List.of("crossref", "openalex"));
        when(aggregatorService.getDoiLookupOrder()).thenReturn(List.of("crossref", "openalex", "biorxiv"));
        sourceRequestMonitor.recordFailedRequest("openalex", "timeout");

        mockMvc.perform(get("/api/papers/sources"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.titleSearchOrder", contains("crossref", "openalex")))
            .andExpect(jsonPath("$.doiLookupOrder", hasSize(3)))
            .andExpect(jsonPath("$.metrics.total_failed", equalTo(1)))
            .andExpect(jsonPath("$.metrics.sources.openalex.last_failure", equalTo("timeout")));
    }

    private ResultActions performAsync(MockHttpServletRequestBuilder builder) throws Exception {
        MvcResult result = mockMvc.perform(builder)
            .andExpect(request().asyncStarted())
            .andReturn();
        return mockMvc.perform(asyncDispatch(result));
    }
}
