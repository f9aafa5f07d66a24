/**
 * Wires the literature sources and the aggregator
 *
 * @author William Callahan
 *
 * Features:
 * - One rate-limited HTTP client per source over the shared transport
 * - API keys become headers or query parameters depending on the source
 * - Default priority order with an optional allow-list from configuration
 */
package com.williamcallahan.literature_search_engine.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.literature_search_engine.service.LiteratureAggregatorService;
import com.williamcallahan.literature_search_engine.service.SourceRegistration;
import com.williamcallahan.literature_search_engine.service.SourceRequestMonitor;
import com.williamcallahan.literature_search_engine.service.source.BiorxivSource;
import com.williamcallahan.literature_search_engine.service.source.CrossrefSource;
import com.williamcallahan.literature_search_engine.service.source.DoajSource;
import com.williamcallahan.literature_search_engine.service.source.EuropePmcSource;
import com.williamcallahan.literature_search_engine.service.source.LiteratureHttpTransport;
import com.williamcallahan.literature_search_engine.service.source.OpenAlexSource;
import com.williamcallahan.literature_search_engine.service.source.OsfPreprintsSource;
import com.williamcallahan.literature_search_engine.service.source.PlosSource;
import com.williamcallahan.literature_search_engine.service.source.PubMedSource;
import com.williamcallahan.literature_search_engine.service.source.SemanticScholarSource;
import com.williamcallahan.literature_search_engine.service.source.SourceEndpoint;
import com.williamcallahan.literature_search_engine.service.source.SourceHttpClient;
import com.williamcallahan.literature_search_engine.util.ValidationUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

@Slf4j
@Configuration
public class LiteratureSourcesConfig {

    private final LiteratureSourcesProperties properties;
    private final LiteratureHttpTransport transport;
    private final ObjectMapper objectMapper;
    private final SourceRequestMonitor monitor;

    public LiteratureSourcesConfig(LiteratureSourcesProperties properties,
                                   LiteratureHttpTransport transport,
                                   ObjectMapper objectMapper,
                                   SourceRequestMonitor monitor) {
        this.properties = properties;
        this.transport = transport;
        this.objectMapper = objectMapper;
        this.monitor = monitor;
    }

    @Bean
    public CrossrefSource crossrefSource() {
        SourceEndpoint endpoint = endpoint(CrossrefSource.NAME, CrossrefSource.BASE_URL, properties.getCrossref(),
                CrossrefSource.TIMEOUT, CrossrefSource.MIN_INTERVAL)
            .withParam("mailto", properties.getMailto());
        return new CrossrefSource(client(endpoint));
    }

    @Bean
    public OpenAlexSource openAlexSource() {
        SourceEndpoint endpoint = endpoint(OpenAlexSource.NAME, OpenAlexSource.BASE_URL, properties.getOpenalex(),
                OpenAlexSource.TIMEOUT, OpenAlexSource.MIN_INTERVAL)
            .withParam("mailto", properties.getMailto());
        return new OpenAlexSource(client(endpoint));
    }

    @Bean
    public SemanticScholarSource semanticScholarSource() {
        String apiKey = properties.getSemanticScholar().getApiKey();
        SourceEndpoint endpoint = endpoint(SemanticScholarSource.NAME, SemanticScholarSource.BASE_URL, properties.getSemanticScholar(),
                SemanticScholarSource.TIMEOUT, SemanticScholarSource.minInterval(ValidationUtils.hasText(apiKey)))
            .withHeader(SemanticScholarSource.API_KEY_HEADER, apiKey);
        return new SemanticScholarSource(client(endpoint));
    }

    @Bean
    public EuropePmcSource europePmcSource() {
        SourceEndpoint endpoint = endpoint(EuropePmcSource.NAME, EuropePmcSource.BASE_URL, properties.getEuropePmc(),
            EuropePmcSource.TIMEOUT, EuropePmcSource.MIN_INTERVAL);
        return new EuropePmcSource(client(endpoint));
    }

    @Bean
    public PubMedSource pubMedSource() {
        LiteratureSourcesProperties.PubMed pubmed = properties.getPubmed();
        String apiKey = pubmed.getApiKey();
        SourceEndpoint endpoint = endpoint(PubMedSource.NAME, PubMedSource.BASE_URL, pubmed,
                PubMedSource.TIMEOUT, PubMedSource.minInterval(ValidationUtils.hasText(apiKey)))
            .withParam("tool", ValidationUtils.trimToDefault(pubmed.getTool(), PubMedSource.DEFAULT_TOOL))
            .withParam("email", pubmed.getEmail())
            .withParam("api_key", apiKey);
        return new PubMedSource(client(endpoint));
    }

    @Bean
    public PlosSource plosSource() {
        SourceEndpoint endpoint = endpoint(PlosSource.NAME, PlosSource.BASE_URL, properties.getPlos(),
                PlosSource.TIMEOUT, PlosSource.MIN_INTERVAL)
            .withParam("api_key", properties.getPlos().getApiKey());
        return new PlosSource(client(endpoint));
    }

    @Bean
    public OsfPreprintsSource osfPreprintsSource() {
        SourceEndpoint endpoint = endpoint(OsfPreprintsSource.NAME, OsfPreprintsSource.BASE_URL, properties.getOsf(),
            OsfPreprintsSource.TIMEOUT, OsfPreprintsSource.MIN_INTERVAL);
        return new OsfPreprintsSource(client(endpoint), properties.getOsf().getProvider());
    }

    @Bean
    public DoajSource doajSource() {
        String apiKey = properties.getDoaj().getApiKey();
        SourceEndpoint endpoint = endpoint(DoajSource.NAME, DoajSource.BASE_URL, properties.getDoaj(),
                DoajSource.TIMEOUT, DoajSource.MIN_INTERVAL)
            .withHeader(HttpHeaders.AUTHORIZATION, ValidationUtils.hasText(apiKey) ? "Bearer " + apiKey.trim() : null);
        return new DoajSource(client(endpoint));
    }

    @Bean
    public BiorxivSource medrxivSource() {
        return preprintServer(BiorxivSource.MEDRXIV);
    }

    @Bean
    public BiorxivSource biorxivSource() {
        return preprintServer(BiorxivSource.BIORXIV);
    }

    @Bean
    public LiteratureAggregatorService literatureAggregatorService(CrossrefSource crossrefSource,
                                                                   OpenAlexSource openAlexSource,
                                                                   SemanticScholarSource semanticScholarSource,
                                                                   EuropePmcSource europePmcSource,
                                                                   PubMedSource pubMedSource,
                                                                   PlosSource plosSource,
                                                                   OsfPreprintsSource osfPreprintsSource,
                                                                   DoajSource doajSource,
                                                                   @Qualifier("medrxivSource") BiorxivSource medrxivSource,
                                                                   @Qualifier("biorxivSource") BiorxivSource biorxivSource) {
        List<SourceRegistration> defaults = List.of(
            SourceRegistration.titleAndDoi(crossrefSource),
            SourceRegistration.titleAndDoi(openAlexSource),
            SourceRegistration.titleAndDoi(semanticScholarSource),
            SourceRegistration.titleAndDoi(europePmcSource),
            SourceRegistration.titleAndDoi(pubMedSource),
            SourceRegistration.titleAndDoi(plosSource),
            SourceRegistration.titleAndDoi(osfPreprintsSource),
            SourceRegistration.titleAndDoi(doajSource),
            SourceRegistration.doiOnly(medrxivSource),
            SourceRegistration.doiOnly(biorxivSource)
        );
        return new LiteratureAggregatorService(
            filterEnabled(defaults, properties.getEnabledSources()),
            properties.getDefaultLimit(),
            properties.getMaxLimit());
    }

    /**
     * Keeps the registrations named in {@code enabled}, in their default order. Null or empty keeps all.
     */
    static List<SourceRegistration> filterEnabled(List<SourceRegistration> registrations, List<String> enabled) {
        if (enabled == null || enabled.stream().noneMatch(ValidationUtils::hasText)) {
            return registrations;
        }
        Set<String> wanted = enabled.stream()
            .filter(ValidationUtils::hasText)
            .map(name -> name.trim().toLowerCase(Locale.ROOT))
            .collect(Collectors.toCollection(LinkedHashSet::new));
        List<SourceRegistration> kept = new ArrayList<>();
        for (SourceRegistration registration : registrations) {
            if (wanted.remove(registration.name())) {
                kept.add(registration);
            }
        }
        if (!wanted.isEmpty()) {
            log.warn("Ignoring unknown literature sources in literature.enabled-sources: {}", wanted);
        }
        return kept;
    }

    private BiorxivSource preprintServer(String server) {
        SourceEndpoint endpoint = endpoint(server, BiorxivSource.BASE_URL, properties.getBiorxiv(),
            BiorxivSource.TIMEOUT, BiorxivSource.MIN_INTERVAL);
        return new BiorxivSource(client(endpoint), server);
    }

    private SourceEndpoint endpoint(String name, String baseUrl, LiteratureSourcesProperties.Source source,
                                    Duration timeout, Duration minInterval) {
        String userAgent = ValidationUtils.trimToDefault(properties.getUserAgent(), "paper-finder/1.0");
        return SourceEndpoint.of(name, baseUrl, timeout, minInterval, userAgent)
            .withBaseUrl(source.getUrl());
    }

    private SourceHttpClient client(SourceEndpoint endpoint) {
        return new SourceHttpClient(endpoint, transport.webClient(), objectMapper, monitor);
    }
}
