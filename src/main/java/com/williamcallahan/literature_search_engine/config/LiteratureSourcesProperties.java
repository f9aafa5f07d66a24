/**
 * Literature source configuration properties
 *
 * @author William Callahan
 *
 * Features:
 * - Shared user agent and Crossref/OpenAlex polite-pool mailto
 * - Per-source base URL overrides and optional API keys
 * - NCBI tool/email and OSF preprint provider settings
 * - Optional allow-list restricting which sources are consulted
 */

package com.williamcallahan.literature_search_engine.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "literature")
public class LiteratureSourcesProperties {
    private String userAgent = "paper-finder/1.0";
    private String mailto = "";
    private int defaultLimit = 5;
    private int maxLimit = 20;
    /** Source tags to register; default priority order is kept, empty means all. */
    private List<String> enabledSources = new ArrayList<>();

    @NestedConfigurationProperty
    private Transport transport = new Transport();

    @NestedConfigurationProperty
    private Source crossref = new Source();
    @NestedConfigurationProperty
    private Source openalex = new Source();
    @NestedConfigurationProperty
    private Source semanticScholar = new Source();
    @NestedConfigurationProperty
    private Source europePmc = new Source();
    @NestedConfigurationProperty
    private PubMed pubmed = new PubMed();
    @NestedConfigurationProperty
    private Source plos = new Source();
    @NestedConfigurationProperty
    private Osf osf = new Osf();
    @NestedConfigurationProperty
    private Source doaj = new Source();
    @NestedConfigurationProperty
    private Source biorxiv = new Source();

    public String getUserAgent() { return userAgent; }
    public void setUserAgent(String userAgent) { this.userAgent = userAgent; }

    public String getMailto() { return mailto; }
    public void setMailto(String mailto) { this.mailto = mailto; }

    public int getDefaultLimit() { return defaultLimit; }
    public void setDefaultLimit(int defaultLimit) { this.defaultLimit = defaultLimit; }

    public int getMaxLimit() { return maxLimit; }
    public void setMaxLimit(int maxLimit) { this.maxLimit = maxLimit; }

    public List<String> getEnabledSources() { return enabledSources; }
    public void setEnabledSources(List<String> enabledSources) { this.enabledSources = enabledSources; }

    public Transport getTransport() { return transport; }
    public void setTransport(Transport transport) { this.transport = transport; }

    public Source getCrossref() { return crossref; }
    public void setCrossref(Source crossref) { this.crossref = crossref; }

    public Source getOpenalex() { return openalex; }
    public void setOpenalex(Source openalex) { this.openalex = openalex; }

    public Source getSemanticScholar() { return semanticScholar; }
    public void setSemanticScholar(Source semanticScholar) { this.semanticScholar = semanticScholar; }

    public Source getEuropePmc() { return europePmc; }
    public void setEuropePmc(Source europePmc) { this.europePmc = europePmc; }

    public PubMed getPubmed() { return pubmed; }
    public void setPubmed(PubMed pubmed) { this.pubmed = pubmed; }

    public Source getPlos() { return plos; }
    public void setPlos(Source plos) { this.plos = plos; }

    public Osf getOsf() { return osf; }
    public void setOsf(Osf osf) { this.osf = osf; }

    public Source getDoaj() { return doaj; }
    public void setDoaj(Source doaj) { this.doaj = doaj; }

    public Source getBiorxiv() { return biorxiv; }
    public void setBiorxiv(Source biorxiv) { this.biorxiv = biorxiv; }

    public static class Transport {
        private Duration connectTimeout = Duration.ofSeconds(5);
        private int maxConnections = 50;

        public Duration getConnectTimeout() { return connectTimeout; }
        public void setConnectTimeout(Duration connectTimeout) { this.connectTimeout = connectTimeout; }

        public int getMaxConnections() { return maxConnections; }
        public void setMaxConnections(int maxConnections) { this.maxConnections = maxConnections; }
    }

    public static class Source {
        /** Overrides the source's public base URL when set. */
        private String url = "";
        private String apiKey = "";

        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }

        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }
    }

    public static class PubMed extends Source {
        private String tool = "paper-finder";
        private String email = "";

        public String getTool() { return tool; }
        public void setTool(String tool) { this.tool = tool; }

        public String getEmail() { return email; }
        public void setEmail(String email) { this.email = email; }
    }

    public static class Osf extends Source {
        private String provider = "psyarxiv";

        public String getProvider() { return provider; }
        public void setProvider(String provider) { this.provider = provider; }
    }
}
