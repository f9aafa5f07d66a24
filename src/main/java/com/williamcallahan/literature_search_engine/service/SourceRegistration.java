package com.williamcallahan.literature_search_engine.service;

import com.williamcallahan.literature_search_engine.service.source.LiteratureSource;

import java.util.Objects;

/**
 * One entry of the source priority list, with the operations the aggregator may route to it.
 */
public record SourceRegistration(LiteratureSource source, boolean supportsTitleSearch, boolean supportsDoiLookup) {

    public SourceRegistration {
        Objects.requireNonNull(source, "source");
    }

    public static SourceRegistration titleAndDoi(LiteratureSource source) {
        return new SourceRegistration(source, true, true);
    }

    public static SourceRegistration doiOnly(LiteratureSource source) {
        return new SourceRegistration(source, false, true);
    }

    public String name() {
        return source.name();
    }
}
