package com.williamcallahan.literature_search_engine.service.source;

import com.williamcallahan.literature_search_engine.model.Paper;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * A public bibliographic API that can be searched by title and/or queried by DOI.
 *
 * <p>Implementations never throw; failures arrive as
 * {@link com.williamcallahan.literature_search_engine.exception.SourceException} error signals.</p>
 */
public interface LiteratureSource {

    /**
     * Short tag stamped on every {@link Paper} this source produces, e.g. {@code crossref}.
     */
    String name();

    /**
     * Free-text title search.
     *
     * @param title query text; blank yields an empty list without any network call
     * @param limit maximum number of records to return
     * @return records in the source's native ranking order
     */
    Mono<List<Paper>> searchByTitle(String title, int limit);

    /**
     * Single-record lookup by DOI.
     *
     * @param doi DOI in any accepted form; it is cleaned before use
     * @return the record, or an empty Mono when the source has no match
     */
    Mono<Paper> lookupByDoi(String doi);
}
