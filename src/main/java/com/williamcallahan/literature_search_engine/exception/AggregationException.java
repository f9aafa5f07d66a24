/**
 * Raised when every consulted source failed and nothing could be returned
 *
 * @author William Callahan
 */

package com.williamcallahan.literature_search_engine.exception;

import java.util.List;

public class AggregationException extends RuntimeException {

    private final List<String> sourceDiagnostics;

    public AggregationException(String message, List<String> sourceDiagnostics) {
        super(message);
        this.sourceDiagnostics = sourceDiagnostics == null ? List.of() : List.copyOf(sourceDiagnostics);
    }

    /**
     * One "source: diagnostic" entry per failed source, in consultation order. Meant for logs,
     * not for callers.
     */
    public List<String> getSourceDiagnostics() {
        return sourceDiagnostics;
    }
}
