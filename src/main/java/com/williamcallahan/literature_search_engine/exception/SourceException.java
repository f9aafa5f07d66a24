/**
 * Failure of a single literature source call
 *
 * @author William Callahan
 *
 * Features:
 * - Carries the source name and a short diagnostic ("HTTP 503: ...", "timeout", "network error")
 * - Recovered from by the aggregator, which moves on to the next source
 */

package com.williamcallahan.literature_search_engine.exception;

public class SourceException extends RuntimeException {

    public static final String TIMEOUT = "timeout";
    public static final String NETWORK_ERROR = "network error";
    public static final String UNPARSEABLE = "unparseable response";

    private final String source;
    private final String diagnostic;

    public SourceException(String source, String diagnostic) {
        super(source + ": " + diagnostic);
        this.source = source;
        this.diagnostic = diagnostic;
    }

    public SourceException(String source, String diagnostic, Throwable cause) {
        super(source + ": " + diagnostic, cause);
        this.source = source;
        this.diagnostic = diagnostic;
    }

    public String getSource() {
        return source;
    }

    public String getDiagnostic() {
        return diagnostic;
    }
}
