package com.jreinhal.hragent.analysis;

/**
 * The analysis reply could not be turned into a {@code QueryAnalysisResult}.
 */
public class QueryAnalysisException extends RuntimeException {

    public QueryAnalysisException(String message) {
        super(message);
    }

    public QueryAnalysisException(String message, Throwable cause) {
        super(message, cause);
    }
}
