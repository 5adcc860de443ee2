package com.jreinhal.hragent.retrieval;

/**
 * @param province jurisdiction code to restrict passages to, or {@code null} for no restriction
 */
public record RetrievalRequest(String query, double similarityThreshold, int limit, String province) {
}
