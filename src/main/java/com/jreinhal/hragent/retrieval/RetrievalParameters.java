package com.jreinhal.hragent.retrieval;

import com.jreinhal.hragent.model.QueryAnalysisResult;
import com.jreinhal.hragent.settings.AgentSettings;

/**
 * Threshold and result count for one retrieval.
 */
public record RetrievalParameters(double similarityThreshold, int limit) {

    /**
     * With an analysis, its suggested count is the limit and the threshold is the suggested
     * threshold capped at {@code suggestedThresholdCap}, then bounded by the configured default.
     * Without one, the configured defaults apply.
     */
    public static RetrievalParameters resolve(QueryAnalysisResult analysis, AgentSettings.SearchSettings search) {
        if (analysis == null) {
            return new RetrievalParameters(search.similarityThreshold(), search.maxResults());
        }
        double capped = Math.min(analysis.suggestedSimilarityThreshold(), search.suggestedThresholdCap());
        double threshold = Math.min(capped, search.similarityThreshold());
        return new RetrievalParameters(threshold, analysis.suggestedDocCount());
    }
}
