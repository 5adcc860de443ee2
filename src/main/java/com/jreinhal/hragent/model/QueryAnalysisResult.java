package com.jreinhal.hragent.model;

import java.util.List;

/**
 * Intent, complexity, entities and retrieval hints derived from one user question.
 */
public record QueryAnalysisResult(
        String originalQuery,
        QueryIntent intent,
        double intentConfidence,
        QueryComplexity complexity,
        double complexityScore,
        List<ExtractedEntity> entities,
        RoutingDecision routing,
        double routingConfidence,
        boolean requiresRecentContext,
        boolean requiresMultipleSources,
        int suggestedDocCount,
        double suggestedSimilarityThreshold,
        boolean requiresTools,
        List<String> suggestedTools,
        List<String> keyConcepts,
        List<String> queryTopics,
        String analysisReasoning,
        double analysisTimeMs) {

    public static final int MIN_DOC_COUNT = 1;
    public static final int MAX_DOC_COUNT = 20;

    public QueryAnalysisResult {
        entities = entities == null ? List.of() : List.copyOf(entities);
        suggestedTools = suggestedTools == null ? List.of() : List.copyOf(suggestedTools);
        keyConcepts = keyConcepts == null ? List.of() : List.copyOf(keyConcepts);
        queryTopics = queryTopics == null ? List.of() : List.copyOf(queryTopics);
        analysisReasoning = analysisReasoning == null ? "" : analysisReasoning;
    }

    /**
     * Deterministic analysis used whenever the model reply cannot be obtained or parsed.
     * It routes to standard retrieval and asks for several sources so the rest of the
     * pipeline can still answer.
     */
    public static QueryAnalysisResult fallback(String query, String cause) {
        return new QueryAnalysisResult(
                query,
                QueryIntent.UNKNOWN,
                0.0,
                QueryComplexity.MODERATE,
                0.5,
                List.of(),
                RoutingDecision.STANDARD_RAG,
                0.5,
                false,
                true,
                5,
                0.7,
                false,
                List.of(),
                List.of(),
                List.of(),
                "Fallback analysis due to error: " + cause,
                0.0);
    }
}
