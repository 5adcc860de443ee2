package com.jreinhal.hragent.retrieval;

import static org.assertj.core.api.Assertions.assertThat;

import com.jreinhal.hragent.model.QueryAnalysisResult;
import com.jreinhal.hragent.model.QueryComplexity;
import com.jreinhal.hragent.model.QueryIntent;
import com.jreinhal.hragent.model.RoutingDecision;
import com.jreinhal.hragent.settings.AgentSettings;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class RetrievalParametersTest {

    private final AgentSettings.SearchSettings search = new AgentSettings.SearchSettings(0.7, 5, 0.5);

    private static QueryAnalysisResult suggesting(int docCount, double threshold) {
        return new QueryAnalysisResult("q", QueryIntent.FACTUAL, 0.9, QueryComplexity.SIMPLE, 0.2, List.of(),
                RoutingDecision.STANDARD_RAG, 0.9, false, false, docCount, threshold, false,
                List.of(), List.of(), List.of(), "", 1.0);
    }

    @Test
    @DisplayName("Strict suggested thresholds are capped")
    void capped() {
        RetrievalParameters params = RetrievalParameters.resolve(suggesting(8, 0.85), search);

        assertThat(params.similarityThreshold()).isEqualTo(0.5);
        assertThat(params.limit()).isEqualTo(8);
    }

    @Test
    @DisplayName("Lenient suggested thresholds are kept")
    void lenientKept() {
        assertThat(RetrievalParameters.resolve(suggesting(3, 0.3), search).similarityThreshold()).isEqualTo(0.3);
    }

    @Test
    @DisplayName("Without analysis the configured defaults apply")
    void noAnalysis() {
        RetrievalParameters params = RetrievalParameters.resolve(null, search);

        assertThat(params.similarityThreshold()).isEqualTo(0.7);
        assertThat(params.limit()).isEqualTo(5);
    }

    @Test
    @DisplayName("Configured threshold bounds the result when below the cap")
    void configuredBelowCap() {
        AgentSettings.SearchSettings strict = new AgentSettings.SearchSettings(0.4, 5, 0.5);

        assertThat(RetrievalParameters.resolve(suggesting(5, 0.45), strict).similarityThreshold()).isEqualTo(0.4);
    }
}
