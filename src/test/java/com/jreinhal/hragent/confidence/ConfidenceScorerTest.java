package com.jreinhal.hragent.confidence;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.jreinhal.hragent.model.ConfidenceLevel;
import com.jreinhal.hragent.model.ContextPassage;
import com.jreinhal.hragent.model.PipelineState;
import com.jreinhal.hragent.settings.AgentSettings;
import com.jreinhal.hragent.settings.AgentSettingsCache;
import com.jreinhal.hragent.settings.AgentSettingsFixtures;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ConfidenceScorerTest {

    private FormulaConfidenceStrategy formula;
    private LlmConfidenceStrategy llm;
    private HybridConfidenceStrategy hybrid;

    @BeforeEach
    void setUp() {
        formula = new FormulaConfidenceStrategy();
        llm = mock(LlmConfidenceStrategy.class);
        hybrid = mock(HybridConfidenceStrategy.class);
    }

    private ConfidenceScorer scorer(AgentSettings settings) {
        return new ConfidenceScorer(AgentSettingsFixtures.cacheOf(settings), formula, llm, hybrid);
    }

    private static PipelineState answeredState() {
        PipelineState state = new PipelineState("Overtime rules?", "MB", "u1", "s1", List.of());
        state.setContextDocuments(List.of(ContextPassage.of("1", "text", "upload", 0.9),
                ContextPassage.of("2", "text", "upload", 0.8),
                ContextPassage.of("3", "text", "upload", 0.76)));
        state.setResponse("r".repeat(250));
        return state;
    }

    @Test
    @DisplayName("Formula method scores and assigns the confidence band")
    void formulaBand() {
        PipelineState state = answeredState();

        scorer(AgentSettingsFixtures.defaults()).apply(state).applyTo(state);

        assertThat(state.getConfidenceMethod()).isEqualTo("formula");
        assertThat(state.getConfidenceLevel()).isEqualTo(ConfidenceLevel.HIGH);
        assertThat(state.getErrors()).isEmpty();
    }

    @Test
    @DisplayName("Configured method selects the strategy")
    void dispatch() {
        when(llm.score(any(), any())).thenReturn(new ConfidenceResult(0.6, ConfidenceMethod.LLM, Map.of()));

        ConfidenceResult result = scorer(AgentSettingsFixtures.defaults())
                .score(new ConfidenceInput("q", "a", List.of()), AgentSettingsFixtures.withMethod("llm"));

        assertThat(result.method()).isEqualTo(ConfidenceMethod.LLM);
        verify(hybrid, never()).score(any(), any());
    }

    @Test
    @DisplayName("Strategy failure yields score 0 tagged error and records the error")
    void strategyFailure() {
        when(hybrid.score(any(), any())).thenThrow(new IllegalStateException("executor gone"));
        PipelineState state = answeredState();

        scorer(AgentSettingsFixtures.withMethod("hybrid")).apply(state).applyTo(state);

        assertThat(state.getConfidenceScore()).isZero();
        assertThat(state.getConfidenceMethod()).isEqualTo("error");
        assertThat(state.getConfidenceLevel()).isEqualTo(ConfidenceLevel.VERY_LOW);
        assertThat(state.getError()).contains("Confidence calculation error: executor gone");
    }

    @Test
    @DisplayName("Unavailable settings yield an error result without a band")
    void settingsUnavailable() {
        AgentSettingsCache cache = mock(AgentSettingsCache.class);
        when(cache.current()).thenThrow(new IllegalStateException("settings store down"));
        PipelineState state = answeredState();

        new ConfidenceScorer(cache, formula, llm, hybrid).apply(state).applyTo(state);

        assertThat(state.getConfidenceMethod()).isEqualTo("error");
        assertThat(state.getConfidenceLevel()).isNull();
    }
}
