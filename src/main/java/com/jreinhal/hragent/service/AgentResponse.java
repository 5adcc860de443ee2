package com.jreinhal.hragent.service;

import com.jreinhal.hragent.model.ConfidenceLevel;
import com.jreinhal.hragent.model.PipelineState;
import com.jreinhal.hragent.model.SourceCitation;
import com.jreinhal.hragent.model.TokenUsage;
import java.util.List;

/**
 * What the caller gets back for one question.
 *
 * @param error recovered errors joined by {@code "; "}, {@code null} for a clean run
 */
public record AgentResponse(
        String response,
        double confidenceScore,
        String confidenceMethod,
        ConfidenceLevel confidenceLevel,
        boolean escalated,
        String escalationReason,
        List<SourceCitation> sources,
        TokenUsage tokenUsage,
        String sessionId,
        String error
) {
    public AgentResponse {
        sources = sources == null ? List.of() : List.copyOf(sources);
        tokenUsage = tokenUsage == null ? TokenUsage.NONE : tokenUsage;
    }

    public static AgentResponse from(PipelineState state) {
        return new AgentResponse(
                state.getResponse(),
                state.getConfidenceScore() == null ? 0.0 : state.getConfidenceScore(),
                state.getConfidenceMethod(),
                state.getConfidenceLevel() == null ? ConfidenceLevel.VERY_LOW : state.getConfidenceLevel(),
                state.isEscalated(),
                state.getEscalationReason(),
                state.getSources(),
                state.getTokenUsage(),
                state.getSessionId(),
                state.getError());
    }
}
