package com.jreinhal.hragent.pipeline;

import com.jreinhal.hragent.confidence.ConfidenceResult;
import com.jreinhal.hragent.model.ConfidenceLevel;
import com.jreinhal.hragent.model.ContextPassage;
import com.jreinhal.hragent.model.PipelineState;
import com.jreinhal.hragent.model.QueryAnalysisResult;
import com.jreinhal.hragent.model.SourceCitation;
import com.jreinhal.hragent.model.TokenUsage;
import com.jreinhal.hragent.model.ToolResult;
import java.util.ArrayList;
import java.util.List;

/**
 * Partial state produced by a {@link PipelineStage}. Fields left {@code null} are not touched
 * when the update is applied.
 */
public final class StateUpdate {

    private static final StateUpdate EMPTY = builder().build();

    private final QueryAnalysisResult queryAnalysis;
    private final List<ContextPassage> contextDocuments;
    private final List<ToolResult> toolResults;
    private final String toolInvocationError;
    private final String response;
    private final TokenUsage tokenUsage;
    private final ConfidenceResult confidence;
    private final ConfidenceLevel confidenceLevel;
    private final EscalationDecision escalation;
    private final List<SourceCitation> sources;
    private final List<String> errors;

    private StateUpdate(Builder builder) {
        this.queryAnalysis = builder.queryAnalysis;
        this.contextDocuments = builder.contextDocuments == null ? null : List.copyOf(builder.contextDocuments);
        this.toolResults = builder.toolResults == null ? null : List.copyOf(builder.toolResults);
        this.toolInvocationError = builder.toolInvocationError;
        this.response = builder.response;
        this.tokenUsage = builder.tokenUsage;
        this.confidence = builder.confidence;
        this.confidenceLevel = builder.confidenceLevel;
        this.escalation = builder.escalation;
        this.sources = builder.sources == null ? null : List.copyOf(builder.sources);
        this.errors = List.copyOf(builder.errors);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static StateUpdate empty() {
        return EMPTY;
    }

    public void applyTo(PipelineState state) {
        if (this.queryAnalysis != null) {
            state.setQueryAnalysis(this.queryAnalysis);
        }
        if (this.contextDocuments != null) {
            state.setContextDocuments(this.contextDocuments);
        }
        if (this.toolResults != null) {
            state.setToolResults(this.toolResults);
        }
        if (this.toolInvocationError != null) {
            state.setToolInvocationError(this.toolInvocationError);
        }
        if (this.response != null) {
            state.setResponse(this.response);
        }
        if (this.tokenUsage != null) {
            state.addTokenUsage(this.tokenUsage);
        }
        if (this.confidence != null) {
            state.setConfidence(this.confidence.score(), this.confidence.method().tag(), this.confidence.breakdown());
        }
        if (this.confidenceLevel != null) {
            state.setConfidenceLevel(this.confidenceLevel);
        }
        if (this.escalation != null) {
            state.setEscalation(this.escalation.escalated(), this.escalation.reason());
        }
        if (this.sources != null) {
            state.setSources(this.sources);
        }
        this.errors.forEach(state::addError);
    }

    public QueryAnalysisResult getQueryAnalysis() {
        return queryAnalysis;
    }

    public List<ContextPassage> getContextDocuments() {
        return contextDocuments;
    }

    public List<ToolResult> getToolResults() {
        return toolResults;
    }

    public String getToolInvocationError() {
        return toolInvocationError;
    }

    public String getResponse() {
        return response;
    }

    public TokenUsage getTokenUsage() {
        return tokenUsage;
    }

    public ConfidenceResult getConfidence() {
        return confidence;
    }

    public ConfidenceLevel getConfidenceLevel() {
        return confidenceLevel;
    }

    public EscalationDecision getEscalation() {
        return escalation;
    }

    public List<SourceCitation> getSources() {
        return sources;
    }

    public List<String> getErrors() {
        return errors;
    }

    public static final class Builder {
        private QueryAnalysisResult queryAnalysis;
        private List<ContextPassage> contextDocuments;
        private List<ToolResult> toolResults;
        private String toolInvocationError;
        private String response;
        private TokenUsage tokenUsage;
        private ConfidenceResult confidence;
        private ConfidenceLevel confidenceLevel;
        private EscalationDecision escalation;
        private List<SourceCitation> sources;
        private final List<String> errors = new ArrayList<>();

        private Builder() {
        }

        public Builder queryAnalysis(QueryAnalysisResult queryAnalysis) {
            this.queryAnalysis = queryAnalysis;
            return this;
        }

        public Builder contextDocuments(List<ContextPassage> contextDocuments) {
            this.contextDocuments = contextDocuments;
            return this;
        }

        public Builder toolResults(List<ToolResult> toolResults) {
            this.toolResults = toolResults;
            return this;
        }

        public Builder toolInvocationError(String toolInvocationError) {
            this.toolInvocationError = toolInvocationError;
            return this;
        }

        public Builder response(String response) {
            this.response = response;
            return this;
        }

        public Builder tokenUsage(TokenUsage tokenUsage) {
            this.tokenUsage = tokenUsage;
            return this;
        }

        public Builder confidence(ConfidenceResult confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder confidenceLevel(ConfidenceLevel confidenceLevel) {
            this.confidenceLevel = confidenceLevel;
            return this;
        }

        public Builder escalation(EscalationDecision escalation) {
            this.escalation = escalation;
            return this;
        }

        public Builder sources(List<SourceCitation> sources) {
            this.sources = sources;
            return this;
        }

        public Builder error(String error) {
            if (error != null && !error.isBlank()) {
                this.errors.add(error);
            }
            return this;
        }

        public StateUpdate build() {
            return new StateUpdate(this);
        }
    }
}
