package com.jreinhal.hragent.model;

import com.jreinhal.hragent.reasoning.ReasoningTrace;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Per-request accumulator filled stage by stage by the agent pipeline.
 *
 * <p>One instance is created for each request and discarded once the response has been
 * built. It is never shared between concurrent executions, so it carries no synchronization.
 * {@code queryAnalysis} and {@code response} may be assigned once only.</p>
 */
public class PipelineState {

    private final String query;
    private final String province;
    private final String userId;
    private final String sessionId;
    private final List<ConversationMessage> conversationHistory;
    private final ReasoningTrace trace;

    private QueryAnalysisResult queryAnalysis;
    private final List<ContextPassage> contextDocuments = new ArrayList<>();
    private final List<ToolResult> toolResults = new ArrayList<>();
    private String toolInvocationError;
    private String response;
    private TokenUsage tokenUsage = TokenUsage.NONE;
    private Double confidenceScore;
    private String confidenceMethod;
    private Map<String, Object> confidenceBreakdown = Map.of();
    private ConfidenceLevel confidenceLevel;
    private Boolean escalated;
    private String escalationReason;
    private List<SourceCitation> sources = List.of();
    private final List<String> errors = new ArrayList<>();
    private String failedStage;

    public PipelineState(String query, String province, String userId, String sessionId,
                         List<ConversationMessage> conversationHistory) {
        this.query = Objects.requireNonNull(query, "query");
        this.province = province;
        this.userId = userId;
        this.sessionId = sessionId;
        this.conversationHistory = conversationHistory == null ? List.of() : List.copyOf(conversationHistory);
        this.trace = new ReasoningTrace(sessionId);
    }

    public String getQuery() {
        return query;
    }

    public String getProvince() {
        return province;
    }

    public boolean hasProvince() {
        return province != null && !province.isBlank();
    }

    public String getUserId() {
        return userId;
    }

    public String getSessionId() {
        return sessionId;
    }

    public List<ConversationMessage> getConversationHistory() {
        return conversationHistory;
    }

    public ReasoningTrace getTrace() {
        return trace;
    }

    public QueryAnalysisResult getQueryAnalysis() {
        return queryAnalysis;
    }

    public void setQueryAnalysis(QueryAnalysisResult queryAnalysis) {
        if (this.queryAnalysis != null) {
            throw new IllegalStateException("query analysis already set");
        }
        this.queryAnalysis = queryAnalysis;
    }

    public List<ContextPassage> getContextDocuments() {
        return Collections.unmodifiableList(contextDocuments);
    }

    public void setContextDocuments(List<ContextPassage> documents) {
        contextDocuments.clear();
        if (documents != null) {
            contextDocuments.addAll(documents);
        }
    }

    public List<ToolResult> getToolResults() {
        return Collections.unmodifiableList(toolResults);
    }

    public void setToolResults(List<ToolResult> results) {
        toolResults.clear();
        if (results != null) {
            toolResults.addAll(results);
        }
    }

    public String getToolInvocationError() {
        return toolInvocationError;
    }

    public void setToolInvocationError(String toolInvocationError) {
        this.toolInvocationError = toolInvocationError;
    }

    public String getResponse() {
        return response;
    }

    public boolean hasResponse() {
        return response != null;
    }

    public void setResponse(String response) {
        if (this.response != null) {
            throw new IllegalStateException("response already set");
        }
        this.response = response;
    }

    public TokenUsage getTokenUsage() {
        return tokenUsage;
    }

    public void addTokenUsage(TokenUsage usage) {
        if (usage != null) {
            this.tokenUsage = this.tokenUsage.plus(usage);
        }
    }

    public Double getConfidenceScore() {
        return confidenceScore;
    }

    public String getConfidenceMethod() {
        return confidenceMethod;
    }

    public Map<String, Object> getConfidenceBreakdown() {
        return confidenceBreakdown;
    }

    public void setConfidence(double score, String method, Map<String, Object> breakdown) {
        this.confidenceScore = score;
        this.confidenceMethod = method;
        this.confidenceBreakdown = breakdown == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(breakdown));
    }

    public ConfidenceLevel getConfidenceLevel() {
        return confidenceLevel;
    }

    public void setConfidenceLevel(ConfidenceLevel confidenceLevel) {
        this.confidenceLevel = confidenceLevel;
    }

    public Boolean getEscalated() {
        return escalated;
    }

    public boolean isEscalated() {
        return Boolean.TRUE.equals(escalated);
    }

    public String getEscalationReason() {
        return escalationReason;
    }

    public void setEscalation(boolean escalated, String reason) {
        this.escalated = escalated;
        this.escalationReason = reason;
    }

    public List<SourceCitation> getSources() {
        return sources;
    }

    public void setSources(List<SourceCitation> sources) {
        this.sources = sources == null ? List.of() : List.copyOf(sources);
    }

    public List<String> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    public void addError(String error) {
        if (error != null && !error.isBlank()) {
            errors.add(error);
        }
    }

    /**
     * All recovered errors joined by {@code "; "}, or {@code null} when the run was clean.
     */
    public String getError() {
        return errors.isEmpty() ? null : String.join("; ", errors);
    }

    public String getFailedStage() {
        return failedStage;
    }

    public boolean hasStageFailure() {
        return failedStage != null;
    }

    public void markStageFailure(String stage) {
        if (this.failedStage == null) {
            this.failedStage = stage;
        }
    }
}
