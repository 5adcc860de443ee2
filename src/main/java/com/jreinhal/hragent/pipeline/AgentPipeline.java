package com.jreinhal.hragent.pipeline;

import com.jreinhal.hragent.analysis.QueryAnalyzer;
import com.jreinhal.hragent.citation.OutputFormatter;
import com.jreinhal.hragent.confidence.ConfidenceScorer;
import com.jreinhal.hragent.confidence.ConfidenceMethod;
import com.jreinhal.hragent.model.ConfidenceLevel;
import com.jreinhal.hragent.model.PipelineState;
import com.jreinhal.hragent.reasoning.ReasoningStep;
import com.jreinhal.hragent.reasoning.ReasoningStep.StepType;
import com.jreinhal.hragent.util.LogSanitizer;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Runs one question through analysis, routing, tools or retrieval, generation, confidence
 * scoring, the escalation decision and citation formatting.
 *
 * <p>Stages recover from their own failures. If one throws anyway, the error is recorded, the
 * stage is marked as failed and the run continues, so every run ends with a response, a score
 * and an escalation decision. Interrupting the executing thread stops the run before the next
 * stage with a {@link PipelineCancelledException}.</p>
 */
@Component
public class AgentPipeline {

    private static final Logger log = LoggerFactory.getLogger(AgentPipeline.class);

    static final String ANALYZE = "analyze";
    static final String TOOLS = "invoke_tools";
    static final String RETRIEVE = "retrieve";
    static final String GENERATE = "generate";
    static final String CONFIDENCE = "calculate_confidence";
    static final String DECIDE = "decide";
    static final String FORMAT = "format_output";

    private final QueryAnalyzer queryAnalyzer;
    private final QueryRouter queryRouter;
    private final ToolInvocationStage toolInvocation;
    private final ContextRetrievalStage contextRetrieval;
    private final ResponseGenerator responseGenerator;
    private final ConfidenceScorer confidenceScorer;
    private final EscalationDecider escalationDecider;
    private final OutputFormatter outputFormatter;

    public AgentPipeline(QueryAnalyzer queryAnalyzer, QueryRouter queryRouter, ToolInvocationStage toolInvocation,
                         ContextRetrievalStage contextRetrieval, ResponseGenerator responseGenerator,
                         ConfidenceScorer confidenceScorer, EscalationDecider escalationDecider,
                         OutputFormatter outputFormatter) {
        this.queryAnalyzer = queryAnalyzer;
        this.queryRouter = queryRouter;
        this.toolInvocation = toolInvocation;
        this.contextRetrieval = contextRetrieval;
        this.responseGenerator = responseGenerator;
        this.confidenceScorer = confidenceScorer;
        this.escalationDecider = escalationDecider;
        this.outputFormatter = outputFormatter;
    }

    /**
     * @throws PipelineCancelledException when the executing thread is interrupted between stages
     */
    public PipelineState run(PipelineState state) {
        log.info("Pipeline start for {} (province={})", LogSanitizer.querySummary(state.getQuery()),
                state.hasProvince() ? LogSanitizer.sanitize(state.getProvince()) : "NONE");

        runStage(state, ANALYZE, StepType.QUERY_ANALYSIS, this.queryAnalyzer);

        checkCancelled(ANALYZE);
        if (route(state) == PipelineBranch.TOOLS) {
            runStage(state, TOOLS, StepType.TOOL_INVOCATION, this.toolInvocation);
        } else {
            runStage(state, RETRIEVE, StepType.RETRIEVAL, this.contextRetrieval);
        }

        runStage(state, GENERATE, StepType.GENERATION, this.responseGenerator);
        if (!state.hasResponse()) {
            state.setResponse(ResponseGenerator.APOLOGY);
        }

        runStage(state, CONFIDENCE, StepType.CONFIDENCE_SCORING, this.confidenceScorer);
        if (state.getConfidenceScore() == null) {
            state.setConfidence(0.0, ConfidenceMethod.ERROR.tag(), Map.of());
        }
        if (state.getConfidenceLevel() == null) {
            state.setConfidenceLevel(ConfidenceLevel.VERY_LOW);
        }

        runStage(state, DECIDE, StepType.ESCALATION_DECISION, this.escalationDecider);
        if (state.getEscalated() == null) {
            state.setEscalation(true, "Decision error: no escalation decision was made");
        }

        runStage(state, FORMAT, StepType.OUTPUT_FORMATTING, this.outputFormatter);

        state.getTrace().addMetric("confidence", state.getConfidenceScore());
        state.getTrace().addMetric("escalated", state.isEscalated());
        state.getTrace().addMetric("total_tokens", state.getTokenUsage().totalTokens());
        state.getTrace().complete();
        log.info("Pipeline complete: {}", state.getTrace().getSummary());
        return state;
    }

    private PipelineBranch route(PipelineState state) {
        long start = System.currentTimeMillis();
        PipelineBranch branch = this.queryRouter.route(state.getQueryAnalysis());
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("branch", branch.name());
        if (state.getQueryAnalysis() != null) {
            data.put("routing", state.getQueryAnalysis().routing().name());
        }
        state.getTrace().addStep(ReasoningStep.of(StepType.QUERY_ROUTING, "Route",
                "Selected " + branch.name(), System.currentTimeMillis() - start, data));
        log.debug("Routing to {}", branch);
        return branch;
    }

    private void runStage(PipelineState state, String name, StepType type, PipelineStage stage) {
        checkCancelled(name);
        long start = System.currentTimeMillis();
        try {
            stage.apply(state).applyTo(state);
            state.getTrace().addStep(ReasoningStep.of(type, name, "completed", System.currentTimeMillis() - start));
        } catch (RuntimeException e) {
            log.error("Stage '{}' failed: {}", name, LogSanitizer.sanitize(e.getMessage()), e);
            state.addError("Stage '" + name + "' error: " + e.getMessage());
            state.markStageFailure(name);
            state.getTrace().addStep(ReasoningStep.of(StepType.ERROR, name, String.valueOf(e.getMessage()),
                    System.currentTimeMillis() - start));
        }
    }

    private static void checkCancelled(String nextStage) {
        if (Thread.currentThread().isInterrupted()) {
            log.info("Pipeline interrupted before stage '{}'", nextStage);
            throw new PipelineCancelledException(nextStage);
        }
    }
}
