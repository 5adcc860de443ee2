package com.jreinhal.hragent.service;

import com.jreinhal.hragent.model.PipelineState;
import com.jreinhal.hragent.pipeline.AgentPipeline;
import com.jreinhal.hragent.pipeline.PipelineCancelledException;
import com.jreinhal.hragent.util.LogSanitizer;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Entry point for asking the HR policy agent a question.
 */
@Service
public class HrPolicyAgentService {

    private static final Logger log = LoggerFactory.getLogger(HrPolicyAgentService.class);

    private final AgentPipeline pipeline;
    private final ExecutorService agentExecutor;
    private final List<AgentOutcomeListener> listeners;

    public HrPolicyAgentService(AgentPipeline pipeline,
                                @Qualifier("agentExecutor") ExecutorService agentExecutor,
                                ObjectProvider<AgentOutcomeListener> listeners) {
        this(pipeline, agentExecutor, listeners.orderedStream().toList());
    }

    HrPolicyAgentService(AgentPipeline pipeline, ExecutorService agentExecutor, List<AgentOutcomeListener> listeners) {
        this.pipeline = pipeline;
        this.agentExecutor = agentExecutor;
        this.listeners = List.copyOf(listeners);
    }

    public AgentResponse ask(AgentRequest request) {
        return AgentResponse.from(execute(request));
    }

    /**
     * Runs the question on the agent pool. Cancelling the returned future interrupts the run;
     * it stops before its next stage and no listener is notified.
     */
    public CompletableFuture<AgentResponse> askAsync(AgentRequest request) {
        validate(request);
        CompletableFuture<AgentResponse> result = new CompletableFuture<>();
        Future<?> running = this.agentExecutor.submit(() -> {
            try {
                result.complete(ask(request));
            } catch (PipelineCancelledException e) {
                log.info("Agent run cancelled: {}", e.getMessage());
                result.completeExceptionally(e);
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
            }
        });
        result.whenComplete((response, error) -> {
            if (result.isCancelled()) {
                running.cancel(true);
            }
        });
        return result;
    }

    /**
     * Runs the question and returns the full pipeline state, including the query analysis,
     * retrieved passages, confidence breakdown and trace.
     *
     * @throws IllegalArgumentException when the query is blank
     * @throws PipelineCancelledException when the calling thread is interrupted mid-run
     */
    public PipelineState execute(AgentRequest request) {
        validate(request);
        PipelineState state = new PipelineState(request.query(), request.province(), request.userId(),
                request.sessionId(), request.conversationHistory());
        this.pipeline.run(state);
        log.info("Agent answered {} (confidence={}, escalated={})", LogSanitizer.querySummary(request.query()),
                state.getConfidenceScore(), state.isEscalated());
        notifyListeners(state);
        return state;
    }

    private void notifyListeners(PipelineState state) {
        for (AgentOutcomeListener listener : this.listeners) {
            try {
                listener.onOutcome(state);
            } catch (RuntimeException e) {
                log.warn("Outcome listener {} failed: {}", listener.getClass().getSimpleName(),
                        LogSanitizer.sanitize(e.getMessage()), e);
            }
        }
    }

    private static void validate(AgentRequest request) {
        if (request == null || request.query() == null || request.query().isBlank()) {
            throw new IllegalArgumentException("query must not be blank");
        }
    }
}
