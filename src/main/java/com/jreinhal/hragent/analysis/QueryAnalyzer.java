package com.jreinhal.hragent.analysis;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jreinhal.hragent.gateway.LanguageModelGateway;
import com.jreinhal.hragent.gateway.LlmCallOptions;
import com.jreinhal.hragent.gateway.LlmReply;
import com.jreinhal.hragent.gateway.LlmRequest;
import com.jreinhal.hragent.model.PipelineState;
import com.jreinhal.hragent.model.QueryAnalysisResult;
import com.jreinhal.hragent.pipeline.PipelineStage;
import com.jreinhal.hragent.pipeline.StateUpdate;
import com.jreinhal.hragent.prompt.PromptCatalog;
import com.jreinhal.hragent.settings.AgentSettings;
import com.jreinhal.hragent.settings.AgentSettingsCache;
import com.jreinhal.hragent.util.LogSanitizer;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Classifies intent and complexity, extracts entities and proposes retrieval parameters and a
 * route, with one low-temperature model call.
 *
 * <p>Never fails the pipeline: any call, parse or settings failure yields
 * {@link QueryAnalysisResult#fallback(String, String)} and a recorded error.</p>
 */
@Service
public class QueryAnalyzer implements PipelineStage {

    private static final Logger log = LoggerFactory.getLogger(QueryAnalyzer.class);

    private final LanguageModelGateway gateway;
    private final AgentSettingsCache settingsCache;
    private final PromptCatalog promptCatalog;
    private final QueryAnalysisParser parser;

    public QueryAnalyzer(LanguageModelGateway gateway, AgentSettingsCache settingsCache,
                         PromptCatalog promptCatalog, ObjectMapper objectMapper) {
        this.gateway = gateway;
        this.settingsCache = settingsCache;
        this.promptCatalog = promptCatalog;
        this.parser = new QueryAnalysisParser(objectMapper);
    }

    @Override
    public StateUpdate apply(PipelineState state) {
        String query = state.getQuery();
        long start = System.nanoTime();
        LlmReply reply = null;
        try {
            AgentSettings settings = this.settingsCache.current();
            AgentSettings.AnalysisSettings analysis = settings.analysis();
            String model = analysis.model() == null || analysis.model().isBlank()
                    ? settings.model().model()
                    : analysis.model();
            LlmRequest request = LlmRequest.of(
                    this.promptCatalog.render(PromptCatalog.QUERY_ANALYSIS_SYSTEM, settings, Map.of()),
                    this.promptCatalog.render(PromptCatalog.QUERY_ANALYSIS_USER, settings, Map.of("query", query)),
                    LlmCallOptions.of(model, analysis.temperature(), analysis.maxTokens()));

            reply = this.gateway.complete(request);
            double elapsedMs = (System.nanoTime() - start) / 1_000_000.0;
            QueryAnalysisResult result = this.parser.parse(query, reply.text(), elapsedMs);

            log.info("Query analysis complete: intent={}, complexity={}, routing={}, entities={}, time={}ms",
                    result.intent().value(), result.complexity().value(), result.routing().value(),
                    result.entities().size(), Math.round(elapsedMs));
            if (log.isDebugEnabled() && !result.entities().isEmpty()) {
                log.debug("Key entities: {}", result.entities().stream()
                        .limit(3)
                        .map(e -> LogSanitizer.sanitize(e.text()) + "(" + e.type().value() + ")")
                        .collect(Collectors.joining(", ")));
            }
            return StateUpdate.builder()
                    .queryAnalysis(result)
                    .tokenUsage(reply.usage())
                    .build();
        } catch (RuntimeException e) {
            log.error("Query analysis failed for {}: {}", LogSanitizer.querySummary(query),
                    LogSanitizer.sanitize(e.getMessage()), e);
            log.warn("Using fallback query analysis due to error");
            return StateUpdate.builder()
                    .queryAnalysis(QueryAnalysisResult.fallback(query, String.valueOf(e.getMessage())))
                    .tokenUsage(reply == null ? null : reply.usage())
                    .error("Query analysis error (using fallback): " + e.getMessage())
                    .build();
        }
    }
}
