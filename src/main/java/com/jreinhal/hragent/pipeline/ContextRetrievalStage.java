package com.jreinhal.hragent.pipeline;

import com.jreinhal.hragent.model.ContextPassage;
import com.jreinhal.hragent.model.PipelineState;
import com.jreinhal.hragent.retrieval.ContextRetriever;
import com.jreinhal.hragent.retrieval.RetrievalParameters;
import com.jreinhal.hragent.retrieval.RetrievalRequest;
import com.jreinhal.hragent.settings.AgentSettings;
import com.jreinhal.hragent.settings.AgentSettingsCache;
import com.jreinhal.hragent.util.LogSanitizer;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Retrieves passages for the question, restricted to the request's province. Failures leave the
 * context empty and record an error.
 */
@Component
public class ContextRetrievalStage implements PipelineStage {

    private static final Logger log = LoggerFactory.getLogger(ContextRetrievalStage.class);

    private final ContextRetriever retriever;
    private final AgentSettingsCache settingsCache;

    public ContextRetrievalStage(ContextRetriever retriever, AgentSettingsCache settingsCache) {
        this.retriever = retriever;
        this.settingsCache = settingsCache;
    }

    @Override
    public StateUpdate apply(PipelineState state) {
        try {
            AgentSettings settings = this.settingsCache.current();
            RetrievalParameters params = RetrievalParameters.resolve(state.getQueryAnalysis(), settings.search());
            log.debug("Retrieval parameters for {}: threshold={}, limit={}",
                    LogSanitizer.querySummary(state.getQuery()), params.similarityThreshold(), params.limit());

            List<ContextPassage> passages = this.retriever.retrieve(new RetrievalRequest(
                    state.getQuery(), params.similarityThreshold(), params.limit(), state.getProvince()));
            log.info("Retrieved {} context documents (province={})", passages.size(),
                    state.hasProvince() ? LogSanitizer.sanitize(state.getProvince()) : "NONE");
            return StateUpdate.builder().contextDocuments(passages).build();
        } catch (RuntimeException e) {
            log.error("Context retrieval failed: {}", LogSanitizer.sanitize(e.getMessage()), e);
            return StateUpdate.builder()
                    .contextDocuments(List.of())
                    .error("Context retrieval error: " + e.getMessage())
                    .build();
        }
    }
}
