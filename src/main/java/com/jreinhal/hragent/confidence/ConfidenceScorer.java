package com.jreinhal.hragent.confidence;

import com.jreinhal.hragent.model.PipelineState;
import com.jreinhal.hragent.pipeline.PipelineStage;
import com.jreinhal.hragent.pipeline.StateUpdate;
import com.jreinhal.hragent.settings.AgentSettings;
import com.jreinhal.hragent.settings.AgentSettingsCache;
import com.jreinhal.hragent.util.LogSanitizer;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Scores the generated answer with the configured strategy and assigns its confidence band.
 *
 * <p>Never throws: the last resort is a score of 0 tagged {@link ConfidenceMethod#ERROR}.</p>
 */
@Service
public class ConfidenceScorer implements PipelineStage {

    private static final Logger log = LoggerFactory.getLogger(ConfidenceScorer.class);

    private final AgentSettingsCache settingsCache;
    private final FormulaConfidenceStrategy formula;
    private final LlmConfidenceStrategy llm;
    private final HybridConfidenceStrategy hybrid;

    public ConfidenceScorer(AgentSettingsCache settingsCache, FormulaConfidenceStrategy formula,
                            LlmConfidenceStrategy llm, HybridConfidenceStrategy hybrid) {
        this.settingsCache = settingsCache;
        this.formula = formula;
        this.llm = llm;
        this.hybrid = hybrid;
    }

    @Override
    public StateUpdate apply(PipelineState state) {
        ConfidenceInput input = new ConfidenceInput(state.getQuery(), state.getResponse(), state.getContextDocuments());
        ConfidenceResult result;
        AgentSettings settings = null;
        try {
            settings = this.settingsCache.current();
            result = score(input, settings);
        } catch (RuntimeException e) {
            log.error("Confidence calculation failed: {}", LogSanitizer.sanitize(e.getMessage()), e);
            result = new ConfidenceResult(0.0, ConfidenceMethod.ERROR, Map.of("error", String.valueOf(e.getMessage())));
        }
        StateUpdate.Builder update = StateUpdate.builder()
                .confidence(result)
                .tokenUsage(result.usage());
        if (settings != null) {
            update.confidenceLevel(settings.thresholds().levelFor(result.score()));
        }
        if (result.method() == ConfidenceMethod.ERROR) {
            update.error("Confidence calculation error: " + result.breakdown().get("error"));
        }
        return update.build();
    }

    public ConfidenceResult score(ConfidenceInput input, AgentSettings settings) {
        String configured = settings.confidence().method();
        ConfidenceMethod method = ConfidenceMethod.configured(configured);
        if (method == ConfidenceMethod.FORMULA && !"formula".equals(configured)) {
            log.error("Unknown confidence method: {}, falling back to formula", LogSanitizer.sanitize(configured));
        }
        log.info("Calculating confidence score (method={})", method.tag());
        switch (method) {
            case LLM:
                return this.llm.score(input, settings);
            case HYBRID:
                return this.hybrid.score(input, settings);
            default:
                return this.formula.score(input, settings);
        }
    }
}
