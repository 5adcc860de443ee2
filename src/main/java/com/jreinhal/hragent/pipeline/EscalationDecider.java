package com.jreinhal.hragent.pipeline;

import com.jreinhal.hragent.model.PipelineState;
import com.jreinhal.hragent.settings.AgentSettingsCache;
import com.jreinhal.hragent.util.LogSanitizer;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Escalates answers whose confidence is below the configured threshold. A score equal to the
 * threshold is accepted. Any failure escalates.
 */
@Component
public class EscalationDecider implements PipelineStage {

    private static final Logger log = LoggerFactory.getLogger(EscalationDecider.class);

    private final AgentSettingsCache settingsCache;

    public EscalationDecider(AgentSettingsCache settingsCache) {
        this.settingsCache = settingsCache;
    }

    @Override
    public StateUpdate apply(PipelineState state) {
        EscalationDecision decision;
        if (state.hasStageFailure()) {
            decision = EscalationDecision.escalate("Pipeline stage '" + state.getFailedStage()
                    + "' failed: " + state.getError());
            log.warn("Escalating after stage failure in '{}'", state.getFailedStage());
        } else {
            try {
                double threshold = this.settingsCache.current().thresholds().escalation();
                decision = decide(state.getConfidenceScore(), threshold);
            } catch (RuntimeException e) {
                log.error("Decision failed: {}", LogSanitizer.sanitize(e.getMessage()), e);
                decision = EscalationDecision.escalate("Decision error: " + e.getMessage());
            }
        }
        return StateUpdate.builder().escalation(decision).build();
    }

    /**
     * @throws IllegalStateException when no confidence score has been computed
     */
    public EscalationDecision decide(Double confidence, double threshold) {
        if (confidence == null) {
            throw new IllegalStateException("confidence score was not computed");
        }
        log.info("Decision: confidence={}, threshold={}", format(confidence), format(threshold));
        if (confidence >= threshold) {
            return EscalationDecision.accept();
        }
        return EscalationDecision.escalate(String.format(Locale.ROOT,
                "Confidence score (%.2f) below threshold (%.2f)", confidence, threshold));
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }
}
