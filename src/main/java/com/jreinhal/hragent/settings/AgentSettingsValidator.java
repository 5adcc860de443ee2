package com.jreinhal.hragent.settings;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Load-time rules for settings snapshots. Weights are checked, never normalised.
 */
@Component
public class AgentSettingsValidator {

    public static final double WEIGHT_SUM_TOLERANCE = 0.01;
    static final Set<String> SCORING_METHODS = Set.of("formula", "llm", "hybrid");
    static final int MAX_RESULTS_LIMIT = 50;
    static final long MIN_TIMEOUT_MS = 100L;
    static final long MAX_TIMEOUT_MS = 10_000L;

    public void validate(AgentSettings settings) {
        List<String> violations = new ArrayList<>();
        if (settings == null) {
            throw new InvalidAgentSettingsException(List.of("settings snapshot is missing"));
        }

        AgentSettings.Thresholds thresholds = settings.thresholds();
        if (thresholds == null) {
            violations.add("thresholds are missing");
        } else {
            unitInterval(violations, "thresholds.escalation", thresholds.escalation());
            unitInterval(violations, "thresholds.high", thresholds.high());
            unitInterval(violations, "thresholds.medium", thresholds.medium());
            unitInterval(violations, "thresholds.low", thresholds.low());
        }

        AgentSettings.SearchSettings search = settings.search();
        if (search == null) {
            violations.add("search settings are missing");
        } else {
            unitInterval(violations, "search.similarity-threshold", search.similarityThreshold());
            unitInterval(violations, "search.suggested-threshold-cap", search.suggestedThresholdCap());
            if (search.maxResults() < 1 || search.maxResults() > MAX_RESULTS_LIMIT) {
                violations.add("search.max-results must be between 1 and " + MAX_RESULTS_LIMIT
                        + " but was " + search.maxResults());
            }
        }

        AgentSettings.ConfidenceSettings confidence = settings.confidence();
        if (confidence == null) {
            violations.add("confidence settings are missing");
        } else {
            validateConfidence(violations, confidence);
        }

        if (settings.excerptMaxLength() < 1) {
            violations.add("excerpt.max-length must be positive but was " + settings.excerptMaxLength());
        }

        if (!violations.isEmpty()) {
            throw new InvalidAgentSettingsException(violations);
        }
    }

    private void validateConfidence(List<String> violations, AgentSettings.ConfidenceSettings confidence) {
        String method = confidence.method();
        if (method == null || !SCORING_METHODS.contains(method)) {
            violations.add("confidence.method must be one of " + SCORING_METHODS + " but was " + method);
        }

        AgentSettings.FormulaWeights fw = confidence.formulaWeights();
        if (fw == null) {
            violations.add("confidence.formula-weights are missing");
        } else {
            unitInterval(violations, "confidence.formula-weights.similarity", fw.similarity());
            unitInterval(violations, "confidence.formula-weights.source-quality", fw.sourceQuality());
            unitInterval(violations, "confidence.formula-weights.response-length", fw.responseLength());
            if (Math.abs(fw.sum() - 1.0) > WEIGHT_SUM_TOLERANCE) {
                violations.add(String.format(Locale.ROOT, "confidence.formula-weights must sum to 1.0 but sum to %.3f", fw.sum()));
            }
        }

        AgentSettings.HybridWeights hw = confidence.hybridWeights();
        if (hw == null) {
            violations.add("confidence.hybrid-weights are missing");
        } else {
            unitInterval(violations, "confidence.hybrid-weights.formula", hw.formula());
            unitInterval(violations, "confidence.hybrid-weights.llm", hw.llm());
            if (Math.abs(hw.sum() - 1.0) > WEIGHT_SUM_TOLERANCE) {
                violations.add(String.format(Locale.ROOT, "confidence.hybrid-weights must sum to 1.0 but sum to %.3f", hw.sum()));
            }
        }

        AgentSettings.LlmJudgeSettings llm = confidence.llm();
        if (llm == null) {
            violations.add("confidence.llm settings are missing");
        } else if (llm.timeoutMs() < MIN_TIMEOUT_MS || llm.timeoutMs() > MAX_TIMEOUT_MS) {
            violations.add("confidence.llm.timeout-ms must be between " + MIN_TIMEOUT_MS + " and "
                    + MAX_TIMEOUT_MS + " but was " + llm.timeoutMs());
        }

        AgentSettings.FormulaTuning tuning = confidence.formula();
        if (tuning == null) {
            violations.add("confidence.formula tuning is missing");
        } else {
            unitInterval(violations, "confidence.formula.high-quality-similarity", tuning.highQualitySimilarity());
            if (tuning.partialLengthChars() > tuning.fullLengthChars()) {
                violations.add("confidence.formula.partial-length-chars must not exceed full-length-chars");
            }
        }
    }

    private static void unitInterval(List<String> violations, String name, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            violations.add(name + " must be within [0,1] but was " + value);
        }
    }
}
