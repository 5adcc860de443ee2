package com.jreinhal.hragent.settings;

import com.jreinhal.hragent.model.ConfidenceLevel;
import java.util.List;
import java.util.Map;

/**
 * Immutable snapshot of every tunable value the pipeline reads.
 *
 * <p>Stages obtain the active snapshot from {@link AgentSettingsCache#current()} at the start
 * of their work and never keep it between requests.</p>
 */
public record AgentSettings(
        Thresholds thresholds,
        ModelSettings model,
        AnalysisSettings analysis,
        SearchSettings search,
        ConfidenceSettings confidence,
        int excerptMaxLength,
        ToolSettings tools,
        Map<String, String> prompts) {

    public AgentSettings {
        prompts = prompts == null ? Map.of() : Map.copyOf(prompts);
    }

    public record Thresholds(double escalation, double high, double medium, double low) {

        public ConfidenceLevel levelFor(double score) {
            if (score >= high) {
                return ConfidenceLevel.HIGH;
            }
            if (score >= medium) {
                return ConfidenceLevel.MEDIUM;
            }
            if (score >= low) {
                return ConfidenceLevel.LOW;
            }
            return ConfidenceLevel.VERY_LOW;
        }
    }

    public record ModelSettings(String model, double temperature, int maxTokens, double topP,
                                double frequencyPenalty, double presencePenalty) {
    }

    public record AnalysisSettings(String model, double temperature, int maxTokens) {
    }

    public record SearchSettings(double similarityThreshold, int maxResults, double suggestedThresholdCap) {
    }

    public record FormulaWeights(double similarity, double sourceQuality, double responseLength) {

        public double sum() {
            return similarity + sourceQuality + responseLength;
        }
    }

    public record HybridWeights(double formula, double llm) {

        public double sum() {
            return formula + llm;
        }
    }

    public record LlmJudgeSettings(String model, double temperature, int maxTokens, long timeoutMs) {
    }

    public record FormulaTuning(double highQualitySimilarity, int fullLengthChars, int partialLengthChars) {
    }

    public record ConfidenceSettings(String method, FormulaWeights formulaWeights, HybridWeights hybridWeights,
                                     LlmJudgeSettings llm, FormulaTuning formula) {
    }

    public record ToolSettings(List<String> enabled, double planningTemperature) {

        public ToolSettings {
            enabled = enabled == null ? List.of() : List.copyOf(enabled);
        }
    }
}
