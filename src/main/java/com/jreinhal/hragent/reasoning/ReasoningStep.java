package com.jreinhal.hragent.reasoning;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One timed entry of a {@link ReasoningTrace}.
 */
public record ReasoningStep(StepType type, String label, String detail, long durationMs, Map<String, Object> data) {

    public ReasoningStep {
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    public static ReasoningStep of(StepType type, String label, String detail, long durationMs) {
        return new ReasoningStep(type, label, detail, durationMs, Map.of());
    }

    public static ReasoningStep of(StepType type, String label, String detail, long durationMs, Map<String, Object> data) {
        return new ReasoningStep(type, label, detail, durationMs, data);
    }

    public enum StepType {
        QUERY_ANALYSIS,
        QUERY_ROUTING,
        TOOL_INVOCATION,
        RETRIEVAL,
        GENERATION,
        CONFIDENCE_SCORING,
        ESCALATION_DECISION,
        OUTPUT_FORMATTING,
        ERROR
    }
}
