package com.jreinhal.hragent.model;

import java.util.Locale;
import java.util.Map;

/**
 * Processing strategy proposed by query analysis.
 */
public enum RoutingDecision {
    STANDARD_RAG("standard_rag"),
    TOOL_INVOCATION("tool_invocation"),
    MULTI_STEP_REASONING("multi_step_reasoning"),
    DIRECT_ESCALATION("direct_escalation"),
    CACHED_RESPONSE("cached_response");

    // Older analysis prompts emitted a "routing_decision" field with these short names.
    private static final Map<String, RoutingDecision> LEGACY_VALUES = Map.of(
            "retrieval", STANDARD_RAG,
            "tools", TOOL_INVOCATION,
            "direct", CACHED_RESPONSE);

    private final String value;

    RoutingDecision(String value) {
        this.value = value;
    }

    public String value() {
        return this.value;
    }

    /**
     * Lenient lookup: accepts current and legacy names, defaulting to {@link #STANDARD_RAG}.
     */
    public static RoutingDecision fromValue(String value) {
        if (value == null || value.isBlank()) {
            return STANDARD_RAG;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (RoutingDecision decision : values()) {
            if (decision.value.equals(normalized)) {
                return decision;
            }
        }
        return LEGACY_VALUES.getOrDefault(normalized, STANDARD_RAG);
    }
}
