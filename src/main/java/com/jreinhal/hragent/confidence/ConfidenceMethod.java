package com.jreinhal.hragent.confidence;

import java.util.Locale;

/**
 * Tag reported with every confidence score, naming what actually produced it.
 */
public enum ConfidenceMethod {
    FORMULA("formula"),
    LLM("llm"),
    HYBRID("hybrid"),
    /** Hybrid was requested but the LLM branch degraded, so only the formula score is reported. */
    HYBRID_FALLBACK_FORMULA("hybrid_fallback_formula"),
    /** Scoring itself failed; the score is 0. */
    ERROR("error");

    private final String tag;

    ConfidenceMethod(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return this.tag;
    }

    /**
     * Configured strategy for a method name; anything other than {@code llm} or {@code hybrid} selects the formula.
     */
    public static ConfidenceMethod configured(String name) {
        if (name == null) {
            return FORMULA;
        }
        switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "llm":
                return LLM;
            case "hybrid":
                return HYBRID;
            default:
                return FORMULA;
        }
    }
}
