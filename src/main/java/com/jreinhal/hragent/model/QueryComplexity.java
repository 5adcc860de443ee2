package com.jreinhal.hragent.model;

import java.util.Locale;

public enum QueryComplexity {
    /** Single fact, direct answer */
    SIMPLE("simple"),
    /** Synthesis of two to five facts */
    MODERATE("moderate"),
    /** Multi-step reasoning */
    COMPLEX("complex"),
    VERY_COMPLEX("very_complex");

    private final String value;

    QueryComplexity(String value) {
        this.value = value;
    }

    public String value() {
        return this.value;
    }

    public static QueryComplexity fromValue(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT).replace(' ', '_');
            for (QueryComplexity complexity : values()) {
                if (complexity.value.equals(normalized)) {
                    return complexity;
                }
            }
        }
        throw new IllegalArgumentException("Unknown query complexity: " + value);
    }
}
