package com.jreinhal.hragent.model;

import java.util.Locale;

/**
 * What the user is trying to accomplish with a question.
 */
public enum QueryIntent {
    FACTUAL("factual"),
    PROCEDURAL("procedural"),
    TROUBLESHOOTING("troubleshooting"),
    COMPARISON("comparison"),
    DEFINITION("definition"),
    CONCEPTUAL("conceptual"),
    NAVIGATIONAL("navigational"),
    TRANSACTIONAL("transactional"),
    UNKNOWN("unknown");

    private final String value;

    QueryIntent(String value) {
        this.value = value;
    }

    public String value() {
        return this.value;
    }

    /**
     * Resolves a wire value such as {@code "procedural"}.
     *
     * @throws IllegalArgumentException when the value is not a known intent
     */
    public static QueryIntent fromValue(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (QueryIntent intent : values()) {
                if (intent.value.equals(normalized)) {
                    return intent;
                }
            }
        }
        throw new IllegalArgumentException("Unknown query intent: " + value);
    }
}
