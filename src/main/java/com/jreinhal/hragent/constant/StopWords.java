package com.jreinhal.hragent.constant;

import java.util.Set;

public final class StopWords {
    /**
     * Words ignored when matching question keywords against passage sentences for citation excerpts.
     */
    public static final Set<String> EXCERPT_KEYWORDS = Set.of(
            "the", "a", "an", "and", "or", "but", "in", "on", "at", "to",
            "for", "of", "with", "by", "is", "are", "was", "were", "be",
            "been", "being", "have", "has", "had", "do", "does", "did",
            "will", "would", "could", "should", "may", "might", "must", "can",
            "what", "when", "where", "who", "why", "how", "which", "that",
            "this", "these", "those"
    );

    private StopWords() {
    }
}
