package com.jreinhal.hragent.confidence;

import com.jreinhal.hragent.model.TokenUsage;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Same shape for every strategy, so callers never branch on the method afterwards.
 *
 * @param usage tokens spent by the model calls that produced this score
 */
public record ConfidenceResult(double score, ConfidenceMethod method, Map<String, Object> breakdown, TokenUsage usage) {

    public ConfidenceResult {
        breakdown = breakdown == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(breakdown));
        usage = usage == null ? TokenUsage.NONE : usage;
    }

    public ConfidenceResult(double score, ConfidenceMethod method, Map<String, Object> breakdown) {
        this(score, method, breakdown, TokenUsage.NONE);
    }
}
