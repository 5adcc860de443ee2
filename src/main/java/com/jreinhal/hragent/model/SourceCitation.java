package com.jreinhal.hragent.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A deduplicated, display-ready reference to a source document.
 *
 * @param source     readable document name, unique within one response
 * @param excerpt    the part of the passage that best matches the question
 * @param similarity similarity of the best passage from this document
 */
public record SourceCitation(String source, String excerpt, double similarity, String timestamp,
        Map<String, Object> metadata) {
    public SourceCitation {
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }
}
