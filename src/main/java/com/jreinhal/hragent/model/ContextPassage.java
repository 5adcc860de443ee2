package com.jreinhal.hragent.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A retrieved chunk of previously ingested text with its similarity to the current query.
 *
 * @param id               chunk identifier from the store
 * @param content          chunk text
 * @param source           source type of the originating document (e.g. {@code "upload"}, {@code "web"})
 * @param similarity       similarity in [0,1]
 * @param title            chunk title, typically {@code "<file> (chunk n/m)"}
 * @param documentTitle    title of the parent document, when the store knows it
 * @param documentFilename filename of the parent document, when the store knows it
 * @param timestamp        document timestamp, free form
 * @param metadata         remaining store metadata
 */
public record ContextPassage(
        String id,
        String content,
        String source,
        double similarity,
        String title,
        String documentTitle,
        String documentFilename,
        String timestamp,
        Map<String, Object> metadata) {

    public ContextPassage {
        content = content == null ? "" : content;
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static ContextPassage of(String id, String content, String source, double similarity) {
        return new ContextPassage(id, content, source, similarity, null, null, null, null, Map.of());
    }
}
