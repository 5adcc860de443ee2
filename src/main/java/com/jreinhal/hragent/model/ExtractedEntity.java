package com.jreinhal.hragent.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record ExtractedEntity(String text, EntityType type, double confidence, Map<String, Object> metadata) {
    public ExtractedEntity {
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }
}
