package com.jreinhal.hragent.citation;

import com.jreinhal.hragent.model.ContextPassage;
import com.jreinhal.hragent.model.PipelineState;
import com.jreinhal.hragent.model.SourceCitation;
import com.jreinhal.hragent.pipeline.PipelineStage;
import com.jreinhal.hragent.pipeline.StateUpdate;
import com.jreinhal.hragent.settings.AgentSettingsCache;
import com.jreinhal.hragent.util.LogSanitizer;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns retrieved passages into citations: one per document (the best-matching passage wins),
 * ordered by descending similarity, each with a question-relevant excerpt.
 */
@Component
public class OutputFormatter implements PipelineStage {

    private static final Logger log = LoggerFactory.getLogger(OutputFormatter.class);
    static final int DEFAULT_EXCERPT_LENGTH = 300;

    private final AgentSettingsCache settingsCache;

    public OutputFormatter(AgentSettingsCache settingsCache) {
        this.settingsCache = settingsCache;
    }

    @Override
    public StateUpdate apply(PipelineState state) {
        try {
            int maxLength = excerptLength();
            List<SourceCitation> sources = format(state.getContextDocuments(), state.getQuery(), maxLength);
            log.info("Formatted {} citations from {} passages", sources.size(), state.getContextDocuments().size());
            return StateUpdate.builder().sources(sources).build();
        } catch (RuntimeException e) {
            log.error("Output formatting failed: {}", LogSanitizer.sanitize(e.getMessage()), e);
            return StateUpdate.builder()
                    .sources(List.of())
                    .error("Output formatting error: " + e.getMessage())
                    .build();
        }
    }

    public static List<SourceCitation> format(List<ContextPassage> passages, String query, int maxExcerptLength) {
        Map<String, SourceCitation> byName = new LinkedHashMap<>();
        for (ContextPassage passage : passages) {
            String displayName = SourceDisplayNames.of(passage);
            SourceCitation existing = byName.get(displayName);
            if (existing != null && passage.similarity() <= existing.similarity()) {
                continue;
            }
            byName.put(displayName, new SourceCitation(
                    displayName,
                    ExcerptExtractor.extract(passage.content(), query, maxExcerptLength),
                    passage.similarity(),
                    passage.timestamp(),
                    passage.metadata()));
        }
        List<SourceCitation> sources = new ArrayList<>(byName.values());
        sources.sort(Comparator.comparingDouble(SourceCitation::similarity).reversed());
        return sources;
    }

    private int excerptLength() {
        try {
            return this.settingsCache.current().excerptMaxLength();
        } catch (RuntimeException e) {
            log.warn("Settings unavailable for output formatting, using excerpt length {}: {}",
                    DEFAULT_EXCERPT_LENGTH, LogSanitizer.sanitize(e.getMessage()));
            return DEFAULT_EXCERPT_LENGTH;
        }
    }
}
