package com.jreinhal.hragent.citation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.jreinhal.hragent.model.ContextPassage;
import com.jreinhal.hragent.model.PipelineState;
import com.jreinhal.hragent.model.SourceCitation;
import com.jreinhal.hragent.settings.AgentSettingsCache;
import com.jreinhal.hragent.settings.AgentSettingsFixtures;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class OutputFormatterTest {

    private static ContextPassage titled(String id, String title, double similarity) {
        return new ContextPassage(id, "Overtime is paid at 1.5 times the regular wage.", "upload", similarity,
                title, null, null, "2024-03-01", Map.of());
    }

    @Nested
    @DisplayName("Deduplication and ordering")
    class Dedup {

        @Test
        @DisplayName("Chunks of one document collapse to the best-matching one")
        void bestChunkWins() {
            List<SourceCitation> sources = OutputFormatter.format(List.of(
                    titled("1", "overtime_rules.pdf (chunk 1/4)", 0.6),
                    titled("2", "overtime_rules.pdf (chunk 3/4)", 0.9),
                    titled("3", "vacation_guide.pdf (chunk 1/2)", 0.7)), "overtime pay", 300);

            assertThat(sources).extracting(SourceCitation::source)
                    .containsExactly("Overtime Rules", "Vacation Guide");
            assertThat(sources.get(0).similarity()).isEqualTo(0.9);
            assertThat(sources.get(0).timestamp()).isEqualTo("2024-03-01");
        }

        @Test
        @DisplayName("Equal similarity keeps the first passage")
        void tieKeepsFirst() {
            ContextPassage first = new ContextPassage("1", "First text.", "upload", 0.8,
                    "guide.pdf (chunk 1/2)", null, null, "first", Map.of());
            ContextPassage second = new ContextPassage("2", "Second text.", "upload", 0.8,
                    "guide.pdf (chunk 2/2)", null, null, "second", Map.of());

            List<SourceCitation> sources = OutputFormatter.format(List.of(first, second), "text", 300);

            assertThat(sources).singleElement().extracting(SourceCitation::timestamp).isEqualTo("first");
        }

        @Test
        @DisplayName("Distinct untitled documents are not merged")
        void untitledDocumentsStayDistinct() {
            ContextPassage upload = new ContextPassage("aaaaaaaa-1111", "Notice is two weeks.", "upload", 0.8,
                    " (chunk 1/3)", null, null, null, Map.of());
            ContextPassage web = new ContextPassage("bbbbbbbb-2222", "Notice is one week.", "web", 0.7,
                    " (chunk 2/5)", null, null, null, Map.of());

            List<SourceCitation> sources = OutputFormatter.format(List.of(upload, web), "notice", 300);

            assertThat(sources).extracting(SourceCitation::source)
                    .containsExactly("Upload (aaaaaaaa)", "Web (bbbbbbbb)");
        }

        @Test
        @DisplayName("Citations are sorted by descending similarity")
        void sorted() {
            List<SourceCitation> sources = OutputFormatter.format(List.of(
                    titled("1", "a.pdf", 0.5), titled("2", "b.pdf", 0.95), titled("3", "c.pdf", 0.7)), "wage", 300);

            assertThat(sources).extracting(SourceCitation::similarity).containsExactly(0.95, 0.7, 0.5);
        }
    }

    @Nested
    @DisplayName("As a pipeline stage")
    class Stage {

        @Test
        @DisplayName("Sources are written to the state")
        void writesSources() {
            PipelineState state = new PipelineState("overtime", "MB", null, null, List.of());
            state.setContextDocuments(List.of(titled("1", "overtime_rules.pdf", 0.8)));

            new OutputFormatter(AgentSettingsFixtures.cacheOf(AgentSettingsFixtures.defaults()))
                    .apply(state).applyTo(state);

            assertThat(state.getSources()).hasSize(1);
        }

        @Test
        @DisplayName("Unavailable settings fall back to the default excerpt length")
        void settingsUnavailable() {
            AgentSettingsCache cache = mock(AgentSettingsCache.class);
            when(cache.current()).thenThrow(new IllegalStateException("down"));
            PipelineState state = new PipelineState("wage", null, null, null, List.of());
            state.setContextDocuments(List.of(new ContextPassage("1", "w".repeat(500), "upload", 0.8,
                    "long.pdf", null, null, null, Map.of())));

            new OutputFormatter(cache).apply(state).applyTo(state);

            assertThat(state.getSources().get(0).excerpt()).hasSize(OutputFormatter.DEFAULT_EXCERPT_LENGTH + 3);
            assertThat(state.getErrors()).isEmpty();
        }
    }
}
