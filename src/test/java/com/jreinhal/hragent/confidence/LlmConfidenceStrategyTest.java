package com.jreinhal.hragent.confidence;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jreinhal.hragent.gateway.LanguageModelException;
import com.jreinhal.hragent.gateway.LanguageModelGateway;
import com.jreinhal.hragent.gateway.LanguageModelTimeoutException;
import com.jreinhal.hragent.gateway.LlmReply;
import com.jreinhal.hragent.gateway.LlmRequest;
import com.jreinhal.hragent.model.ContextPassage;
import com.jreinhal.hragent.model.TokenUsage;
import com.jreinhal.hragent.prompt.PromptCatalog;
import com.jreinhal.hragent.settings.AgentSettings;
import com.jreinhal.hragent.settings.AgentSettingsFixtures;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class LlmConfidenceStrategyTest {

    private LanguageModelGateway gateway;
    private LlmConfidenceStrategy strategy;
    private final AgentSettings settings = AgentSettingsFixtures.withMethod("llm");
    private final ConfidenceInput input = new ConfidenceInput("What is the minimum wage in Manitoba?",
            "The minimum wage is $15.80 per hour.",
            List.of(ContextPassage.of("a", "Manitoba minimum wage is $15.80.", "upload", 0.82)));

    @BeforeEach
    void setUp() {
        gateway = mock(LanguageModelGateway.class);
        strategy = new LlmConfidenceStrategy(gateway, new PromptCatalog(), new FormulaConfidenceStrategy(),
                new ObjectMapper());
    }

    @Nested
    @DisplayName("Successful evaluation")
    class Success {

        @Test
        @DisplayName("Bare number reply becomes the score")
        void bareNumber() {
            when(gateway.complete(any())).thenReturn(new LlmReply("0.85", new TokenUsage(40, 2, 42)));

            ConfidenceResult result = strategy.score(input, settings);

            assertThat(result.method()).isEqualTo(ConfidenceMethod.LLM);
            assertThat(result.score()).isCloseTo(0.85, within(1e-9));
            assertThat(result.usage().totalTokens()).isEqualTo(42);
            assertThat(result.breakdown()).containsEntry("llm_raw_response", "0.85");
        }

        @Test
        @DisplayName("Out-of-range values are clamped")
        void clamped() {
            when(gateway.complete(any())).thenReturn(new LlmReply("1.7", TokenUsage.NONE));

            assertThat(strategy.score(input, settings).score()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Call carries the configured timeout and judge temperature")
        void requestOptions() {
            when(gateway.complete(any())).thenReturn(new LlmReply("0.5", TokenUsage.NONE));

            strategy.score(input, settings);

            ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);
            verify(gateway).complete(captor.capture());
            assertThat(captor.getValue().timeout()).isEqualTo(Duration.ofMillis(2000));
            assertThat(captor.getValue().options().temperature()).isEqualTo(0.1);
            assertThat(captor.getValue().options().maxTokens()).isEqualTo(100);
            assertThat(captor.getValue().userPrompt()).contains("Manitoba minimum wage is $15.80.");
        }
    }

    @Nested
    @DisplayName("Fallback to formula")
    class Fallback {

        @Test
        @DisplayName("Timeout reports the formula method, never llm")
        void timeout() {
            when(gateway.complete(any())).thenThrow(new LanguageModelTimeoutException(Duration.ofMillis(2000)));

            ConfidenceResult result = strategy.score(input, settings);

            assertThat(result.method()).isEqualTo(ConfidenceMethod.FORMULA);
            assertThat(result.score()).isCloseTo(0.82 * 0.8 + 0.3 * 0.1, within(1e-9));
        }

        @Test
        @DisplayName("Gateway failure falls back to formula")
        void failure() {
            when(gateway.complete(any())).thenThrow(new LanguageModelException("connection refused"));

            assertThat(strategy.score(input, settings).method()).isEqualTo(ConfidenceMethod.FORMULA);
        }

        @Test
        @DisplayName("Unparsable reply falls back to formula but keeps the tokens spent")
        void unparsable() {
            when(gateway.complete(any())).thenReturn(new LlmReply("Pretty confident!", new TokenUsage(30, 4, 34)));

            ConfidenceResult result = strategy.score(input, settings);

            assertThat(result.method()).isEqualTo(ConfidenceMethod.FORMULA);
            assertThat(result.usage().totalTokens()).isEqualTo(34);
        }
    }

    @Nested
    @DisplayName("Score parsing")
    class Parsing {

        @Test
        @DisplayName("JSON object with confidence_score is accepted")
        void jsonObject() {
            assertThat(strategy.parseScore("{\"confidence_score\": 0.42, \"reasoning\": \"ok\"}"))
                    .isCloseTo(0.42, within(1e-9));
        }

        @Test
        @DisplayName("JSON object without confidence_score scores zero")
        void jsonWithoutScore() {
            assertThat(strategy.parseScore("{\"reasoning\": \"unsure\"}")).isZero();
        }

        @Test
        @DisplayName("Negative values clamp to zero")
        void negative() {
            assertThat(strategy.parseScore("-0.3")).isZero();
        }

        @Test
        @DisplayName("Text is rejected")
        void text() {
            assertThatThrownBy(() -> strategy.parseScore("high"))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
