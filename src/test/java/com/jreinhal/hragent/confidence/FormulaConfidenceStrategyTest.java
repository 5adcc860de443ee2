package com.jreinhal.hragent.confidence;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.jreinhal.hragent.model.ContextPassage;
import com.jreinhal.hragent.settings.AgentSettings;
import com.jreinhal.hragent.settings.AgentSettingsFixtures;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class FormulaConfidenceStrategyTest {

    private final FormulaConfidenceStrategy strategy = new FormulaConfidenceStrategy();
    private final AgentSettings settings = AgentSettingsFixtures.defaults();

    private static ContextPassage passage(double similarity) {
        return ContextPassage.of("id-" + similarity, "content", "upload", similarity);
    }

    @Nested
    @DisplayName("Score composition")
    class Composition {

        @Test
        @DisplayName("Three strong passages and a long answer score 0.8848 with default weights")
        void threeStrongPassages() {
            ConfidenceInput input = new ConfidenceInput("How much vacation?", "x".repeat(250),
                    List.of(passage(0.9), passage(0.8), passage(0.76)));

            ConfidenceResult result = strategy.score(input, settings);

            assertThat(result.method()).isEqualTo(ConfidenceMethod.FORMULA);
            assertThat(result.score()).isCloseTo(0.8848, within(1e-9));
            assertThat((double) result.breakdown().get("similarity_score")).isCloseTo(0.856, within(1e-9));
            assertThat(result.breakdown().get("source_boost")).isEqualTo(1.0);
            assertThat(result.breakdown().get("length_boost")).isEqualTo(1.0);
            assertThat(result.breakdown().get("high_quality_source_count")).isEqualTo(3);
        }

        @Test
        @DisplayName("No passages always score zero")
        void noPassages() {
            ConfidenceResult result = strategy.score(
                    new ConfidenceInput("q", "a long answer ".repeat(40), List.of()), settings);

            assertThat(result.score()).isZero();
            assertThat(result.method()).isEqualTo(ConfidenceMethod.FORMULA);
            assertThat(result.breakdown()).containsEntry("reason", "no_context_documents");
        }

        @Test
        @DisplayName("Two passages are weighted 0.7/0.3 and one passage counts fully")
        void fewPassages() {
            assertThat(FormulaConfidenceStrategy.similarityScore(List.of(passage(0.8), passage(0.6))))
                    .isCloseTo(0.74, within(1e-9));
            assertThat(FormulaConfidenceStrategy.similarityScore(List.of(passage(0.65))))
                    .isCloseTo(0.65, within(1e-9));
        }

        @Test
        @DisplayName("Similarity equal to the high-quality bound does not count as high quality")
        void highQualityBoundIsExclusive() {
            ConfidenceResult result = strategy.score(
                    new ConfidenceInput("q", "short", List.of(passage(0.75))), settings);

            assertThat(result.breakdown().get("high_quality_source_count")).isEqualTo(0);
            assertThat(result.breakdown().get("length_boost")).isEqualTo(0.0);
            assertThat(result.score()).isCloseTo(0.75 * 0.8, within(1e-9));
        }

        @Test
        @DisplayName("Medium-length answers get half the length boost")
        void partialLength() {
            ConfidenceResult result = strategy.score(
                    new ConfidenceInput("q", "y".repeat(150), List.of(passage(0.9), passage(0.9))), settings);

            assertThat(result.breakdown().get("length_boost")).isEqualTo(0.5);
            assertThat(result.breakdown().get("source_boost")).isEqualTo(0.6);
        }
    }

    @Nested
    @DisplayName("Score properties")
    class Properties {

        @Test
        @DisplayName("Score never exceeds 1.0")
        void capped() {
            AgentSettings heavy = AgentSettingsFixtures.with(p -> {
                p.getConfidence().getFormulaWeights().setSimilarity(1.0);
                p.getConfidence().getFormulaWeights().setSourceQuality(1.0);
                p.getConfidence().getFormulaWeights().setResponseLength(1.0);
            });
            ConfidenceResult result = strategy.score(new ConfidenceInput("q", "z".repeat(300),
                    List.of(passage(1.0), passage(1.0), passage(1.0))), heavy);

            assertThat(result.score()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Raising a passage similarity never lowers the score")
        void monotoneInSimilarity() {
            double previous = -1.0;
            for (double top = 0.1; top <= 1.0; top += 0.05) {
                double score = strategy.score(new ConfidenceInput("q", "w".repeat(120),
                        List.of(passage(top), passage(0.5), passage(0.4))), settings).score();
                assertThat(score).isGreaterThanOrEqualTo(previous);
                previous = score;
            }
        }

        @Test
        @DisplayName("Source boost steps by high-quality passage count")
        void sourceBoostSteps() {
            assertThat(FormulaConfidenceStrategy.sourceBoost(0)).isEqualTo(0.0);
            assertThat(FormulaConfidenceStrategy.sourceBoost(1)).isEqualTo(0.3);
            assertThat(FormulaConfidenceStrategy.sourceBoost(2)).isEqualTo(0.6);
            assertThat(FormulaConfidenceStrategy.sourceBoost(5)).isEqualTo(1.0);
        }
    }
}
