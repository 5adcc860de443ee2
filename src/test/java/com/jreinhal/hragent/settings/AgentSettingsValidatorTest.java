package com.jreinhal.hragent.settings;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class AgentSettingsValidatorTest {

    private final AgentSettingsValidator validator = new AgentSettingsValidator();

    private InvalidAgentSettingsException violationsOf(AgentSettings settings) {
        return catchInvalid(() -> validator.validate(settings));
    }

    private static InvalidAgentSettingsException catchInvalid(Runnable runnable) {
        try {
            runnable.run();
        } catch (InvalidAgentSettingsException e) {
            return e;
        }
        throw new AssertionError("expected InvalidAgentSettingsException");
    }

    @Test
    @DisplayName("Defaults are valid")
    void defaultsValid() {
        assertThatCode(() -> validator.validate(AgentSettingsFixtures.defaults())).doesNotThrowAnyException();
    }

    @Nested
    @DisplayName("Weights")
    class Weights {

        @Test
        @DisplayName("Formula weights must sum to 1.0")
        void formulaSum() {
            InvalidAgentSettingsException e = violationsOf(AgentSettingsFixtures.with(
                    p -> p.getConfidence().getFormulaWeights().setSimilarity(0.9)));

            assertThat(e.getViolations()).singleElement().asString()
                    .contains("formula-weights must sum to 1.0 but sum to 1.100");
        }

        @Test
        @DisplayName("Sums within the tolerance are accepted")
        void withinTolerance() {
            assertThatCode(() -> validator.validate(AgentSettingsFixtures.with(p -> {
                p.getConfidence().getHybridWeights().setFormula(0.605);
            }))).doesNotThrowAnyException();
        }

        @Test
        @DisplayName("Hybrid weights must sum to 1.0")
        void hybridSum() {
            InvalidAgentSettingsException e = violationsOf(AgentSettingsFixtures.with(
                    p -> p.getConfidence().getHybridWeights().setLlm(0.2)));

            assertThat(e.getViolations()).anyMatch(v -> v.startsWith("confidence.hybrid-weights must sum"));
        }
    }

    @Nested
    @DisplayName("Ranges")
    class Ranges {

        @Test
        @DisplayName("Thresholds outside [0,1] are rejected")
        void thresholdRange() {
            InvalidAgentSettingsException e = violationsOf(AgentSettingsFixtures.with(
                    p -> p.getThresholds().setEscalation(1.2)));

            assertThat(e.getViolations()).containsExactly("thresholds.escalation must be within [0,1] but was 1.2");
        }

        @Test
        @DisplayName("All violations are reported together")
        void collected() {
            InvalidAgentSettingsException e = violationsOf(AgentSettingsFixtures.with(p -> {
                p.getSearch().setMaxResults(0);
                p.getConfidence().setMethod("vibes");
                p.getConfidence().getLlm().setTimeoutMs(50);
                p.getExcerpt().setMaxLength(0);
            }));

            assertThat(e.getViolations()).hasSize(4);
            assertThat(e.getMessage()).startsWith("Invalid agent settings:");
        }

        @Test
        @DisplayName("Partial length may not exceed full length")
        void lengthOrder() {
            InvalidAgentSettingsException e = violationsOf(AgentSettingsFixtures.with(
                    p -> p.getConfidence().getFormula().setPartialLengthChars(300)));

            assertThat(e.getViolations()).hasSize(1);
        }
    }

    @Test
    @DisplayName("Missing snapshot is rejected")
    void missing() {
        assertThatThrownBy(() -> validator.validate(null)).isInstanceOf(InvalidAgentSettingsException.class);
    }
}
