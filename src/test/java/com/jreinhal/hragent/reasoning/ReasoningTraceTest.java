package com.jreinhal.hragent.reasoning;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ReasoningTraceTest {

    @Nested
    @DisplayName("Trace construction")
    class ConstructionTest {

        @Test
        @DisplayName("Should generate an 8 character traceId")
        void shouldGenerateTraceId() {
            ReasoningTrace trace = new ReasoningTrace("session-1");

            assertThat(trace.getTraceId()).hasSize(8);
            assertThat(trace.getSessionId()).isEqualTo("session-1");
            assertThat(trace.isCompleted()).isFalse();
        }
    }

    @Nested
    @DisplayName("Step management")
    class StepManagementTest {

        @Test
        @DisplayName("Should add steps and accumulate duration")
        void shouldAddSteps() {
            ReasoningTrace trace = new ReasoningTrace(null);
            trace.addStep(ReasoningStep.of(ReasoningStep.StepType.QUERY_ANALYSIS, "analyze", "completed", 120));
            trace.addStep(ReasoningStep.of(ReasoningStep.StepType.RETRIEVAL, "retrieve", "completed", 80,
                    Map.of("documents", 3)));

            assertThat(trace.getSteps()).hasSize(2);
            assertThat(trace.getTotalDurationMs()).isEqualTo(200);
            assertThat(trace.getSteps().get(1).data()).containsEntry("documents", 3);
        }

        @Test
        @DisplayName("Summary lists the step types in order")
        void summary() {
            ReasoningTrace trace = new ReasoningTrace(null);
            trace.addStep(ReasoningStep.of(ReasoningStep.StepType.QUERY_ROUTING, "Route", "Selected RETRIEVAL", 1));
            trace.addStep(ReasoningStep.of(ReasoningStep.StepType.GENERATION, "generate", "completed", 9));

            assertThat(trace.getSummary())
                    .isEqualTo("Trace[" + trace.getTraceId() + "] 2 steps, 10ms | QUERY_ROUTING -> GENERATION");
        }

        @Test
        @DisplayName("Metrics are kept in insertion order")
        void metrics() {
            ReasoningTrace trace = new ReasoningTrace(null);
            trace.addMetric("confidence", 0.9);
            trace.addMetric("escalated", false);

            assertThat(trace.getMetrics()).containsExactly(Map.entry("confidence", 0.9), Map.entry("escalated", false));
        }
    }
}
