package com.jreinhal.hragent.reasoning;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Ordered record of the stages one pipeline execution went through.
 *
 * Owned by a single {@code PipelineState}; not shared between requests.
 */
public class ReasoningTrace {

    private final String traceId;
    private final Instant timestamp;
    private final String sessionId;
    private final List<ReasoningStep> steps;
    private final Map<String, Object> metrics;
    private long totalDurationMs;
    private boolean completed;

    public ReasoningTrace(String sessionId) {
        this.traceId = UUID.randomUUID().toString().substring(0, 8);
        this.timestamp = Instant.now();
        this.sessionId = sessionId;
        this.steps = new ArrayList<>();
        this.metrics = new LinkedHashMap<>();
    }

    public void addStep(ReasoningStep step) {
        steps.add(step);
        totalDurationMs += step.durationMs();
    }

    public void addMetric(String key, Object value) {
        metrics.put(key, value);
    }

    public void complete() {
        this.completed = true;
    }

    public String getTraceId() {
        return traceId;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getSessionId() {
        return sessionId;
    }

    public List<ReasoningStep> getSteps() {
        return Collections.unmodifiableList(steps);
    }

    public Map<String, Object> getMetrics() {
        return Collections.unmodifiableMap(metrics);
    }

    public long getTotalDurationMs() {
        return totalDurationMs;
    }

    public boolean isCompleted() {
        return completed;
    }

    /**
     * One-line summary for log output.
     */
    public String getSummary() {
        StringBuilder sb = new StringBuilder();
        sb.append("Trace[").append(traceId).append("] ");
        sb.append(steps.size()).append(" steps, ");
        sb.append(totalDurationMs).append("ms");
        if (!steps.isEmpty()) {
            sb.append(" | ");
            for (int i = 0; i < steps.size(); i++) {
                if (i > 0) {
                    sb.append(" -> ");
                }
                sb.append(steps.get(i).type());
            }
        }
        return sb.toString();
    }
}
