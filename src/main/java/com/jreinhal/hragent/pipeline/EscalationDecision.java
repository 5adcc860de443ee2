package com.jreinhal.hragent.pipeline;

/**
 * @param reason human-readable explanation, {@code null} when the answer is accepted
 */
public record EscalationDecision(boolean escalated, String reason) {

    public static EscalationDecision accept() {
        return new EscalationDecision(false, null);
    }

    public static EscalationDecision escalate(String reason) {
        return new EscalationDecision(true, reason);
    }
}
