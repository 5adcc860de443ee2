package com.jreinhal.hragent.service;

import com.jreinhal.hragent.model.PipelineState;

/**
 * Receives the final state of every completed run, e.g. to persist chat history or audit
 * escalations. Not called for cancelled runs.
 */
@FunctionalInterface
public interface AgentOutcomeListener {

    void onOutcome(PipelineState state);
}
