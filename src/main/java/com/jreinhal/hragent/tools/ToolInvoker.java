package com.jreinhal.hragent.tools;

import com.jreinhal.hragent.model.QueryAnalysisResult;
import com.jreinhal.hragent.settings.AgentSettings;

/**
 * Chooses and runs tools for a question. Results feed the generator alongside retrieved passages.
 */
public interface ToolInvoker {

    /**
     * Never throws for tool or planning failures; those are reported in the outcome.
     */
    ToolInvocationOutcome invoke(String query, QueryAnalysisResult analysis, AgentSettings settings);
}
