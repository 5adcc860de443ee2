package com.jreinhal.hragent.pipeline;

import com.jreinhal.hragent.model.QueryAnalysisResult;
import com.jreinhal.hragent.model.RoutingDecision;
import org.springframework.stereotype.Component;

/**
 * Maps the analysis' routing decision to a branch. Pure; no side effects.
 *
 * <p>Only {@code tool_invocation} leaves the retrieval path. {@code direct_escalation} still
 * retrieves and generates; whether to escalate is decided after scoring.</p>
 */
@Component
public class QueryRouter {

    public PipelineBranch route(QueryAnalysisResult analysis) {
        if (analysis == null) {
            return PipelineBranch.RETRIEVAL;
        }
        return analysis.routing() == RoutingDecision.TOOL_INVOCATION
                ? PipelineBranch.TOOLS
                : PipelineBranch.RETRIEVAL;
    }
}
