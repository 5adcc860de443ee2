package com.jreinhal.hragent.tools;

import com.jreinhal.hragent.model.TokenUsage;
import com.jreinhal.hragent.model.ToolResult;
import java.util.List;

/**
 * @param error planning-level failure, {@code null} when planning succeeded (individual tool
 *              failures are carried by their {@link ToolResult})
 */
public record ToolInvocationOutcome(List<ToolResult> results, TokenUsage usage, String error) {

    public ToolInvocationOutcome {
        results = results == null ? List.of() : List.copyOf(results);
        usage = usage == null ? TokenUsage.NONE : usage;
    }

    public static ToolInvocationOutcome failed(String error, TokenUsage usage) {
        return new ToolInvocationOutcome(List.of(), usage, error);
    }
}
