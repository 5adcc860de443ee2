package com.jreinhal.hragent.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of one tool call. Failed calls keep the error text as their result so the
 * generator can still see what went wrong.
 */
public record ToolResult(String toolName, Map<String, Object> arguments, String result, boolean success, String error) {
    public ToolResult {
        arguments = arguments == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
    }

    public static ToolResult success(String toolName, Map<String, Object> arguments, String result) {
        return new ToolResult(toolName, arguments, result, true, null);
    }

    public static ToolResult failure(String toolName, Map<String, Object> arguments, String error) {
        return new ToolResult(toolName, arguments, "Tool execution error: " + error, false, error);
    }
}
