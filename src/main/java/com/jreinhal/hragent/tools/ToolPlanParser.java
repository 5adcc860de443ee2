package com.jreinhal.hragent.tools;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the planner's {@code {"tool_calls":[{"name":..., "arguments":{...}}]}} reply.
 */
public class ToolPlanParser {

    private static final Pattern FENCE = Pattern.compile("```(?:json)?\\s*(.*?)\\s*```", Pattern.DOTALL);
    private static final TypeReference<Map<String, Object>> ARGUMENTS = new TypeReference<>() { };

    private final ObjectMapper objectMapper;

    public ToolPlanParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @throws IllegalArgumentException when the reply is not a JSON tool plan
     */
    public List<PlannedToolCall> parse(String reply) {
        String json = stripFence(reply);
        if (json.isEmpty()) {
            throw new IllegalArgumentException("Empty tool plan");
        }
        JsonNode root;
        try {
            root = this.objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Tool plan is not valid JSON: " + e.getOriginalMessage(), e);
        }
        JsonNode calls = root == null ? null : root.get("tool_calls");
        if (calls == null || calls.isNull()) {
            throw new IllegalArgumentException("Tool plan has no tool_calls field");
        }
        if (!calls.isArray()) {
            throw new IllegalArgumentException("tool_calls must be a list");
        }
        List<PlannedToolCall> planned = new ArrayList<>();
        for (JsonNode call : calls) {
            String name = call.path("name").asText("").trim();
            if (name.isEmpty()) {
                throw new IllegalArgumentException("Tool call without a name");
            }
            JsonNode args = call.get("arguments");
            if (args == null || args.isNull()) {
                args = call.get("args");
            }
            Map<String, Object> arguments = args != null && args.isObject()
                    ? this.objectMapper.convertValue(args, ARGUMENTS)
                    : Map.of();
            planned.add(new PlannedToolCall(name, arguments));
        }
        return planned;
    }

    static String stripFence(String reply) {
        if (reply == null) {
            return "";
        }
        String trimmed = reply.trim();
        Matcher matcher = FENCE.matcher(trimmed);
        if (matcher.find()) {
            return matcher.group(1).trim();
        }
        return trimmed;
    }
}
