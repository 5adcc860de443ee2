package com.jreinhal.hragent.tools;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jreinhal.hragent.gateway.LanguageModelException;
import com.jreinhal.hragent.gateway.LanguageModelGateway;
import com.jreinhal.hragent.gateway.LlmCallOptions;
import com.jreinhal.hragent.gateway.LlmReply;
import com.jreinhal.hragent.gateway.LlmRequest;
import com.jreinhal.hragent.model.QueryAnalysisResult;
import com.jreinhal.hragent.model.TokenUsage;
import com.jreinhal.hragent.model.ToolResult;
import com.jreinhal.hragent.prompt.PromptCatalog;
import com.jreinhal.hragent.settings.AgentSettings;
import com.jreinhal.hragent.util.LogSanitizer;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Asks the language model for a JSON tool plan and runs each planned call through its
 * {@link ToolCallback}.
 *
 * <p>Built-in tools are filtered by {@code hragent.tools.enabled}; tools contributed by
 * {@link ToolCallbackProvider} beans (MCP clients, for instance) are always offered.</p>
 */
@Component
public class AgentToolInvoker implements ToolInvoker {

    private static final Logger log = LoggerFactory.getLogger(AgentToolInvoker.class);
    static final int PLANNING_MAX_TOKENS = 500;

    private final LanguageModelGateway gateway;
    private final PromptCatalog promptCatalog;
    private final ObjectMapper objectMapper;
    private final ToolPlanParser planParser;
    private final List<ToolCallback> builtInTools;
    private final List<ToolCallbackProvider> toolProviders;

    @Autowired
    public AgentToolInvoker(LanguageModelGateway gateway, PromptCatalog promptCatalog, ObjectMapper objectMapper,
                            ObjectProvider<ToolCallback> builtInTools,
                            ObjectProvider<ToolCallbackProvider> toolProviders) {
        this(gateway, promptCatalog, objectMapper,
                builtInTools.orderedStream().collect(Collectors.toList()),
                toolProviders.orderedStream().collect(Collectors.toList()));
    }

    AgentToolInvoker(LanguageModelGateway gateway, PromptCatalog promptCatalog, ObjectMapper objectMapper,
                     List<ToolCallback> builtInTools, List<ToolCallbackProvider> toolProviders) {
        this.gateway = gateway;
        this.promptCatalog = promptCatalog;
        this.objectMapper = objectMapper;
        this.planParser = new ToolPlanParser(objectMapper);
        this.builtInTools = List.copyOf(builtInTools);
        this.toolProviders = List.copyOf(toolProviders);
    }

    @Override
    public ToolInvocationOutcome invoke(String query, QueryAnalysisResult analysis, AgentSettings settings) {
        Map<String, ToolCallback> tools = availableTools(settings);
        if (tools.isEmpty()) {
            log.warn("No tools available for invocation");
            return ToolInvocationOutcome.failed("No tools available", TokenUsage.NONE);
        }
        log.info("Invoking tools: {} available {}", tools.size(), tools.keySet());

        String systemPrompt = this.promptCatalog.render(PromptCatalog.TOOL_INVOCATION_SYSTEM, settings,
                Map.of("tools", describe(tools)));
        LlmCallOptions options = LlmCallOptions.of(settings.model().model(),
                settings.tools().planningTemperature(), PLANNING_MAX_TOKENS);

        LlmReply reply;
        try {
            reply = this.gateway.complete(LlmRequest.of(systemPrompt, userPrompt(query, analysis), options));
        } catch (LanguageModelException e) {
            log.warn("Tool planning call failed: {}", LogSanitizer.sanitize(e.getMessage()));
            return ToolInvocationOutcome.failed("Tool planning error: " + e.getMessage(), TokenUsage.NONE);
        }

        List<PlannedToolCall> plan;
        try {
            plan = this.planParser.parse(reply.text());
        } catch (IllegalArgumentException e) {
            log.warn("Unusable tool plan: {} (reply={})", e.getMessage(), LogSanitizer.preview(reply.text(), 200));
            return ToolInvocationOutcome.failed("Tool planning error: " + e.getMessage(), reply.usage());
        }
        if (plan.isEmpty()) {
            log.info("No tool calls requested by model");
            return new ToolInvocationOutcome(List.of(), reply.usage(), null);
        }

        List<ToolResult> results = new ArrayList<>();
        for (PlannedToolCall call : plan) {
            results.add(execute(call, tools));
        }
        return new ToolInvocationOutcome(results, reply.usage(), null);
    }

    Map<String, ToolCallback> availableTools(AgentSettings settings) {
        Map<String, ToolCallback> tools = new LinkedHashMap<>();
        List<String> enabled = settings.tools().enabled();
        for (ToolCallback tool : this.builtInTools) {
            String name = tool.getToolDefinition().name();
            if (enabled.contains(name)) {
                tools.put(name, tool);
            }
        }
        for (ToolCallbackProvider provider : this.toolProviders) {
            ToolCallback[] callbacks = provider.getToolCallbacks();
            if (callbacks == null) {
                continue;
            }
            for (ToolCallback tool : callbacks) {
                tools.putIfAbsent(tool.getToolDefinition().name(), tool);
            }
        }
        return tools;
    }

    private ToolResult execute(PlannedToolCall call, Map<String, ToolCallback> tools) {
        ToolCallback tool = tools.get(call.name());
        if (tool == null) {
            log.warn("Planned tool '{}' is not available", LogSanitizer.sanitize(call.name()));
            return ToolResult.failure(call.name(), call.arguments(), "Tool '" + call.name() + "' not found");
        }
        try {
            String input = this.objectMapper.writeValueAsString(call.arguments());
            String output = tool.call(input);
            log.info("Tool {} executed successfully", call.name());
            return ToolResult.success(call.name(), call.arguments(), output);
        } catch (JsonProcessingException e) {
            log.error("Tool {} arguments could not be serialized", call.name(), e);
            return ToolResult.failure(call.name(), call.arguments(), e.getOriginalMessage());
        } catch (RuntimeException e) {
            log.error("Tool {} failed: {}", call.name(), LogSanitizer.sanitize(e.getMessage()), e);
            return ToolResult.failure(call.name(), call.arguments(), e.getMessage());
        }
    }

    private static String describe(Map<String, ToolCallback> tools) {
        StringBuilder sb = new StringBuilder();
        for (ToolCallback tool : tools.values()) {
            if (sb.length() > 0) {
                sb.append('\n');
            }
            sb.append("- ").append(tool.getToolDefinition().name())
                    .append(": ").append(tool.getToolDefinition().description())
                    .append("\n  input schema: ").append(tool.getToolDefinition().inputSchema());
        }
        return sb.toString();
    }

    private static String userPrompt(String query, QueryAnalysisResult analysis) {
        if (analysis == null || analysis.suggestedTools().isEmpty()) {
            return query;
        }
        return query + "\n\nSuggested tools (prefer these when they apply): " + String.join(", ", analysis.suggestedTools());
    }
}
