package com.jreinhal.hragent.pipeline;

import com.jreinhal.hragent.constant.Provinces;
import com.jreinhal.hragent.gateway.LanguageModelGateway;
import com.jreinhal.hragent.gateway.LlmCallOptions;
import com.jreinhal.hragent.gateway.LlmReply;
import com.jreinhal.hragent.gateway.LlmRequest;
import com.jreinhal.hragent.model.ContextPassage;
import com.jreinhal.hragent.model.ConversationMessage;
import com.jreinhal.hragent.model.PipelineState;
import com.jreinhal.hragent.model.ToolResult;
import com.jreinhal.hragent.prompt.PromptCatalog;
import com.jreinhal.hragent.settings.AgentSettings;
import com.jreinhal.hragent.settings.AgentSettingsCache;
import com.jreinhal.hragent.util.LogSanitizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Builds the jurisdiction-aware system prompt and the context/history user prompt, and asks the
 * model for the answer. A failed call produces a fixed apology instead of an answer.
 */
@Service
public class ResponseGenerator implements PipelineStage {

    private static final Logger log = LoggerFactory.getLogger(ResponseGenerator.class);

    public static final String APOLOGY = "I apologize, but I encountered an error generating a response.";
    static final String NO_CONTEXT = "No relevant context found.";
    static final String NO_HISTORY = "No previous conversation.";

    private final LanguageModelGateway gateway;
    private final AgentSettingsCache settingsCache;
    private final PromptCatalog promptCatalog;

    public ResponseGenerator(LanguageModelGateway gateway, AgentSettingsCache settingsCache, PromptCatalog promptCatalog) {
        this.gateway = gateway;
        this.settingsCache = settingsCache;
        this.promptCatalog = promptCatalog;
    }

    @Override
    public StateUpdate apply(PipelineState state) {
        try {
            AgentSettings settings = this.settingsCache.current();
            AgentSettings.ModelSettings model = settings.model();
            LlmRequest request = LlmRequest.of(
                    systemPrompt(settings, state.getProvince()),
                    userPrompt(settings, state),
                    new LlmCallOptions(blankToNull(model.model()), model.temperature(), model.maxTokens(),
                            model.topP(), model.frequencyPenalty(), model.presencePenalty()));
            LlmReply reply = this.gateway.complete(request);
            log.info("Response generated: {} chars, {} tokens", reply.text().length(), reply.usage().totalTokens());
            return StateUpdate.builder()
                    .response(reply.text())
                    .tokenUsage(reply.usage())
                    .build();
        } catch (RuntimeException e) {
            log.error("Response generation failed: {}", LogSanitizer.sanitize(e.getMessage()), e);
            return StateUpdate.builder()
                    .response(APOLOGY)
                    .error("Response generation error: " + e.getMessage())
                    .build();
        }
    }

    String systemPrompt(AgentSettings settings, String province) {
        String base = this.promptCatalog.render(PromptCatalog.MAIN_SYSTEM, settings, Map.of());
        if (province == null || province.isBlank()) {
            return base;
        }
        return base + "\n\n" + provinceInstruction(province);
    }

    static String provinceInstruction(String province) {
        String code = Provinces.normalize(province);
        String name = Provinces.displayName(code);
        return "IMPORTANT: You are answering questions about " + name + " (" + code + ") employment standards. "
                + "Only reference laws and regulations that apply to " + name + ". "
                + "Do not mix information from other provinces.";
    }

    String userPrompt(AgentSettings settings, PipelineState state) {
        String context = contextText(state.getContextDocuments(), state.getToolResults());
        String contextSection = context.isEmpty() ? NO_CONTEXT : context;
        String history = historyText(state.getConversationHistory());
        String query = state.getQuery();

        if (this.promptCatalog.isOverridden(PromptCatalog.RETRIEVAL_CONTEXT, settings)) {
            return this.promptCatalog.render(PromptCatalog.RETRIEVAL_CONTEXT, settings, Map.of(
                    "context", contextSection,
                    "query", query,
                    "conversation_history", history.isEmpty() ? NO_HISTORY : history));
        }
        if (!history.isEmpty()) {
            return "Previous conversation:\n" + history
                    + "\n\nKnowledge base context:\n" + contextSection
                    + "\n\nCurrent user question: " + query
                    + "\n\nPlease provide a comprehensive answer based on the conversation history and context above.";
        }
        return "Context information:\n" + contextSection
                + "\n\nUser question: " + query
                + "\n\nPlease provide a comprehensive answer based on the context above.";
    }

    static String contextText(List<ContextPassage> passages, List<ToolResult> toolResults) {
        List<String> blocks = new ArrayList<>();
        for (ContextPassage passage : passages) {
            String source = passage.source() == null ? "unknown" : passage.source();
            blocks.add("Source: " + source + "\n" + passage.content());
        }
        for (ToolResult result : toolResults) {
            blocks.add("Source: tool:" + result.toolName() + "\n" + result.result());
        }
        return String.join("\n\n", blocks);
    }

    static String historyText(List<ConversationMessage> history) {
        List<String> lines = new ArrayList<>();
        for (ConversationMessage message : history) {
            lines.add((message.isUser() ? "User: " : "Assistant: ") + message.content());
        }
        return String.join("\n", lines);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
