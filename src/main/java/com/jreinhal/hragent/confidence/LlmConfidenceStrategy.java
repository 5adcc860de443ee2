package com.jreinhal.hragent.confidence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jreinhal.hragent.gateway.LanguageModelGateway;
import com.jreinhal.hragent.gateway.LanguageModelTimeoutException;
import com.jreinhal.hragent.gateway.LlmCallOptions;
import com.jreinhal.hragent.gateway.LlmReply;
import com.jreinhal.hragent.gateway.LlmRequest;
import com.jreinhal.hragent.model.ContextPassage;
import com.jreinhal.hragent.prompt.PromptCatalog;
import com.jreinhal.hragent.settings.AgentSettings;
import com.jreinhal.hragent.util.LogSanitizer;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Asks the language model to rate the answer, with a bounded timeout.
 *
 * <p>The reply may be a bare number or a JSON object with {@code confidence_score}; either is
 * clamped to [0,1]. A timeout, an unparsable reply or any other failure returns the formula
 * result instead, so callers see the method change rather than an exception.</p>
 */
@Component
public class LlmConfidenceStrategy implements ConfidenceStrategy {

    private static final Logger log = LoggerFactory.getLogger(LlmConfidenceStrategy.class);

    static final String SYSTEM_PROMPT = "You are a confidence evaluator. Respond with ONLY a number between 0.0 and 1.0.";
    static final int CONTEXT_PASSAGES = 3;
    static final int CONTEXT_CHARS = 1000;
    static final int QUERY_CHARS = 500;
    static final int RESPONSE_CHARS = 500;

    private final LanguageModelGateway gateway;
    private final PromptCatalog promptCatalog;
    private final FormulaConfidenceStrategy formula;
    private final ObjectMapper objectMapper;

    public LlmConfidenceStrategy(LanguageModelGateway gateway, PromptCatalog promptCatalog,
                                 FormulaConfidenceStrategy formula, ObjectMapper objectMapper) {
        this.gateway = gateway;
        this.promptCatalog = promptCatalog;
        this.formula = formula;
        this.objectMapper = objectMapper;
    }

    @Override
    public ConfidenceResult score(ConfidenceInput input, AgentSettings settings) {
        AgentSettings.LlmJudgeSettings llm = settings.confidence().llm();
        String model = llm.model() == null || llm.model().isBlank() ? settings.model().model() : llm.model();
        LlmReply reply;
        try {
            String prompt = this.promptCatalog.render(PromptCatalog.CONFIDENCE_EVALUATION, settings, Map.of(
                    "query", truncate(input.query(), QUERY_CHARS),
                    "context", contextText(input),
                    "response", truncate(input.response(), RESPONSE_CHARS)));
            LlmRequest request = LlmRequest.of(SYSTEM_PROMPT, prompt, LlmCallOptions.of(model, llm.temperature(), llm.maxTokens()))
                    .withTimeout(Duration.ofMillis(llm.timeoutMs()));
            reply = this.gateway.complete(request);
        } catch (LanguageModelTimeoutException e) {
            log.warn("LLM confidence evaluation timed out after {}ms, falling back to formula", llm.timeoutMs());
            return this.formula.score(input, settings);
        } catch (RuntimeException e) {
            log.error("LLM confidence calculation failed: {}", LogSanitizer.sanitize(e.getMessage()), e);
            log.info("Falling back to formula confidence due to error");
            return this.formula.score(input, settings);
        }

        String content = reply.text().trim();
        double confidence;
        try {
            confidence = parseScore(content);
        } catch (IllegalArgumentException e) {
            log.warn("Failed to parse LLM confidence score: '{}', error: {}",
                    LogSanitizer.preview(content, 100), e.getMessage());
            log.info("Falling back to formula confidence due to parse error");
            ConfidenceResult fallback = this.formula.score(input, settings);
            return new ConfidenceResult(fallback.score(), fallback.method(), fallback.breakdown(), reply.usage());
        }

        log.info("LLM confidence: {} ({}, raw='{}')", String.format(Locale.ROOT, "%.3f", confidence),
                model, LogSanitizer.preview(content, 50));
        Map<String, Object> breakdown = new LinkedHashMap<>();
        breakdown.put("llm_model", model);
        breakdown.put("llm_raw_response", content);
        return new ConfidenceResult(confidence, ConfidenceMethod.LLM, breakdown, reply.usage());
    }

    /**
     * @throws IllegalArgumentException when the reply is neither a number nor a JSON object with a numeric score
     */
    double parseScore(String content) {
        double value;
        if (content.startsWith("{")) {
            JsonNode root;
            try {
                root = this.objectMapper.readTree(content);
            } catch (JsonProcessingException e) {
                throw new IllegalArgumentException("invalid JSON: " + e.getOriginalMessage(), e);
            }
            JsonNode score = root.get("confidence_score");
            if (score == null || score.isNull()) {
                value = 0.0;
            } else if (score.isNumber()) {
                value = score.asDouble();
            } else {
                value = parseNumber(score.asText());
            }
        } else {
            value = parseNumber(content);
        }
        if (Double.isNaN(value)) {
            throw new IllegalArgumentException("score is NaN");
        }
        return Math.max(0.0, Math.min(1.0, value));
    }

    private static double parseNumber(String text) {
        try {
            return Double.parseDouble(text.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("not a number", e);
        }
    }

    static String contextText(ConfidenceInput input) {
        String joined = input.passages().stream()
                .limit(CONTEXT_PASSAGES)
                .map(ContextPassage::content)
                .collect(Collectors.joining("\n\n"));
        return truncate(joined, CONTEXT_CHARS);
    }

    private static String truncate(String value, int max) {
        return value.length() <= max ? value : value.substring(0, max);
    }
}
