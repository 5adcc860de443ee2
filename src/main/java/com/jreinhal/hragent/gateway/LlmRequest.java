package com.jreinhal.hragent.gateway;

import java.time.Duration;

/**
 * One request to the language model.
 *
 * @param timeout optional bound on the call; {@code null} waits until the model answers or the caller is interrupted
 */
public record LlmRequest(String systemPrompt, String userPrompt, LlmCallOptions options, Duration timeout) {

    public static LlmRequest of(String systemPrompt, String userPrompt, LlmCallOptions options) {
        return new LlmRequest(systemPrompt, userPrompt, options, null);
    }

    public LlmRequest withTimeout(Duration timeout) {
        return new LlmRequest(systemPrompt, userPrompt, options, timeout);
    }
}
