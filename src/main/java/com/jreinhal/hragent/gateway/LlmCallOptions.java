package com.jreinhal.hragent.gateway;

/**
 * Per-call generation parameters. {@code null} fields fall back to the chat model's defaults.
 */
public record LlmCallOptions(String model, Double temperature, Integer maxTokens, Double topP,
                             Double frequencyPenalty, Double presencePenalty) {

    public static LlmCallOptions of(String model, double temperature, int maxTokens) {
        return new LlmCallOptions(blankToNull(model), temperature, maxTokens, null, null, null);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
