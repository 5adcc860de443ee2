package com.jreinhal.hragent.prompt;

import java.util.Map;

/**
 * Prompt text with {@code {name}} placeholders.
 *
 * <p>Only the supplied names are substituted; any other braces (for example JSON examples
 * inside a prompt) are left as written.</p>
 */
public final class PromptTemplate {

    private final String text;

    public PromptTemplate(String text) {
        this.text = text == null ? "" : text;
    }

    public String render(Map<String, String> variables) {
        String result = this.text;
        if (variables == null) {
            return result;
        }
        for (Map.Entry<String, String> entry : variables.entrySet()) {
            String value = entry.getValue() == null ? "" : entry.getValue();
            result = result.replace("{" + entry.getKey() + "}", value);
        }
        return result;
    }

    public String getText() {
        return this.text;
    }
}
