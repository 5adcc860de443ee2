package com.jreinhal.hragent.gateway;

import com.jreinhal.hragent.model.TokenUsage;

public record LlmReply(String text, TokenUsage usage) {

    public LlmReply {
        text = text == null ? "" : text;
        usage = usage == null ? TokenUsage.NONE : usage;
    }
}
