package com.jreinhal.hragent.model;

/**
 * One prior turn of the session, as supplied by the caller.
 */
public record ConversationMessage(String role, String content) {

    public static ConversationMessage user(String content) {
        return new ConversationMessage("user", content);
    }

    public static ConversationMessage assistant(String content) {
        return new ConversationMessage("assistant", content);
    }

    public boolean isUser() {
        return "user".equalsIgnoreCase(this.role);
    }
}
