package com.jreinhal.hragent.service;

import com.jreinhal.hragent.model.ConversationMessage;
import java.util.List;

/**
 * A question for the agent.
 *
 * @param province            two-letter province code scoping retrieval and generation, may be {@code null}
 * @param conversationHistory earlier turns of the session, oldest first
 */
public record AgentRequest(String query, String province, List<ConversationMessage> conversationHistory,
                           String sessionId, String userId) {

    public AgentRequest {
        conversationHistory = conversationHistory == null ? List.of() : List.copyOf(conversationHistory);
    }

    public static AgentRequest of(String query, String province) {
        return new AgentRequest(query, province, List.of(), null, null);
    }
}
