package com.jreinhal.hragent.confidence;

import com.jreinhal.hragent.model.ContextPassage;
import java.util.List;

/**
 * What every strategy scores: the question, the generated answer and the passages behind it,
 * in retriever order.
 */
public record ConfidenceInput(String query, String response, List<ContextPassage> passages) {

    public ConfidenceInput {
        query = query == null ? "" : query;
        response = response == null ? "" : response;
        passages = passages == null ? List.of() : List.copyOf(passages);
    }
}
