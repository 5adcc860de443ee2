package com.jreinhal.hragent.retrieval;

import com.jreinhal.hragent.model.ContextPassage;
import java.util.List;

/**
 * Ranked passage lookup over the knowledge base. The query is embedded by the implementation.
 */
public interface ContextRetriever {

    /**
     * Passages ordered by descending similarity. Backend failures surface as runtime exceptions;
     * the retrieval stage turns them into an empty context and a recorded error.
     */
    List<ContextPassage> retrieve(RetrievalRequest request);
}
