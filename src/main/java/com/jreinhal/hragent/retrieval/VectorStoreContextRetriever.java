package com.jreinhal.hragent.retrieval;

import com.jreinhal.hragent.constant.MetadataConstants;
import com.jreinhal.hragent.model.ContextPassage;
import com.jreinhal.hragent.util.LogSanitizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.document.Document;
import org.springframework.ai.vectorstore.SearchRequest;
import org.springframework.ai.vectorstore.VectorStore;
import org.springframework.stereotype.Component;

/**
 * {@link ContextRetriever} over a Spring AI {@link VectorStore}; the store embeds the query with its
 * own {@code EmbeddingModel}.
 */
@Component
public class VectorStoreContextRetriever implements ContextRetriever {

    private static final Logger log = LoggerFactory.getLogger(VectorStoreContextRetriever.class);

    private final VectorStore vectorStore;

    public VectorStoreContextRetriever(VectorStore vectorStore) {
        this.vectorStore = vectorStore;
    }

    @Override
    public List<ContextPassage> retrieve(RetrievalRequest request) {
        SearchRequest.Builder search = SearchRequest.builder()
                .query(request.query())
                .topK(request.limit())
                .similarityThreshold(request.similarityThreshold());
        String filter = ProvinceFilterExpression.forProvince(request.province());
        if (filter != null) {
            search.filterExpression(filter);
        } else {
            log.warn("No province on request {}; searching all jurisdictions", LogSanitizer.querySummary(request.query()));
        }

        List<Document> documents = this.vectorStore.similaritySearch(search.build());
        if (documents == null || documents.isEmpty()) {
            return List.of();
        }
        List<ContextPassage> passages = new ArrayList<>(documents.size());
        for (Document document : documents) {
            passages.add(toPassage(document));
        }
        return passages;
    }

    static ContextPassage toPassage(Document document) {
        Map<String, Object> meta = document.getMetadata();
        return new ContextPassage(
                document.getId(),
                document.getText(),
                stringValue(meta, MetadataConstants.SOURCE_KEY, "unknown"),
                similarityOf(document),
                stringValue(meta, MetadataConstants.TITLE_KEY, null),
                stringValue(meta, MetadataConstants.DOCUMENT_TITLE_KEY, null),
                stringValue(meta, MetadataConstants.DOCUMENT_FILENAME_KEY, null),
                stringValue(meta, MetadataConstants.TIMESTAMP_KEY,
                        stringValue(meta, MetadataConstants.CREATED_AT_KEY, null)),
                meta);
    }

    private static double similarityOf(Document document) {
        Double score = document.getScore();
        if (score == null) {
            Object distance = document.getMetadata().get(MetadataConstants.DISTANCE_KEY);
            score = distance instanceof Number ? 1.0 - ((Number) distance).doubleValue() : 0.0;
        }
        return Math.max(0.0, Math.min(1.0, score));
    }

    private static String stringValue(Map<String, Object> meta, String key, String fallback) {
        Object value = meta == null ? null : meta.get(key);
        if (value == null) {
            return fallback;
        }
        String text = value.toString();
        return text.isBlank() ? fallback : text;
    }
}
