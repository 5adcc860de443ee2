package com.jreinhal.hragent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.ai.vectorstore.SimpleVectorStore;
import org.springframework.ai.vectorstore.VectorStore;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;

@SpringBootApplication
public class HrAgentApplication {
    private static final Logger log = LoggerFactory.getLogger(HrAgentApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(HrAgentApplication.class, args);
    }

    /**
     * In-memory store used when no other {@link VectorStore} is configured. Deployments that
     * index the employment-standards corpus elsewhere supply their own bean.
     */
    @Bean
    @ConditionalOnMissingBean(VectorStore.class)
    public VectorStore vectorStore(EmbeddingModel embeddingModel) {
        log.info("Using SimpleVectorStore (no external vector store configured).");
        return SimpleVectorStore.builder(embeddingModel).build();
    }
}
