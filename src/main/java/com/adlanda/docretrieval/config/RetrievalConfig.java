package com.adlanda.docretrieval.config;

import com.adlanda.docretrieval.chunking.JTokkitTokenizer;
import com.adlanda.docretrieval.chunking.TokenChunker;
import com.adlanda.docretrieval.chunking.Tokenizer;
import com.adlanda.docretrieval.repository.RetrievalStore;
import com.adlanda.docretrieval.service.EmbeddingProvider;
import com.adlanda.docretrieval.service.SpringAiEmbeddingProvider;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the shared retrieval components once at startup.
 */
@Configuration
public class RetrievalConfig {

    @Bean
    public Tokenizer tokenizer(RetrievalProperties properties) {
        return new JTokkitTokenizer(properties.getTokenizerEncoding());
    }

    @Bean
    public TokenChunker tokenChunker(Tokenizer tokenizer) {
        return new TokenChunker(tokenizer);
    }

    @Bean
    public EmbeddingProvider embeddingProvider(EmbeddingModel embeddingModel, RetrievalProperties properties) {
        return new SpringAiEmbeddingProvider(embeddingModel, properties.getEmbedding().getDimensions());
    }

    @Bean
    public RetrievalStore retrievalStore(EmbeddingProvider embeddingProvider) {
        return new RetrievalStore(embeddingProvider);
    }
}
