package com.adlanda.docretrieval.service;

import com.adlanda.docretrieval.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.Embedding;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.ai.embedding.EmbeddingResponse;

import java.util.Comparator;
import java.util.List;

/**
 * Embedding provider backed by a Spring AI {@link EmbeddingModel}.
 *
 * Each {@link #encode(List)} is a single batch request. The OpenAI embedding
 * models return unit-length vectors, so squared Euclidean distance ranks the
 * same way cosine similarity would.
 */
public class SpringAiEmbeddingProvider implements EmbeddingProvider {

    private static final Logger log = LoggerFactory.getLogger(SpringAiEmbeddingProvider.class);

    private final EmbeddingModel embeddingModel;
    private final int dimensions;

    /**
     * @param embeddingModel       The model to call
     * @param configuredDimensions Dimension to use, or {@code null} to ask the model once
     */
    public SpringAiEmbeddingProvider(EmbeddingModel embeddingModel, Integer configuredDimensions) {
        this.embeddingModel = embeddingModel;
        this.dimensions = configuredDimensions != null
                ? configuredDimensions
                : discoverDimensions(embeddingModel);
        log.info("Embedding provider using {} ({} dimensions)",
                embeddingModel.getClass().getSimpleName(), dimensions);
    }

    @Override
    public List<float[]> encode(List<String> texts) {
        if (texts.isEmpty()) {
            return List.of();
        }
        log.debug("Requesting embeddings for {} texts", texts.size());
        EmbeddingResponse response = embeddingModel.embedForResponse(texts);
        return response.getResults().stream()
                .sorted(Comparator.comparingInt(Embedding::getIndex))
                .map(Embedding::getOutput)
                .toList();
    }

    @Override
    public int dimensions() {
        return dimensions;
    }

    private static int discoverDimensions(EmbeddingModel embeddingModel) {
        try {
            return embeddingModel.dimensions();
        } catch (RuntimeException e) {
            throw new ConfigurationException("Could not determine embedding dimension: " + e.getMessage(), e);
        }
    }
}
