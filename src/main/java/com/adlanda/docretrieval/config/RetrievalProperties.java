package com.adlanda.docretrieval.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for chunking, retrieval and embedding.
 *
 * Maps to properties prefixed with 'retrieval' in application.properties.
 */
@Component
@ConfigurationProperties(prefix = "retrieval")
public class RetrievalProperties {

    /**
     * Maximum number of tokens per chunk.
     */
    private int chunkSize = 500;

    /**
     * Number of tokens shared by consecutive chunks.
     */
    private int chunkOverlap = 50;

    /**
     * Default number of chunks returned by a query.
     */
    private int maxContextChunks = 5;

    /**
     * JTokkit encoding used to measure chunks.
     */
    private String tokenizerEncoding = "cl100k_base";

    private final Embedding embedding = new Embedding();

    public int getChunkSize() {
        return chunkSize;
    }

    public void setChunkSize(int chunkSize) {
        this.chunkSize = chunkSize;
    }

    public int getChunkOverlap() {
        return chunkOverlap;
    }

    public void setChunkOverlap(int chunkOverlap) {
        this.chunkOverlap = chunkOverlap;
    }

    public int getMaxContextChunks() {
        return maxContextChunks;
    }

    public void setMaxContextChunks(int maxContextChunks) {
        this.maxContextChunks = maxContextChunks;
    }

    public String getTokenizerEncoding() {
        return tokenizerEncoding;
    }

    public void setTokenizerEncoding(String tokenizerEncoding) {
        this.tokenizerEncoding = tokenizerEncoding;
    }

    public Embedding getEmbedding() {
        return embedding;
    }

    public static class Embedding {

        /**
         * Fixed embedding dimension. When unset, the model is asked once at startup.
         */
        private Integer dimensions;

        public Integer getDimensions() {
            return dimensions;
        }

        public void setDimensions(Integer dimensions) {
            this.dimensions = dimensions;
        }
    }
}
