package com.adlanda.docretrieval.service;

import com.adlanda.docretrieval.config.RetrievalProperties;
import com.adlanda.docretrieval.model.QueryResponse;
import com.adlanda.docretrieval.model.SearchHit;
import com.adlanda.docretrieval.repository.RetrievalStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Service responsible for retrieving relevant chunks for a question.
 */
@Service
public class RetrievalService {

    private static final Logger log = LoggerFactory.getLogger(RetrievalService.class);

    private final RetrievalStore retrievalStore;
    private final RetrievalProperties properties;

    public RetrievalService(RetrievalStore retrievalStore, RetrievalProperties properties) {
        this.retrievalStore = retrievalStore;
        this.properties = properties;
    }

    /**
     * Queries the store for the chunks closest to the question.
     *
     * @param question   The question to search for
     * @param maxResults Maximum number of results, or {@code null} for the configured default
     * @return QueryResponse containing the matched chunks and index size
     */
    public QueryResponse query(String question, Integer maxResults) {
        long startTime = System.currentTimeMillis();
        int k = maxResults != null ? maxResults : properties.getMaxContextChunks();

        List<SearchHit> results = retrievalStore.search(question, k);

        long queryTimeMs = System.currentTimeMillis() - startTime;
        log.debug("Query returned {} results in {}ms", results.size(), queryTimeMs);

        return new QueryResponse(results, retrievalStore.totalVectors(), queryTimeMs);
    }

    /**
     * Returns the number of vectors in the store.
     */
    public int getIndexSize() {
        return retrievalStore.totalVectors();
    }

    public List<String> getDocumentNames() {
        return retrievalStore.documentNames();
    }
}
