package com.adlanda.docretrieval.model;

import java.util.List;

/**
 * Response from the query endpoint.
 *
 * @param results      Matched chunks, closest first
 * @param totalVectors Total number of vectors in the store
 * @param queryTimeMs  Time taken to process the query in milliseconds
 */
public record QueryResponse(
        List<SearchHit> results,
        int totalVectors,
        long queryTimeMs
) {}
