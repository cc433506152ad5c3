package com.adlanda.docretrieval.repository;

import java.util.Comparator;
import java.util.List;

/**
 * Stores fixed-dimension vectors under dense, insertion-ordered identifiers
 * and answers nearest-neighbour queries.
 *
 * Implementations are not required to be thread-safe; {@link RetrievalStore}
 * serialises access.
 */
public interface VectorIndex {

    /**
     * Appends vectors to the index.
     *
     * @param vectors Vectors in insertion order, each of {@link #dimensions()} width
     * @return The assigned ids, {@code count() .. count() + vectors.size() - 1}
     */
    List<Integer> add(List<float[]> vectors);

    /**
     * Finds the vectors nearest to the query.
     *
     * @param query Query vector of {@link #dimensions()} width
     * @param k     Maximum number of hits
     * @return Hits ordered by ascending distance, ties by ascending id
     */
    List<IndexHit> search(float[] query, int k);

    /**
     * Drops all vectors; the next assigned id is 0 again.
     */
    void reset();

    int count();

    int dimensions();

    /**
     * An id and its distance to the query.
     */
    record IndexHit(int id, double distance) {

        static final Comparator<IndexHit> RANKING =
                Comparator.comparingDouble(IndexHit::distance).thenComparingInt(IndexHit::id);
    }
}
