package com.adlanda.docretrieval.service;

import java.util.List;

/**
 * Turns texts into fixed-dimension vectors.
 *
 * Implementations must return one vector per input, in input order, each
 * {@link #dimensions()} wide. Vectors are compared with squared Euclidean
 * distance, so providers should document whether they normalise their output.
 */
public interface EmbeddingProvider {

    /**
     * Embeds a batch of texts in one call.
     *
     * @param texts Texts to embed
     * @return One vector per text, same order
     */
    List<float[]> encode(List<String> texts);

    /**
     * Width of every vector returned by {@link #encode(List)}.
     */
    int dimensions();
}
