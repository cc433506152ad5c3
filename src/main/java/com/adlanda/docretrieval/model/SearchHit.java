package com.adlanda.docretrieval.model;

/**
 * A single ranked search result.
 *
 * @param documentName Name of the source document
 * @param chunkNumber  Chunk number within that document
 * @param text         The chunk's text
 * @param score        Squared Euclidean distance to the query (lower is more similar)
 */
public record SearchHit(
        String documentName,
        int chunkNumber,
        String text,
        double score
) {
    public static SearchHit from(ChunkMetadata metadata, double score) {
        return new SearchHit(metadata.documentName(), metadata.chunkNumber(), metadata.text(), score);
    }
}
