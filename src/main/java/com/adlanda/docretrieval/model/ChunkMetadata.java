package com.adlanda.docretrieval.model;

/**
 * Metadata kept for every indexed vector.
 *
 * @param id           Vector identifier, equal to its offset in the index
 * @param documentName Name of the source document
 * @param chunkNumber  Position of the chunk within all uploads of that document name
 * @param text         The chunk's text
 */
public record ChunkMetadata(
        int id,
        String documentName,
        int chunkNumber,
        String text
) {}
