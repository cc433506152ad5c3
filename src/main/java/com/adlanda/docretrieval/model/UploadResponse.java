package com.adlanda.docretrieval.model;

/**
 * Response from the upload endpoint.
 *
 * @param filename     Name the document was indexed under
 * @param message      Human readable outcome
 * @param chunksAdded  Chunks added by this upload
 * @param totalVectors Vectors in the store after the upload
 */
public record UploadResponse(
        String filename,
        String message,
        int chunksAdded,
        int totalVectors
) {}
