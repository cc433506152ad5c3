package com.adlanda.docretrieval.model;

/**
 * Outcome of adding a batch of chunks.
 *
 * @param chunksAdded  Number of chunks inserted by this call
 * @param totalVectors Vectors in the store after the call
 */
public record AddResult(int chunksAdded, int totalVectors) {}
