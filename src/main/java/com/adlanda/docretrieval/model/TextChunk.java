package com.adlanda.docretrieval.model;

/**
 * A window of tokens rendered back to text.
 *
 * @param text       The decoded text of the window
 * @param tokenCount Number of tokens in the window
 */
public record TextChunk(String text, int tokenCount) {
}
