package com.adlanda.docretrieval.chunking;

/**
 * Converts text to tokens and back.
 *
 * The round trip is allowed to be lossy: {@code decode(encode(text))} need not
 * be byte-identical to {@code text}.
 */
public interface Tokenizer {

    int[] encode(String text);

    String decode(int[] tokens);
}
