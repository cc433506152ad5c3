package com.adlanda.docretrieval.chunking;

import com.adlanda.docretrieval.model.TextChunk;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Splits text into overlapping windows measured in tokens.
 *
 * A window of {@code chunkSize} tokens walks over the token sequence and
 * advances by {@code chunkSize - chunkOverlap} each step. Every window is
 * decoded back into one chunk, in document order. The final chunk may be
 * shorter than {@code chunkSize}.
 *
 * Stateless apart from the tokenizer, so a single instance can be shared.
 */
public class TokenChunker {

    private static final Logger log = LoggerFactory.getLogger(TokenChunker.class);

    private final Tokenizer tokenizer;

    public TokenChunker(Tokenizer tokenizer) {
        this.tokenizer = tokenizer;
    }

    /**
     * Splits text into chunk strings.
     *
     * @param text         The text to split
     * @param chunkSize    Maximum tokens per chunk, must be positive
     * @param chunkOverlap Tokens shared by consecutive chunks, must not be negative
     * @return Chunk texts in document order, empty for blank input
     */
    public List<String> chunk(String text, int chunkSize, int chunkOverlap) {
        return chunkWithCounts(text, chunkSize, chunkOverlap).stream()
                .map(TextChunk::text)
                .toList();
    }

    /**
     * Same as {@link #chunk(String, int, int)} but keeps the token count of each window.
     */
    public List<TextChunk> chunkWithCounts(String text, int chunkSize, int chunkOverlap) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive, was " + chunkSize);
        }
        if (chunkOverlap < 0) {
            throw new IllegalArgumentException("chunkOverlap must not be negative, was " + chunkOverlap);
        }
        if (isBlank(text)) {
            return List.of();
        }

        int[] tokens = tokenizer.encode(text);
        if (tokens.length == 0) {
            return List.of();
        }

        int stride = chunkSize - chunkOverlap;
        if (stride <= 0) {
            log.warn("chunkOverlap {} >= chunkSize {}; advancing by half a window instead", chunkOverlap, chunkSize);
        }

        List<TextChunk> chunks = new ArrayList<>();
        int start = 0;
        while (start < tokens.length) {
            int end = Math.min(start + chunkSize, tokens.length);
            int[] window = Arrays.copyOfRange(tokens, start, end);
            chunks.add(new TextChunk(tokenizer.decode(window), window.length));

            if (end == tokens.length) {
                break;
            }

            int next;
            if (stride > 0) {
                next = start + stride;
            } else {
                next = end - chunkSize / 2;
            }
            if (next <= start) {
                log.warn("Chunk window did not advance at token {}; stopping", start);
                break;
            }
            start = next;
        }
        return chunks;
    }

    /**
     * True when the text is null or holds only whitespace, counting Unicode
     * space separators such as no-break space, which {@link String#isBlank()} does not.
     */
    public static boolean isBlank(String text) {
        if (text == null) {
            return true;
        }
        return text.codePoints().allMatch(cp -> Character.isWhitespace(cp) || Character.isSpaceChar(cp));
    }
}
