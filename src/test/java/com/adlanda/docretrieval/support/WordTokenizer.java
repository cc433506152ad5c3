package com.adlanda.docretrieval.support;

import com.adlanda.docretrieval.chunking.Tokenizer;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Whitespace tokenizer with an exact round trip for single-spaced text.
 * One token per word, so windows are easy to reason about in tests.
 */
public class WordTokenizer implements Tokenizer {

    private final List<String> words = new ArrayList<>();
    private final Map<String, Integer> ids = new HashMap<>();

    @Override
    public synchronized int[] encode(String text) {
        String stripped = text.strip();
        if (stripped.isEmpty()) {
            return new int[0];
        }
        String[] parts = stripped.split("\\s+");
        int[] tokens = new int[parts.length];
        for (int i = 0; i < parts.length; i++) {
            tokens[i] = ids.computeIfAbsent(parts[i], word -> {
                words.add(word);
                return words.size() - 1;
            });
        }
        return tokens;
    }

    @Override
    public synchronized String decode(int[] tokens) {
        List<String> parts = new ArrayList<>(tokens.length);
        for (int token : tokens) {
            parts.add(words.get(token));
        }
        return String.join(" ", parts);
    }

    /**
     * Builds {@code "w0 w1 ... w(n-1)"}.
     */
    public static String words(int n) {
        List<String> parts = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            parts.add("w" + i);
        }
        return String.join(" ", parts);
    }
}
