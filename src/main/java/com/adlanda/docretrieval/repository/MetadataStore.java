package com.adlanda.docretrieval.repository;

import com.adlanda.docretrieval.model.ChunkMetadata;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Per-vector metadata plus the per-document chunk number counters.
 *
 * Entries are addressed by vector id, which is dense from 0, so they live in a
 * list where the id is the position. Not thread-safe on its own.
 */
public class MetadataStore {

    private final List<ChunkMetadata> entries = new ArrayList<>();
    private final Map<String, Integer> nextChunkNumber = new LinkedHashMap<>();

    /**
     * Reserves a block of chunk numbers for a document.
     *
     * @return The first number of the block
     */
    public int reserve(String documentName, int count) {
        if (count < 0) {
            throw new IllegalArgumentException("count must not be negative, was " + count);
        }
        int start = nextChunkNumber.getOrDefault(documentName, 0);
        nextChunkNumber.put(documentName, start + count);
        return start;
    }

    /**
     * Records metadata for one id. Ids must arrive in order and are never overwritten.
     */
    public void record(int id, String documentName, int chunkNumber, String text) {
        if (id < entries.size()) {
            throw new IllegalStateException("Metadata for id " + id + " already recorded");
        }
        if (id > entries.size()) {
            throw new IllegalStateException("Metadata id " + id + " skips ahead of " + entries.size());
        }
        entries.add(new ChunkMetadata(id, documentName, chunkNumber, text));
    }

    public Optional<ChunkMetadata> get(int id) {
        if (id < 0 || id >= entries.size()) {
            return Optional.empty();
        }
        return Optional.of(entries.get(id));
    }

    public int size() {
        return entries.size();
    }

    /**
     * Document names seen since the last reset, in first-seen order.
     */
    public List<String> documentNames() {
        return List.copyOf(nextChunkNumber.keySet());
    }

    public void reset() {
        entries.clear();
        nextChunkNumber.clear();
    }
}
